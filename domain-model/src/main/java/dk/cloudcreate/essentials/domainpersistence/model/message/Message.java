package dk.cloudcreate.essentials.domainpersistence.model.message;

import java.time.Instant;

/**
 * Common interface for all {@link Command}'s and {@link Event}'s.<br>
 * Messages are immutable value objects: two messages of the same type with the same field values are equal
 * and interchangeable.<br>
 * Concrete message types provide a static, validated, <code>create(...)</code> factory method as their construction path.
 */
public interface Message {
    /**
     * When the message was generated
     */
    Instant raisedAt();

    /**
     * Non-negative delivery delay. Interpreted by the dispatcher of the message, not by the domain model
     */
    int delay();
}
