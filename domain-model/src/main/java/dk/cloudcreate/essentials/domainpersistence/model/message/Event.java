package dk.cloudcreate.essentials.domainpersistence.model.message;

import dk.cloudcreate.essentials.domainpersistence.model.AggregateRoot;

import java.util.UUID;

/**
 * A fact about something that already happened, raised by an {@link AggregateRoot}
 *
 * @see AbstractEvent
 */
public interface Event extends Message {
    /**
     * The id of the aggregate root that raised this event
     */
    UUID raisedBy();
}
