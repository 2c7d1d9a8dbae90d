package dk.cloudcreate.essentials.domainpersistence.common.transaction;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Optimistic concurrency failure detected while committing a UnitOfWork.<br>
 * Either an aggregate's stored version no longer matched the version read when it was loaded, or the
 * underlying database reported a serialization failure for the transaction.<p>
 * The condition is recoverable: the caller can retry the entire UnitOfWork with freshly loaded state.
 * It is never retried internally.
 */
public class ConcurrencyConflictException extends UnitOfWorkException {
    private final Class<?> aggregateType;
    private final Object   aggregateId;
    private final Integer  expectedVersion;

    public ConcurrencyConflictException(Class<?> aggregateType, Object aggregateId, int expectedVersion) {
        super(msg("Optimistic concurrency conflict for '{}' with id '{}': expected stored version {} but it had been changed by another transaction",
                  requireNonNull(aggregateType, "No aggregateType provided").getName(),
                  aggregateId,
                  expectedVersion));
        this.aggregateType = aggregateType;
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.expectedVersion = expectedVersion;
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
        this.aggregateType = null;
        this.aggregateId = null;
        this.expectedVersion = null;
    }

    /**
     * The type of aggregate whose version check failed (empty if the conflict was reported by the database)
     */
    public Optional<Class<?>> aggregateType() {
        return Optional.ofNullable(aggregateType);
    }

    public Optional<Object> aggregateId() {
        return Optional.ofNullable(aggregateId);
    }

    /**
     * The version the aggregate had when it was loaded
     */
    public Optional<Integer> expectedVersion() {
        return Optional.ofNullable(expectedVersion);
    }
}
