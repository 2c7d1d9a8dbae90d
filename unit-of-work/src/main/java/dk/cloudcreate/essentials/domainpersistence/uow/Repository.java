package dk.cloudcreate.essentials.domainpersistence.uow;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.ConcurrencyConflictException;
import dk.cloudcreate.essentials.domainpersistence.model.AggregateRoot;

import java.util.Collection;

/**
 * A repository bound to the storage session of a single {@link UnitOfWork}.<br>
 * The repository keeps track of every aggregate it has loaded or added, so the {@link UnitOfWork} can
 * harvest their events and the repository can flush their changes when the {@link UnitOfWork} commits.
 */
public interface Repository {
    /**
     * The aggregates loaded or added through this repository, in the order they were first touched.
     * The same instance must not appear twice
     */
    Collection<? extends AggregateRoot<?>> touchedAggregates();

    /**
     * Called before the storage transaction is committed.<br>
     * This is where a repository writes its changes and verifies that the stored version of every changed
     * aggregate still matches the version it had when it was loaded
     *
     * @throws ConcurrencyConflictException if a version check fails
     */
    default void beforeCommit() {
    }

    /**
     * Called after the storage transaction has been committed. Failures are logged and don't affect the commit
     */
    default void afterCommit() {
    }

    /**
     * Called after the storage transaction has been rolled back
     */
    default void afterRollback() {
    }
}
