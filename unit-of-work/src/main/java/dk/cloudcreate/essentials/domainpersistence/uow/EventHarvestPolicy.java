package dk.cloudcreate.essentials.domainpersistence.uow;

/**
 * Controls whether {@link UnitOfWork#collectNewEvents()} yields the events raised by the aggregates touched in
 * a {@link UnitOfWork} that wasn't committed
 */
public enum EventHarvestPolicy {
    /**
     * Events are harvested regardless of the outcome of the {@link UnitOfWork}.<br>
     * Callers that forward the events must themselves check {@link UnitOfWork#status()}
     */
    ALWAYS,
    /**
     * Events are only harvested after the {@link UnitOfWork} has been committed. Before that (or after a rollback)
     * {@link UnitOfWork#collectNewEvents()} yields nothing and leaves the aggregates' pending events untouched
     */
    COMMITTED_ONLY
}
