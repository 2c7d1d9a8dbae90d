package dk.cloudcreate.essentials.domainpersistence.common.transaction;

/**
 * A single storage transaction. One session backs exactly one UnitOfWork and must never
 * be shared across UnitOfWork instances or threads.
 */
public interface StorageSession {
    /**
     * Begin the underlying transaction
     */
    void begin();

    /**
     * Commit the underlying transaction
     *
     * @throws ConcurrencyConflictException if the storage detected a conflicting concurrent update
     */
    void commit();

    /**
     * Roll back the underlying transaction
     */
    void rollback();

    /**
     * Release the session and any resources (e.g. connections) it holds.
     * Closing an already closed session is a no-op
     */
    void close();

    /**
     * @return true if a transaction has been begun and hasn't yet been committed or rolled back
     */
    boolean isActive();
}
