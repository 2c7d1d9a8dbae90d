package dk.cloudcreate.essentials.domainpersistence.common.transaction;

/**
 * The status of a UnitOfWork
 */
public enum UnitOfWorkStatus {
    /**
     * The UnitOfWork has just been created, but not yet {@link #Started}
     */
    Ready(false),
    /**
     * The UnitOfWork has been started (i.e. the storage session is open and its transaction has begun)
     */
    Started(false),
    /**
     * The UnitOfWork has been committed
     */
    Committed(true),
    /**
     * The UnitOfWork has been rolled back, either explicitly or because it was closed before being committed
     */
    RolledBack(true),
    /**
     * The UnitOfWork was closed without ever being started
     */
    Closed(true);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
