package dk.cloudcreate.essentials.domainpersistence.common.transaction;

/**
 * Opens new {@link StorageSession}'s
 *
 * @param <SESSION> the concrete session type
 */
@FunctionalInterface
public interface StorageSessionFactory<SESSION extends StorageSession> {
    /**
     * Open a new session. The transaction isn't begun until {@link StorageSession#begin()} is called
     *
     * @return the new session
     */
    SESSION openSession();
}
