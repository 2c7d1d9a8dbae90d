package dk.cloudcreate.essentials.domainpersistence.uow;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.StorageSession;

/**
 * Creates the {@link Repository} for a {@link RepositorySlot} when a {@link UnitOfWork} is started
 *
 * @param <SESSION> the storage session type
 * @param <R>       the repository type
 */
@FunctionalInterface
public interface RepositoryFactory<SESSION extends StorageSession, R extends Repository> {
    R create(SESSION session);
}
