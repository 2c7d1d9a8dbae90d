package dk.cloudcreate.essentials.domainpersistence.uow;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.StorageSession;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A named and typed repository declaration. Every {@link UnitOfWork} gets its own instance of the repository
 * declared by each slot registered with the {@link UnitOfWorkFactory}:
 * <pre>{@code
 * public static final RepositorySlot<JdbiStorageSession, OrderRepository> ORDERS = RepositorySlot.of("orders", OrderRepository.class, OrderRepository::new);
 *
 * unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
 *     var order = unitOfWork.repository(ORDERS).load(orderId);
 *     order.addProduct(productId, 2);
 *     unitOfWork.commit();
 * });
 * }</pre>
 *
 * @param <SESSION> the storage session type
 * @param <R>       the repository type
 */
public final class RepositorySlot<SESSION extends StorageSession, R extends Repository> {
    public final String                        name;
    public final Class<R>                      repositoryType;
    public final RepositoryFactory<SESSION, R> factory;

    private RepositorySlot(String name, Class<R> repositoryType, RepositoryFactory<SESSION, R> factory) {
        this.name = requireNonNull(name, "No name provided");
        requireTrue(!name.isBlank(), "The slot name must not be blank");
        this.repositoryType = requireNonNull(repositoryType, "No repositoryType provided");
        this.factory = requireNonNull(factory, "No factory provided");
    }

    public static <SESSION extends StorageSession, R extends Repository> RepositorySlot<SESSION, R> of(String name,
                                                                                                      Class<R> repositoryType,
                                                                                                      RepositoryFactory<SESSION, R> factory) {
        return new RepositorySlot<>(name, repositoryType, factory);
    }

    R createRepository(SESSION session) {
        var repository = factory.create(session);
        if (!repositoryType.isInstance(repository)) {
            throw new IllegalStateException(msg("The factory for repository slot '{}' returned '{}' and not an instance of '{}'",
                                                name,
                                                repository,
                                                repositoryType.getName()));
        }
        return repository;
    }

    @Override
    public String toString() {
        return "RepositorySlot{" +
                "name='" + name + '\'' +
                ", repositoryType=" + repositoryType.getName() +
                '}';
    }
}
