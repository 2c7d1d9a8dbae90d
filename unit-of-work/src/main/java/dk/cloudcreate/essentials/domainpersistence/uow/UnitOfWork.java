package dk.cloudcreate.essentials.domainpersistence.uow;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.*;
import dk.cloudcreate.essentials.domainpersistence.model.AggregateRoot;
import dk.cloudcreate.essentials.domainpersistence.model.message.Event;

import java.util.stream.Stream;

/**
 * A single business transaction that spans the repositories declared by {@link RepositorySlot}'s, all bound to
 * one storage session.<br>
 * A {@link UnitOfWork} is never committed implicitly: {@link #commit()} must be called explicitly, and closing a
 * {@link UnitOfWork} that wasn't committed rolls it back:
 * <pre>{@code
 * try (var unitOfWork = unitOfWorkFactory.startUnitOfWork()) {
 *     var order = unitOfWork.repository(ORDERS).load(orderId);
 *     order.addProduct(productId, 2);
 *     unitOfWork.commit();
 * }
 * }</pre>
 * A {@link UnitOfWork} is not thread safe and must only be used by the thread that started it.
 *
 * @param <SESSION> the storage session type
 */
public interface UnitOfWork<SESSION extends StorageSession> extends AutoCloseable {
    /**
     * Open the storage session, begin its transaction and create the repositories of all declared slots
     *
     * @throws UnitOfWorkException if the {@link UnitOfWork} isn't {@link UnitOfWorkStatus#Ready}
     */
    void start();

    /**
     * Get the repository created for the given slot
     *
     * @throws NoActiveUnitOfWorkException if the {@link UnitOfWork} isn't {@link UnitOfWorkStatus#Started}
     * @throws UnitOfWorkException         if the slot isn't one of the slots the {@link UnitOfWork} was created with
     */
    <R extends Repository> R repository(RepositorySlot<SESSION, R> slot);

    /**
     * Get the repository created for the slot with the given name
     *
     * @throws NoActiveUnitOfWorkException if the {@link UnitOfWork} isn't {@link UnitOfWorkStatus#Started}
     * @throws UnitOfWorkException         if there's no slot with that name or its repository isn't a <code>repositoryType</code>
     */
    <R extends Repository> R repository(String slotName, Class<R> repositoryType);

    /**
     * The storage session bound to this {@link UnitOfWork}
     *
     * @throws NoActiveUnitOfWorkException if the {@link UnitOfWork} isn't {@link UnitOfWorkStatus#Started}
     */
    SESSION session();

    /**
     * Let every repository flush its changes and commit the storage transaction.<br>
     * If anything fails the transaction is rolled back and the exception is rethrown unchanged.
     *
     * @throws ConcurrencyConflictException if an aggregate was changed by a concurrent transaction
     * @throws UnitOfWorkException          if the {@link UnitOfWork} isn't {@link UnitOfWorkStatus#Started}
     */
    void commit();

    /**
     * Roll back the storage transaction. Has no effect if the {@link UnitOfWork} is already completed
     *
     * @param cause the cause of the rollback (may be null)
     */
    void rollback(Exception cause);

    default void rollback() {
        rollback(null);
    }

    /**
     * Release the storage session. A {@link UnitOfWork} that is still {@link UnitOfWorkStatus#Started} is
     * rolled back first. Closing more than once has no effect
     */
    @Override
    void close();

    /**
     * Drain the pending events of every aggregate touched through the repositories of this {@link UnitOfWork}.<br>
     * The stream is lazy and can only be consumed once. Aggregates are visited in the order they were first
     * touched (slot declaration order, then repository order), each aggregate is visited once (by identity), and
     * its events are yielded in the order they were raised. Events already drained aren't yielded again.<br>
     * Can be called both during and after the {@link UnitOfWork}. Whether events from a {@link UnitOfWork} that
     * wasn't committed are yielded depends on the configured {@link EventHarvestPolicy}
     *
     * @see AggregateRoot#nextPendingEvent()
     */
    Stream<Event> collectNewEvents();

    UnitOfWorkStatus status();

    /**
     * The cause of the rollback, if any
     */
    Exception getCauseOfRollback();
}
