package dk.cloudcreate.essentials.domainpersistence.model;

import dk.cloudcreate.essentials.domainpersistence.model.message.Event;

import java.time.Instant;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A versioned {@link Entity} that is the unit of transactional consistency and the source of domain {@link Event}'s.<br>
 * Domain methods {@link #raise(Event) raise} events, which are queued (in the order they were raised) until the
 * UnitOfWork that loaded or created the aggregate drains them using {@link #nextPendingEvent()}.
 * <pre>{@code
 * public class Order extends AggregateRoot<UUID> {
 *     public void addProduct(ProductId productId, int quantity) {
 *         update();
 *         productAndQuantity.merge(productId, quantity, Integer::sum);
 *         raise(ProductAdded.create(id(), productId, quantity));
 *     }
 * }
 * }</pre>
 *
 * @param <ID> the aggregate id type
 */
public abstract class AggregateRoot<ID> extends Entity<ID> {
    private final Deque<Event> pendingEvents = new ArrayDeque<>();

    protected AggregateRoot(ID id) {
        super(id);
    }

    protected AggregateRoot(ID id, int version, boolean discarded, Instant registeredAt, Instant updatedAt) {
        super(id, version, discarded, registeredAt, updatedAt);
    }

    /**
     * Queue a new event raised by this aggregate
     *
     * @param event the event. {@link Event#raisedBy()} must be the id of this aggregate
     * @throws EntityDiscardedException if the aggregate is discarded
     */
    protected final void raise(Event event) {
        requireNonNull(event, "You must supply an event");
        checkNotDiscarded();
        requireTrue(Objects.equals(event.raisedBy(), id()), msg("Cannot raise Event '{}' with raisedBy '{}' on '{}' with id '{}'",
                                                               event.getClass().getName(),
                                                               event.raisedBy(),
                                                               getClass().getName(),
                                                               id()));
        pendingEvents.addLast(event);
    }

    public final boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    public final int pendingEventCount() {
        return pendingEvents.size();
    }

    /**
     * Remove and return the oldest pending event
     *
     * @return the oldest event that hasn't been drained yet
     * @throws NoSuchElementException if there are no pending events
     */
    public final Event nextPendingEvent() {
        return pendingEvents.removeFirst();
    }
}
