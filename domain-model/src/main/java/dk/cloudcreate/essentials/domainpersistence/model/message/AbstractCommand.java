package dk.cloudcreate.essentials.domainpersistence.model.message;

import java.time.Instant;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for {@link Command}'s that validates and holds the common {@link Message} fields.<br>
 * Subclasses must be immutable, include their own fields in {@link #equals(Object)}/{@link #hashCode()} and supply a
 * static <code>create(...)</code> factory:
 * <pre>{@code
 * public final class PlaceOrder extends AbstractCommand {
 *     private final UUID customerId;
 *
 *     @JsonCreator
 *     private PlaceOrder(@JsonProperty("raisedAt") Instant raisedAt,
 *                        @JsonProperty("delay") int delay,
 *                        @JsonProperty("customerId") UUID customerId) {
 *         super(raisedAt, delay);
 *         this.customerId = requireNonNull(customerId, "No customerId provided");
 *     }
 *
 *     public static PlaceOrder create(UUID customerId) {
 *         return new PlaceOrder(Instant.now(), 0, customerId);
 *     }
 * }
 * }</pre>
 */
public abstract class AbstractCommand implements Command {
    private final Instant raisedAt;
    private final int     delay;

    protected AbstractCommand(Instant raisedAt, int delay) {
        this.raisedAt = requireNonNull(raisedAt, "No raisedAt provided");
        requireTrue(delay >= 0, msg("delay must be non-negative, was {}", delay));
        this.delay = delay;
    }

    @Override
    public final Instant raisedAt() {
        return raisedAt;
    }

    @Override
    public final int delay() {
        return delay;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var that = (AbstractCommand) o;
        return delay == that.delay && raisedAt.equals(that.raisedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), raisedAt, delay);
    }
}
