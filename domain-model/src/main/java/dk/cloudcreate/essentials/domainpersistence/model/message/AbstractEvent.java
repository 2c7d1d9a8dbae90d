package dk.cloudcreate.essentials.domainpersistence.model.message;

import java.time.Instant;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for {@link Event}'s that validates and holds the common {@link Event} fields.<br>
 * Subclasses must be immutable, include their own fields in {@link #equals(Object)}/{@link #hashCode()} and supply a
 * static <code>create(...)</code> factory
 *
 * @see AbstractCommand
 */
public abstract class AbstractEvent implements Event {
    private final Instant raisedAt;
    private final int     delay;
    private final UUID    raisedBy;

    protected AbstractEvent(Instant raisedAt, int delay, UUID raisedBy) {
        this.raisedAt = requireNonNull(raisedAt, "No raisedAt provided");
        requireTrue(delay >= 0, msg("delay must be non-negative, was {}", delay));
        this.delay = delay;
        this.raisedBy = requireNonNull(raisedBy, "No raisedBy provided");
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
    public final UUID raisedBy() {
        return raisedBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var that = (AbstractEvent) o;
        return delay == that.delay && raisedAt.equals(that.raisedAt) && raisedBy.equals(that.raisedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), raisedAt, delay, raisedBy);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{raisedBy=" + raisedBy + ", raisedAt=" + raisedAt + ", delay=" + delay + "}";
    }
}
