package dk.cloudcreate.essentials.domainpersistence.model;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The base element of the domain model, for entities and their aggregates.<br>
 * An {@link Entity} has a global unique, immutable, identifier and a version that's used for optimistic concurrency
 * control. Every domain method that changes the state of the entity MUST call {@link #update()} before (or as part of)
 * applying its change, since that is where the version is increased.<p>
 * An entity can be {@link #discard() discarded} (soft deleted) exactly once, after which its state is frozen
 * and any further mutation fails with an {@link EntityDiscardedException}.<p>
 * Equality is based on the concrete entity type and the {@link #id()}
 *
 * @param <ID> the entity id type
 * @see AggregateRoot
 */
public abstract class Entity<ID> {
    /**
     * The version of a newly created entity
     */
    public static final int INITIAL_VERSION = 1;

    private final ID      id;
    private final Instant registeredAt;
    private       int     version;
    private       boolean discarded;
    private       Instant updatedAt;

    /**
     * Create a new entity with {@link #INITIAL_VERSION}, registered now
     *
     * @param id the id of the new entity
     */
    protected Entity(ID id) {
        this.id = requireNonNull(id, "You must supply an id");
        this.version = INITIAL_VERSION;
        this.discarded = false;
        this.registeredAt = Instant.now();
        this.updatedAt = registeredAt;
    }

    /**
     * Restore an existing entity, e.g. when a repository maps it from storage
     *
     * @param id           the id of the entity
     * @param version      the stored version
     * @param discarded    the stored discard flag
     * @param registeredAt when the entity was created
     * @param updatedAt    when the entity was last updated
     */
    protected Entity(ID id, int version, boolean discarded, Instant registeredAt, Instant updatedAt) {
        this.id = requireNonNull(id, "You must supply an id");
        requireTrue(version >= 0, msg("Version must be non-negative, was {}", version));
        this.version = version;
        this.discarded = discarded;
        this.registeredAt = requireNonNull(registeredAt, "You must supply registeredAt");
        this.updatedAt = requireNonNull(updatedAt, "You must supply updatedAt");
        requireTrue(!updatedAt.isBefore(registeredAt), msg("updatedAt '{}' is before registeredAt '{}'", updatedAt, registeredAt));
    }

    public final ID id() {
        return id;
    }

    public final int version() {
        return version;
    }

    public final boolean isDiscarded() {
        return discarded;
    }

    public final Instant registeredAt() {
        return registeredAt;
    }

    public final Instant updatedAt() {
        return updatedAt;
    }

    /**
     * The mutation checkpoint. Increases the {@link #version()} by exactly one and refreshes {@link #updatedAt()}
     *
     * @throws EntityDiscardedException if the entity is discarded
     */
    public final void update() {
        checkNotDiscarded();
        version++;
        var now = Instant.now();
        if (now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    /**
     * Soft delete the entity. This is irreversible and leaves the {@link #version()} untouched.
     *
     * @throws EntityDiscardedException if the entity is already discarded
     */
    public void discard() {
        checkNotDiscarded();
        discarded = true;
    }

    /**
     * Guard that subclasses can use in their own mutation methods
     *
     * @throws EntityDiscardedException if the entity is discarded
     */
    protected final void checkNotDiscarded() {
        if (discarded) {
            throw new EntityDiscardedException(getClass(), id);
        }
    }

    /**
     * Build the standard textual representation of an entity, for use in {@link #toString()} implementations:
     * <pre>{@code
     * **DISCARDED** <Order 'a0c1...' (customer=..., lines=3)>
     * }</pre>
     *
     * @param identifier the value shown as the entity's identifier
     * @param extras     additional key/value pairs to include (in iteration order)
     * @return the representation
     */
    protected final String describe(Object identifier, Map<String, ?> extras) {
        var pairs = extras.entrySet()
                          .stream()
                          .map(entry -> entry.getKey() + "=" + entry.getValue())
                          .collect(Collectors.joining(", "));
        return (discarded ? "**DISCARDED** " : "") +
                "<" + getClass().getSimpleName() + " '" + identifier + "'" +
                (extras.isEmpty() ? "" : " (" + pairs + ")") +
                ">";
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Entity<?>) o).id);
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), id);
    }

    @Override
    public String toString() {
        return describe(id, Map.of("version", version));
    }
}
