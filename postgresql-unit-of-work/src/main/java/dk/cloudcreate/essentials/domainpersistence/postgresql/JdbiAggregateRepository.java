package dk.cloudcreate.essentials.domainpersistence.postgresql;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.ConcurrencyConflictException;
import dk.cloudcreate.essentials.domainpersistence.model.AggregateRoot;
import dk.cloudcreate.essentials.domainpersistence.uow.Repository;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.util.*;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for {@link Repository}'s that store one aggregate type in a table using Jdbi.<br>
 * The repository remembers the version each aggregate had when it was loaded. When the UnitOfWork commits,
 * new aggregates are inserted and changed aggregates are written with a version checked update, e.g.
 * <pre>{@code
 * UPDATE orders SET version = :version, ... WHERE id = :id AND version = :expectedVersion
 * }</pre>
 * An update that affects no rows means another transaction changed the aggregate, which is reported as a
 * {@link ConcurrencyConflictException}
 *
 * @param <ID> the aggregate id type
 * @param <A>  the aggregate type
 */
public abstract class JdbiAggregateRepository<ID, A extends AggregateRoot<ID>> implements Repository {
    private static final Logger log = LoggerFactory.getLogger(JdbiAggregateRepository.class);

    protected final JdbiStorageSession session;
    protected final Class<A>           aggregateType;
    private final   List<A>            touchedAggregates;
    private final   Map<A, LoadedState> loadedStates;

    protected JdbiAggregateRepository(JdbiStorageSession session, Class<A> aggregateType) {
        this.session = requireNonNull(session, "No session provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.touchedAggregates = new ArrayList<>();
        this.loadedStates = new IdentityHashMap<>();
    }

    /**
     * Load the aggregate with the given id from the table
     *
     * @return the aggregate or an empty {@link Optional} if no aggregate with the given id exists
     */
    protected abstract Optional<A> loadAggregate(Handle handle, ID id);

    /**
     * Insert a new aggregate
     */
    protected abstract void insert(Handle handle, A aggregate);

    /**
     * Update an existing aggregate, but only if its stored version is <code>expectedVersion</code>
     *
     * @return the number of rows affected
     */
    protected abstract int update(Handle handle, A aggregate, int expectedVersion);

    /**
     * Find and track the aggregate with the given id.<br>
     * An aggregate that is already tracked by this repository is returned as the same instance, it isn't loaded again
     */
    public Optional<A> find(ID id) {
        requireNonNull(id, "No id provided");
        var alreadyTracked = touchedAggregates.stream()
                                              .filter(touched -> touched.id().equals(id))
                                              .findFirst();
        if (alreadyTracked.isPresent()) {
            log.trace("'{}' with id '{}' is already tracked", aggregateType.getName(), id);
            return alreadyTracked;
        }
        var aggregate = translateConflicts(() -> loadAggregate(session.handle(), id));
        aggregate.ifPresent(loaded -> {
            log.trace("Loaded '{}' with id '{}' and version {}", aggregateType.getName(), id, loaded.version());
            loadedStates.put(loaded, new LoadedState(loaded.version(), loaded.isDiscarded()));
            touchedAggregates.add(loaded);
        });
        return aggregate;
    }

    /**
     * Load and track the aggregate with the given id
     *
     * @throws NoSuchElementException if no aggregate with the given id exists
     */
    public A load(ID id) {
        return find(id).orElseThrow(() -> new NoSuchElementException(msg("Couldn't find '{}' with id '{}'", aggregateType.getName(), id)));
    }

    /**
     * Track a new aggregate, which will be inserted when the UnitOfWork commits
     */
    public void add(A aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        if (touchedAggregates.stream().noneMatch(touched -> touched == aggregate)) {
            log.trace("Adding new '{}' with id '{}'", aggregateType.getName(), aggregate.id());
            touchedAggregates.add(aggregate);
        }
    }

    @Override
    public List<A> touchedAggregates() {
        return Collections.unmodifiableList(touchedAggregates);
    }

    @Override
    public void beforeCommit() {
        var handle = session.handle();
        for (var aggregate : touchedAggregates) {
            var loadedState = loadedStates.get(aggregate);
            if (loadedState == null) {
                log.debug("Inserting '{}' with id '{}' and version {}", aggregateType.getName(), aggregate.id(), aggregate.version());
                translateConflicts(() -> {
                    insert(handle, aggregate);
                    return null;
                });
            } else if (loadedState.isChangedIn(aggregate)) {
                log.debug("Updating '{}' with id '{}' from version {} to {}", aggregateType.getName(), aggregate.id(), loadedState.version, aggregate.version());
                var rowsUpdated = translateConflicts(() -> update(handle, aggregate, loadedState.version));
                if (rowsUpdated == 0) {
                    throw new ConcurrencyConflictException(aggregateType, aggregate.id(), loadedState.version);
                }
            } else {
                log.trace("No changes detected for '{}' with id '{}'", aggregateType.getName(), aggregate.id());
            }
        }
    }

    private <T> T translateConflicts(Supplier<T> storageOperation) {
        try {
            return storageOperation.get();
        } catch (RuntimeException e) {
            throw session.translateException(e);
        }
    }

    private static final class LoadedState {
        private final int     version;
        private final boolean discarded;

        private LoadedState(int version, boolean discarded) {
            this.version = version;
            this.discarded = discarded;
        }

        private boolean isChangedIn(AggregateRoot<?> aggregate) {
            return aggregate.version() != version || aggregate.isDiscarded() != discarded;
        }
    }
}
