package dk.cloudcreate.essentials.domainpersistence.uow;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.*;
import dk.cloudcreate.essentials.domainpersistence.model.AggregateRoot;
import dk.cloudcreate.essentials.domainpersistence.model.message.Event;
import org.slf4j.*;

import java.util.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link UnitOfWorkFactory} where every {@link UnitOfWork} opens and manages its own storage session,
 * obtained from the {@link StorageSessionFactory}, and creates a fresh repository for each declared {@link RepositorySlot}
 *
 * @param <SESSION> the storage session type
 */
public final class SessionManagedUnitOfWorkFactory<SESSION extends StorageSession> implements UnitOfWorkFactory<SESSION> {
    private static final Logger log = LoggerFactory.getLogger(SessionManagedUnitOfWorkFactory.class);

    private final StorageSessionFactory<SESSION>   sessionFactory;
    private final List<RepositorySlot<SESSION, ?>> repositorySlots;
    private final UnitOfWorkConfiguration          configuration;

    public SessionManagedUnitOfWorkFactory(StorageSessionFactory<SESSION> sessionFactory,
                                           List<RepositorySlot<SESSION, ?>> repositorySlots) {
        this(sessionFactory, repositorySlots, UnitOfWorkConfiguration.defaultConfiguration());
    }

    /**
     * @param sessionFactory  opens the storage session for each {@link UnitOfWork}
     * @param repositorySlots the repository slots. Slot names must be unique
     * @param configuration   the configuration shared by the {@link UnitOfWork}'s
     */
    public SessionManagedUnitOfWorkFactory(StorageSessionFactory<SESSION> sessionFactory,
                                           List<RepositorySlot<SESSION, ?>> repositorySlots,
                                           UnitOfWorkConfiguration configuration) {
        this.sessionFactory = requireNonNull(sessionFactory, "No sessionFactory provided");
        this.repositorySlots = List.copyOf(requireNonNull(repositorySlots, "No repositorySlots provided"));
        this.configuration = requireNonNull(configuration, "No configuration provided");
        var slotNames = new HashSet<String>();
        for (var slot : this.repositorySlots) {
            if (!slotNames.add(slot.name)) {
                throw new IllegalArgumentException(msg("Repository slot name '{}' is declared more than once", slot.name));
            }
        }
        log.debug("Created {} with {} repository slot(s) {} and {}", getClass().getSimpleName(), this.repositorySlots.size(), slotNames, configuration);
    }

    @Override
    public UnitOfWork<SESSION> newUnitOfWork() {
        return new SessionManagedUnitOfWork<>(sessionFactory, repositorySlots, configuration);
    }

    @Override
    public List<RepositorySlot<SESSION, ?>> repositorySlots() {
        return repositorySlots;
    }

    @Override
    public UnitOfWorkConfiguration configuration() {
        return configuration;
    }

    private static final class SessionManagedUnitOfWork<SESSION extends StorageSession> implements UnitOfWork<SESSION> {
        private final Logger log = LoggerFactory.getLogger(SessionManagedUnitOfWork.class);

        private final StorageSessionFactory<SESSION>   sessionFactory;
        private final List<RepositorySlot<SESSION, ?>> repositorySlots;
        private final UnitOfWorkConfiguration          configuration;
        /**
         * Slot name to repository, in slot declaration order
         */
        private final Map<String, Repository>          repositories;
        private       SESSION                          session;
        private       UnitOfWorkStatus                 status;
        private       Exception                        causeOfRollback;
        private       boolean                          closed;

        private SessionManagedUnitOfWork(StorageSessionFactory<SESSION> sessionFactory,
                                         List<RepositorySlot<SESSION, ?>> repositorySlots,
                                         UnitOfWorkConfiguration configuration) {
            this.sessionFactory = sessionFactory;
            this.repositorySlots = repositorySlots;
            this.configuration = configuration;
            this.repositories = new LinkedHashMap<>();
            this.status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status != UnitOfWorkStatus.Ready) {
                throw new UnitOfWorkException(msg("Cannot start UnitOfWork as it has status {} and not the expected status {}", status, UnitOfWorkStatus.Ready));
            }
            log.debug("Starting UnitOfWork");
            log.trace("Opening storage session");
            var openedSession = requireNonNull(sessionFactory.openSession(), "The StorageSessionFactory returned a null session");
            try {
                openedSession.begin();
                for (var slot : repositorySlots) {
                    log.trace("Creating repository for slot '{}'", slot.name);
                    repositories.put(slot.name, slot.createRepository(openedSession));
                }
            } catch (RuntimeException e) {
                repositories.clear();
                releaseAfterFailedStart(openedSession, e);
                throw e;
            }
            session = openedSession;
            status = UnitOfWorkStatus.Started;
        }

        private void releaseAfterFailedStart(SESSION openedSession, RuntimeException cause) {
            try {
                if (openedSession.isActive()) {
                    openedSession.rollback();
                }
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            } finally {
                try {
                    openedSession.close();
                } catch (RuntimeException e) {
                    cause.addSuppressed(e);
                }
            }
        }

        @Override
        public <R extends Repository> R repository(RepositorySlot<SESSION, R> slot) {
            requireNonNull(slot, "No slot provided");
            requireStarted();
            if (!repositorySlots.contains(slot)) {
                throw new UnitOfWorkException(msg("{} isn't registered with this UnitOfWork", slot));
            }
            return slot.repositoryType.cast(repositories.get(slot.name));
        }

        @Override
        public <R extends Repository> R repository(String slotName, Class<R> repositoryType) {
            requireNonNull(slotName, "No slotName provided");
            requireNonNull(repositoryType, "No repositoryType provided");
            requireStarted();
            var repository = repositories.get(slotName);
            if (repository == null) {
                throw new UnitOfWorkException(msg("No repository slot named '{}' is registered with this UnitOfWork", slotName));
            }
            if (!repositoryType.isInstance(repository)) {
                throw new UnitOfWorkException(msg("The repository in slot '{}' is a '{}' and not a '{}'", slotName, repository.getClass().getName(), repositoryType.getName()));
            }
            return repositoryType.cast(repository);
        }

        @Override
        public SESSION session() {
            requireStarted();
            return session;
        }

        private void requireStarted() {
            if (status != UnitOfWorkStatus.Started) {
                throw new NoActiveUnitOfWorkException(msg("The UnitOfWork isn't active as it has status {}", status));
            }
        }

        @Override
        public void commit() {
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit UnitOfWork as it has status {} and not the expected status {}", status, UnitOfWorkStatus.Started));
            }
            log.debug("Committing UnitOfWork");
            try {
                repositories.forEach((slotName, repository) -> {
                    log.trace("BeforeCommit for repository slot '{}'", slotName);
                    repository.beforeCommit();
                });
                session.commit();
            } catch (RuntimeException e) {
                log.debug("Failed to commit UnitOfWork: {}", e.getMessage());
                try {
                    rollback(e);
                } catch (RuntimeException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
            status = UnitOfWorkStatus.Committed;
            repositories.forEach((slotName, repository) -> {
                try {
                    log.trace("AfterCommit for repository slot '{}'", slotName);
                    repository.afterCommit();
                } catch (RuntimeException e) {
                    log.error(msg("Repository in slot '{}' failed during afterCommit", slotName), e);
                }
            });
        }

        @Override
        public void rollback(Exception cause) {
            if (status != UnitOfWorkStatus.Started) {
                log.debug("Ignoring call to rollback UnitOfWork with status {}", status);
                return;
            }
            causeOfRollback = cause;
            var description = msg("Rolling back UnitOfWork{}", cause != null ? " due to " + cause.getMessage() : "");
            if (log.isTraceEnabled()) {
                log.trace(description, cause);
            } else {
                log.debug(description);
            }
            try {
                session.rollback();
            } finally {
                status = UnitOfWorkStatus.RolledBack;
                repositories.forEach((slotName, repository) -> {
                    try {
                        log.trace("AfterRollback for repository slot '{}'", slotName);
                        repository.afterRollback();
                    } catch (RuntimeException e) {
                        log.error(msg("Repository in slot '{}' failed during afterRollback", slotName), e);
                    }
                });
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (status == UnitOfWorkStatus.Ready) {
                log.warn("Closing UnitOfWork that was never started");
                status = UnitOfWorkStatus.Closed;
                return;
            }

            RuntimeException releaseFailure = null;
            if (status == UnitOfWorkStatus.Started) {
                log.debug("Closing UnitOfWork that wasn't committed - rolling it back");
                try {
                    rollback(null);
                } catch (RuntimeException e) {
                    log.error("Failed to roll back UnitOfWork while closing it", e);
                    releaseFailure = e;
                }
            }
            log.trace("Closing storage session");
            try {
                session.close();
            } catch (RuntimeException e) {
                log.error("Failed to close storage session", e);
                if (releaseFailure == null) {
                    releaseFailure = e;
                } else {
                    releaseFailure.addSuppressed(e);
                }
            }
            log.debug("Closed UnitOfWork with status {}", status);
            if (releaseFailure != null) {
                throw releaseFailure;
            }
        }

        @Override
        public Stream<Event> collectNewEvents() {
            if (configuration.eventHarvestPolicy() == EventHarvestPolicy.COMMITTED_ONLY && status != UnitOfWorkStatus.Committed) {
                log.debug("Not harvesting events from UnitOfWork with status {} as the harvest policy is {}", status, EventHarvestPolicy.COMMITTED_ONLY);
                return Stream.empty();
            }
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(new PendingEventsIterator(),
                                                                            Spliterator.ORDERED | Spliterator.NONNULL),
                                        false);
        }

        private List<AggregateRoot<?>> touchedAggregates() {
            var seen       = Collections.newSetFromMap(new IdentityHashMap<AggregateRoot<?>, Boolean>());
            var aggregates = new ArrayList<AggregateRoot<?>>();
            repositories.forEach((slotName, repository) -> {
                for (AggregateRoot<?> aggregate : repository.touchedAggregates()) {
                    if (seen.add(aggregate)) {
                        aggregates.add(aggregate);
                    }
                }
            });
            log.trace("Harvesting events from {} touched aggregate(s)", aggregates.size());
            return aggregates;
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        /**
         * Resolves the touched aggregates on first use and drains them one event at a time
         */
        private class PendingEventsIterator implements Iterator<Event> {
            private Iterator<AggregateRoot<?>> aggregates;
            private AggregateRoot<?>           current;

            @Override
            public boolean hasNext() {
                if (aggregates == null) {
                    aggregates = touchedAggregates().iterator();
                }
                while ((current == null || !current.hasPendingEvents()) && aggregates.hasNext()) {
                    current = aggregates.next();
                }
                return current != null && current.hasPendingEvents();
            }

            @Override
            public Event next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.nextPendingEvent();
            }
        }
    }
}
