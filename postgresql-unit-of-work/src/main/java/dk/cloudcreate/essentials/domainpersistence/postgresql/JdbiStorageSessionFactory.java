package dk.cloudcreate.essentials.domainpersistence.postgresql;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.StorageSessionFactory;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionIsolationLevel;
import org.slf4j.*;

import java.util.Set;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Opens {@link JdbiStorageSession}'s on a {@link Jdbi} instance. Each session uses its own {@link org.jdbi.v3.core.Handle}
 */
public final class JdbiStorageSessionFactory implements StorageSessionFactory<JdbiStorageSession> {
    private static final Logger log = LoggerFactory.getLogger(JdbiStorageSessionFactory.class);

    private final Jdbi                      jdbi;
    private final TransactionIsolationLevel isolationLevel;
    private final Set<String>               conflictSqlStates;

    /**
     * Create a factory using {@link DatabaseConfiguration#DEFAULT_ISOLATION_LEVEL} and {@link DatabaseConfiguration#DEFAULT_CONFLICT_SQL_STATES}
     */
    public JdbiStorageSessionFactory(Jdbi jdbi) {
        this(jdbi, DatabaseConfiguration.DEFAULT_ISOLATION_LEVEL, DatabaseConfiguration.DEFAULT_CONFLICT_SQL_STATES);
    }

    public JdbiStorageSessionFactory(Jdbi jdbi, TransactionIsolationLevel isolationLevel, Set<String> conflictSqlStates) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.isolationLevel = requireNonNull(isolationLevel, "No isolationLevel provided");
        this.conflictSqlStates = Set.copyOf(requireNonNull(conflictSqlStates, "No conflictSqlStates provided"));
        jdbi.setSqlLogger(new UnitOfWorkSqlLogger(this.conflictSqlStates));
    }

    /**
     * Create a factory, and the {@link Jdbi} instance it uses, from the given configuration
     */
    public static JdbiStorageSessionFactory fromConfiguration(DatabaseConfiguration configuration) {
        requireNonNull(configuration, "No configuration provided");
        log.info("Creating {} using {}", JdbiStorageSessionFactory.class.getSimpleName(), configuration);
        var jdbi = configuration.username().isPresent() ?
                   Jdbi.create(configuration.jdbcUrl(), configuration.username().get(), configuration.password().orElse("")) :
                   Jdbi.create(configuration.jdbcUrl());
        return new JdbiStorageSessionFactory(jdbi, configuration.isolationLevel(), configuration.conflictSqlStates());
    }

    @Override
    public JdbiStorageSession openSession() {
        log.trace("Opening JDBI handle");
        return new JdbiStorageSession(jdbi.open(), isolationLevel, conflictSqlStates);
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    public TransactionIsolationLevel isolationLevel() {
        return isolationLevel;
    }
}
