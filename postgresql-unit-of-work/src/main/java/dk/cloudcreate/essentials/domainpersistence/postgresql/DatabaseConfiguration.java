package dk.cloudcreate.essentials.domainpersistence.postgresql;

import org.jdbi.v3.core.transaction.TransactionIsolationLevel;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable database configuration used by {@link JdbiStorageSessionFactory#fromConfiguration(DatabaseConfiguration)}.<br>
 * Can be created from environment variables using {@link #fromEnvironment(Map)}:
 * <ul>
 *     <li>{@value #DATABASE_URL} (required) - the JDBC url</li>
 *     <li>{@value #DATABASE_USERNAME} - the database user</li>
 *     <li>{@value #DATABASE_PASSWORD} - the database password</li>
 *     <li>{@value #DATABASE_ISOLATION_LEVEL} - a {@link TransactionIsolationLevel} name, e.g. <code>READ_COMMITTED</code>. Default is {@link #DEFAULT_ISOLATION_LEVEL}</li>
 *     <li>{@value #DATABASE_CONFLICT_SQL_STATES} - comma separated SQL states that signal a concurrency conflict. Default is {@link #DEFAULT_CONFLICT_SQL_STATES}</li>
 * </ul>
 */
public final class DatabaseConfiguration {
    public static final String DATABASE_URL                 = "DATABASE_URL";
    public static final String DATABASE_USERNAME            = "DATABASE_USERNAME";
    public static final String DATABASE_PASSWORD            = "DATABASE_PASSWORD";
    public static final String DATABASE_ISOLATION_LEVEL     = "DATABASE_ISOLATION_LEVEL";
    public static final String DATABASE_CONFLICT_SQL_STATES = "DATABASE_CONFLICT_SQL_STATES";

    public static final TransactionIsolationLevel DEFAULT_ISOLATION_LEVEL     = TransactionIsolationLevel.REPEATABLE_READ;
    /**
     * PostgreSQL's <code>serialization_failure</code>
     */
    public static final Set<String>               DEFAULT_CONFLICT_SQL_STATES = Set.of("40001");

    private final String                    jdbcUrl;
    private final String                    username;
    private final String                    password;
    private final TransactionIsolationLevel isolationLevel;
    private final Set<String>               conflictSqlStates;

    private DatabaseConfiguration(String jdbcUrl,
                                  String username,
                                  String password,
                                  TransactionIsolationLevel isolationLevel,
                                  Set<String> conflictSqlStates) {
        this.jdbcUrl = requireNonNull(jdbcUrl, "No jdbcUrl provided");
        requireTrue(!jdbcUrl.isBlank(), "The jdbcUrl must not be blank");
        this.username = username;
        this.password = password;
        this.isolationLevel = requireNonNull(isolationLevel, "No isolationLevel provided");
        requireTrue(isolationLevel != TransactionIsolationLevel.UNKNOWN, msg("Unsupported isolationLevel {}", isolationLevel));
        this.conflictSqlStates = Set.copyOf(requireNonNull(conflictSqlStates, "No conflictSqlStates provided"));
    }

    /**
     * Configuration with the {@link #DEFAULT_ISOLATION_LEVEL} and {@link #DEFAULT_CONFLICT_SQL_STATES}
     *
     * @param jdbcUrl  the JDBC url
     * @param username the database user (may be null)
     * @param password the database password (may be null)
     */
    public static DatabaseConfiguration of(String jdbcUrl, String username, String password) {
        return new DatabaseConfiguration(jdbcUrl, username, password, DEFAULT_ISOLATION_LEVEL, DEFAULT_CONFLICT_SQL_STATES);
    }

    public static DatabaseConfiguration fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Create the configuration from the given environment variables
     *
     * @throws IllegalArgumentException if {@value #DATABASE_URL} is missing or a value can't be parsed
     */
    public static DatabaseConfiguration fromEnvironment(Map<String, String> environment) {
        requireNonNull(environment, "No environment provided");
        var jdbcUrl = nonBlank(environment.get(DATABASE_URL))
                .orElseThrow(() -> new IllegalArgumentException(msg("Environment variable {} is required", DATABASE_URL)));
        var isolationLevel = nonBlank(environment.get(DATABASE_ISOLATION_LEVEL))
                .map(DatabaseConfiguration::parseIsolationLevel)
                .orElse(DEFAULT_ISOLATION_LEVEL);
        var conflictSqlStates = nonBlank(environment.get(DATABASE_CONFLICT_SQL_STATES))
                .map(DatabaseConfiguration::parseSqlStates)
                .orElse(DEFAULT_CONFLICT_SQL_STATES);
        return new DatabaseConfiguration(jdbcUrl,
                                         nonBlank(environment.get(DATABASE_USERNAME)).orElse(null),
                                         nonBlank(environment.get(DATABASE_PASSWORD)).orElse(null),
                                         isolationLevel,
                                         conflictSqlStates);
    }

    private static Optional<String> nonBlank(String value) {
        return Optional.ofNullable(value)
                       .map(String::trim)
                       .filter(trimmed -> !trimmed.isEmpty());
    }

    private static TransactionIsolationLevel parseIsolationLevel(String value) {
        try {
            return TransactionIsolationLevel.valueOf(value.toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(msg("Unsupported {} '{}'", DATABASE_ISOLATION_LEVEL, value), e);
        }
    }

    private static Set<String> parseSqlStates(String value) {
        var sqlStates = Arrays.stream(value.split(","))
                              .map(String::trim)
                              .filter(sqlState -> !sqlState.isEmpty())
                              .collect(Collectors.toSet());
        requireTrue(!sqlStates.isEmpty(), msg("{} didn't contain any SQL states", DATABASE_CONFLICT_SQL_STATES));
        return sqlStates;
    }

    public DatabaseConfiguration withIsolationLevel(TransactionIsolationLevel isolationLevel) {
        return new DatabaseConfiguration(jdbcUrl, username, password, isolationLevel, conflictSqlStates);
    }

    public DatabaseConfiguration withConflictSqlStates(Set<String> conflictSqlStates) {
        return new DatabaseConfiguration(jdbcUrl, username, password, isolationLevel, conflictSqlStates);
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public Optional<String> username() {
        return Optional.ofNullable(username);
    }

    public Optional<String> password() {
        return Optional.ofNullable(password);
    }

    public TransactionIsolationLevel isolationLevel() {
        return isolationLevel;
    }

    public Set<String> conflictSqlStates() {
        return conflictSqlStates;
    }

    @Override
    public String toString() {
        return "DatabaseConfiguration{" +
                "jdbcUrl='" + jdbcUrl + '\'' +
                ", username='" + username + '\'' +
                ", password=" + (password != null ? "'***'" : "null") +
                ", isolationLevel=" + isolationLevel +
                ", conflictSqlStates=" + conflictSqlStates +
                '}';
    }
}
