package dk.cloudcreate.essentials.domainpersistence.postgresql;

import dk.cloudcreate.essentials.domainpersistence.uow.UnitOfWork;
import org.slf4j.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A SQL statement loaded from a classpath resource.<br>
 * Values are bound to named <code>:parameter</code> placeholders by Jdbi. Identifiers that can't be bound as parameters,
 * such as table names, are written as <code>&lt;attribute&gt;</code> and defined through Jdbi's template engine:
 * <pre>{@code
 * -- sql/orders_by_customer.sql
 * SELECT id, total_quantity FROM <table> WHERE customer_id = :customerId
 *
 * var rows = SqlQueryTemplate.load("sql/orders_by_customer.sql")
 *                            .withAttribute("table", "orders")
 *                            .query(unitOfWork, Map.of("customerId", customerId));
 * }</pre>
 * Statements are executed on the session of a started {@link UnitOfWork} and are never committed by the template.
 */
public final class SqlQueryTemplate {
    private static final Logger                        log             = LoggerFactory.getLogger(SqlQueryTemplate.class);
    private static final ConcurrentMap<String, String> loadedTemplates = new ConcurrentHashMap<>();

    private final String              resourcePath;
    private final String              sql;
    private final Map<String, Object> attributes;

    private SqlQueryTemplate(String resourcePath, String sql, Map<String, Object> attributes) {
        this.resourcePath = resourcePath;
        this.sql = sql;
        this.attributes = attributes;
    }

    /**
     * Load the template from the classpath. Templates are cached after the first load
     *
     * @param resourcePath the classpath resource path, e.g. <code>sql/orders_by_customer.sql</code>
     * @throws QueryTemplateException if the resource doesn't exist or can't be read
     */
    public static SqlQueryTemplate load(String resourcePath) {
        requireNonNull(resourcePath, "No resourcePath provided");
        var sql = loadedTemplates.computeIfAbsent(resourcePath, SqlQueryTemplate::readTemplate);
        return new SqlQueryTemplate(resourcePath, sql, Map.of());
    }

    private static String readTemplate(String resourcePath) {
        var classLoader = Optional.ofNullable(Thread.currentThread().getContextClassLoader())
                                  .orElse(SqlQueryTemplate.class.getClassLoader());
        try (var stream = classLoader.getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new QueryTemplateException(msg("Couldn't find SQL template '{}' on the classpath", resourcePath));
            }
            log.debug("Loaded SQL template '{}'", resourcePath);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new QueryTemplateException(msg("Failed to read SQL template '{}'", resourcePath), e);
        }
    }

    /**
     * Create a copy of this template with an additional <code>&lt;name&gt;</code> attribute
     */
    public SqlQueryTemplate withAttribute(String name, Object value) {
        requireNonNull(name, "No attribute name provided");
        requireNonNull(value, msg("No value provided for attribute '{}'", name));
        var newAttributes = new LinkedHashMap<>(attributes);
        newAttributes.put(name, value);
        return new SqlQueryTemplate(resourcePath, sql, Collections.unmodifiableMap(newAttributes));
    }

    /**
     * Combine the template with the parameter values
     */
    public BuiltStatement build(Map<String, ?> parameters) {
        requireNonNull(parameters, "No parameters provided");
        return new BuiltStatement(sql, attributes, parameters);
    }

    /**
     * Run the template as a query
     *
     * @return the rows, each as a map from column name to value
     * @throws dk.cloudcreate.essentials.domainpersistence.common.transaction.NoActiveUnitOfWorkException if the UnitOfWork isn't started
     */
    public List<Map<String, Object>> query(UnitOfWork<JdbiStorageSession> unitOfWork, Map<String, ?> parameters) {
        var statement = build(parameters);
        var session   = requireNonNull(unitOfWork, "No unitOfWork provided").session();
        log.trace("Querying '{}' with parameters {}", resourcePath, statement.parameters);
        var query = session.handle().createQuery(statement.sql);
        statement.attributes.forEach(query::define);
        try {
            return query.bindMap(statement.parameters)
                        .mapToMap()
                        .list();
        } catch (RuntimeException e) {
            throw session.translateException(e);
        }
    }

    /**
     * Run the template as an insert, update or delete statement
     *
     * @return the number of rows affected
     */
    public int execute(UnitOfWork<JdbiStorageSession> unitOfWork, Map<String, ?> parameters) {
        var statement = build(parameters);
        var session   = requireNonNull(unitOfWork, "No unitOfWork provided").session();
        log.trace("Executing '{}' with parameters {}", resourcePath, statement.parameters);
        var update = session.handle().createUpdate(statement.sql);
        statement.attributes.forEach(update::define);
        try {
            return update.bindMap(statement.parameters)
                         .execute();
        } catch (RuntimeException e) {
            throw session.translateException(e);
        }
    }

    public String resourcePath() {
        return resourcePath;
    }

    public String sql() {
        return sql;
    }

    /**
     * The SQL, attributes and parameter values of a single statement
     */
    public static final class BuiltStatement {
        public final String              sql;
        public final Map<String, Object> attributes;
        public final Map<String, Object> parameters;

        private BuiltStatement(String sql, Map<String, Object> attributes, Map<String, ?> parameters) {
            this.sql = sql;
            this.attributes = attributes;
            this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }

        @Override
        public String toString() {
            return "BuiltStatement{" +
                    "sql='" + sql + '\'' +
                    ", attributes=" + attributes +
                    ", parameters=" + parameters +
                    '}';
        }
    }
}
