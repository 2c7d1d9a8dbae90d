package dk.cloudcreate.essentials.domainpersistence.postgresql;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.*;
import dk.cloudcreate.essentials.domainpersistence.model.message.Event;
import dk.cloudcreate.essentials.domainpersistence.postgresql.test_data.*;
import dk.cloudcreate.essentials.domainpersistence.postgresql.test_data.OrderEvents.*;
import dk.cloudcreate.essentials.domainpersistence.uow.*;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.ConnectionFactory;
import org.jdbi.v3.core.transaction.TransactionIsolationLevel;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.sql.*;
import java.util.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class PostgresqlUnitOfWorkTest {
    private static final RepositorySlot<JdbiStorageSession, OrderRepository> ORDERS = RepositorySlot.of("orders", OrderRepository.class, OrderRepository::new);

    @Container
    private static final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("uow-db")
            .withUsername("test-user")
            .withPassword("secret-password");

    private JdbiStorageSessionFactory             sessionFactory;
    private UnitOfWorkFactory<JdbiStorageSession> unitOfWorkFactory;

    @BeforeEach
    void setup() {
        sessionFactory = JdbiStorageSessionFactory.fromConfiguration(DatabaseConfiguration.fromEnvironment(Map.of(DatabaseConfiguration.DATABASE_URL, postgreSQLContainer.getJdbcUrl(),
                                                                                                                DatabaseConfiguration.DATABASE_USERNAME, postgreSQLContainer.getUsername(),
                                                                                                                DatabaseConfiguration.DATABASE_PASSWORD, postgreSQLContainer.getPassword())));
        sessionFactory.jdbi().useHandle(handle -> {
            handle.execute(OrderRepository.CREATE_TABLE_SQL);
            handle.execute("TRUNCATE TABLE orders");
            handle.execute("CREATE OR REPLACE FUNCTION fail_with_serialization_failure() RETURNS int AS $$ " +
                                   "BEGIN RAISE EXCEPTION 'could not serialize access' USING ERRCODE = 'serialization_failure'; END " +
                                   "$$ LANGUAGE plpgsql");
        });
        unitOfWorkFactory = new SessionManagedUnitOfWorkFactory<>(sessionFactory, List.of(ORDERS));
    }

    private UUID placeOrder(UUID customerId) {
        var orderId = UUID.randomUUID();
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.repository(ORDERS).add(new Order(orderId, customerId));
            unitOfWork.commit();
        });
        return orderId;
    }

    @Test
    void verify_a_committed_order_can_be_loaded_in_a_new_unit_of_work() {
        // Given
        var customerId = UUID.randomUUID();
        var orderId    = placeOrder(customerId);

        // When
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.repository(ORDERS).load(orderId).addItems(3);
            unitOfWork.commit();
        });
        var order = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.repository(ORDERS).load(orderId));

        // Then
        assertThat(order.customerId()).isEqualTo(customerId);
        assertThat(order.totalQuantity()).isEqualTo(3);
        assertThat(order.version()).isEqualTo(2);
        assertThat(order.isDiscarded()).isFalse();
        assertThat(order.hasPendingEvents()).isFalse();
    }

    @Test
    void verify_the_first_of_two_concurrent_unit_of_works_fails_when_the_second_commits_first() {
        verifyConcurrentUpdateConflict();
    }

    @Test
    void verify_the_version_check_detects_the_conflict_with_read_committed_isolation() {
        unitOfWorkFactory = new SessionManagedUnitOfWorkFactory<>(new JdbiStorageSessionFactory(sessionFactory.jdbi(),
                                                                                                TransactionIsolationLevel.READ_COMMITTED,
                                                                                                DatabaseConfiguration.DEFAULT_CONFLICT_SQL_STATES),
                                                                  List.of(ORDERS));
        var conflict = verifyConcurrentUpdateConflict();

        assertThat(conflict.aggregateType()).contains(Order.class);
        assertThat(conflict.expectedVersion()).contains(1);
    }

    private ConcurrencyConflictException verifyConcurrentUpdateConflict() {
        // Given
        var orderId     = placeOrder(UUID.randomUUID());
        var unitOfWork1 = unitOfWorkFactory.startUnitOfWork();
        var unitOfWork2 = unitOfWorkFactory.startUnitOfWork();
        var order1      = unitOfWork1.repository(ORDERS).load(orderId);
        var order2      = unitOfWork2.repository(ORDERS).load(orderId);
        assertThat(unitOfWork1.session().isActive()).isTrue();

        // When
        order2.addItems(5);
        unitOfWork2.commit();
        unitOfWork2.close();
        order1.addItems(1);

        // Then
        var thrown = catchThrowable(unitOfWork1::commit);
        assertThat(thrown).isExactlyInstanceOf(ConcurrencyConflictException.class);
        assertThat(unitOfWork1.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
        unitOfWork1.close();
        assertThat(unitOfWork2.status()).isEqualTo(UnitOfWorkStatus.Committed);

        var stored = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.repository(ORDERS).load(orderId));
        assertThat(stored.version()).isEqualTo(2);
        assertThat(stored.totalQuantity()).isEqualTo(5);
        return (ConcurrencyConflictException) thrown;
    }

    @Test
    void verify_an_exception_before_commit_rolls_back_and_the_events_can_still_be_harvested() {
        // Given
        var orderId    = placeOrder(UUID.randomUUID());
        var unitOfWork = unitOfWorkFactory.newUnitOfWork();
        var failure    = new IllegalStateException("Warehouse unavailable");

        // When
        assertThatThrownBy(() -> {
            try (unitOfWork) {
                unitOfWork.start();
                var order = unitOfWork.repository(ORDERS).load(orderId);
                order.addItems(2);
                order.addItems(4);
                throw failure;
            }
        }).isSameAs(failure);

        // Then
        assertThat(unitOfWork.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
        assertThatThrownBy(unitOfWork::session).isInstanceOf(NoActiveUnitOfWorkException.class);
        List<Event> events = unitOfWork.collectNewEvents().collect(Collectors.toList());
        assertThat(events).hasSize(2);
        assertThat(events).allSatisfy(event -> assertThat(event).isInstanceOf(ItemsAdded.class));
        assertThat(((ItemsAdded) events.get(0)).quantity).isEqualTo(2);
        assertThat(((ItemsAdded) events.get(1)).quantity).isEqualTo(4);

        var stored = unitOfWorkFactory.withUnitOfWork(uow -> uow.repository(ORDERS).load(orderId));
        assertThat(stored.version()).isEqualTo(1);
        assertThat(stored.totalQuantity()).isZero();
    }

    @Test
    void verify_a_cancelled_order_is_stored_as_discarded() {
        // Given
        var orderId = placeOrder(UUID.randomUUID());

        // When
        var events = unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            unitOfWork.repository(ORDERS).load(orderId).cancel();
            unitOfWork.commit();
            return unitOfWork.collectNewEvents().collect(Collectors.toList());
        });

        // Then
        assertThat(events).hasSize(1);
        assertThat(events.get(0)).isInstanceOf(OrderCancelled.class);
        var stored = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.repository(ORDERS).load(orderId));
        assertThat(stored.isDiscarded()).isTrue();
        assertThat(stored.version()).isEqualTo(2);
    }

    @Test
    void verify_sql_templates_run_in_the_unit_of_work() {
        // Given
        var customerId = UUID.randomUUID();
        var orderId1   = placeOrder(customerId);
        var orderId2   = placeOrder(customerId);
        placeOrder(UUID.randomUUID());
        var ordersByCustomer = SqlQueryTemplate.load("sql/orders_by_customer.sql").withAttribute("table", "orders");
        var cancelOrders     = SqlQueryTemplate.load("sql/cancel_orders_for_customer.sql").withAttribute("table", "orders");

        // When
        var rows = unitOfWorkFactory.withUnitOfWork(unitOfWork -> ordersByCustomer.query(unitOfWork, Map.of("customerId", customerId)));

        // Then
        assertThat(rows).hasSize(2);
        assertThat(rows).extracting(row -> row.get("id")).containsExactlyInAnyOrder(orderId1, orderId2);
        assertThat(rows).allSatisfy(row -> assertThat(row.get("version")).isEqualTo(1));

        // When a template update isn't committed
        var uncommitted = unitOfWorkFactory.withUnitOfWork(unitOfWork -> cancelOrders.execute(unitOfWork, Map.of("customerId", customerId)));

        // Then it's rolled back
        assertThat(uncommitted).isEqualTo(2);
        assertThat(unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.repository(ORDERS).load(orderId1)).isDiscarded()).isFalse();

        // When it's committed
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            cancelOrders.execute(unitOfWork, Map.of("customerId", customerId));
            unitOfWork.commit();
        });

        // Then
        var cancelled = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.repository(ORDERS).load(orderId1));
        assertThat(cancelled.isDiscarded()).isTrue();
        assertThat(cancelled.version()).isEqualTo(2);
    }

    @Test
    void verify_a_template_update_makes_a_concurrent_repository_update_fail() {
        // Given
        var customerId   = UUID.randomUUID();
        var orderId      = placeOrder(customerId);
        var cancelOrders = SqlQueryTemplate.load("sql/cancel_orders_for_customer.sql").withAttribute("table", "orders");
        var unitOfWork   = unitOfWorkFactory.startUnitOfWork();
        unitOfWork.repository(ORDERS).load(orderId).addItems(1);

        // When
        unitOfWorkFactory.usingUnitOfWork(other -> {
            cancelOrders.execute(other, Map.of("customerId", customerId));
            other.commit();
        });

        // Then
        assertThatThrownBy(unitOfWork::commit).isInstanceOf(ConcurrencyConflictException.class);
        unitOfWork.close();
    }

    @Test
    void verify_loading_the_same_order_twice_returns_the_tracked_instance() {
        // Given
        var orderId = placeOrder(UUID.randomUUID());

        // When
        var events = unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var orders = unitOfWork.repository(ORDERS);
            var order1 = orders.load(orderId);
            order1.addItems(2);
            var order2 = orders.load(orderId);
            order2.addItems(5);
            assertThat(order2).isSameAs(order1);
            assertThat(orders.find(orderId)).containsSame(order1);
            assertThat(orders.touchedAggregates()).hasSize(1);
            unitOfWork.commit();
            return unitOfWork.collectNewEvents().collect(Collectors.toList());
        });

        // Then
        assertThat(events).hasSize(2);
        var stored = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.repository(ORDERS).load(orderId));
        assertThat(stored.totalQuantity()).isEqualTo(7);
        assertThat(stored.version()).isEqualTo(3);
    }

    @Test
    void verify_a_serialization_failure_raised_by_a_query_template_is_a_concurrency_conflict() {
        var failingQuery = SqlQueryTemplate.load("sql/serialization_failure.sql");

        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> failingQuery.query(unitOfWork, Map.of())))
                .isExactlyInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("40001");
    }

    @Test
    void verify_the_connection_gets_its_isolation_level_back_when_the_session_is_closed() throws SQLException {
        try (var connection = DriverManager.getConnection(postgreSQLContainer.getJdbcUrl(), postgreSQLContainer.getUsername(), postgreSQLContainer.getPassword())) {
            // Given
            var originalIsolationLevel = connection.getTransactionIsolation();
            var singleConnectionJdbi = Jdbi.create(new ConnectionFactory() {
                @Override
                public Connection openConnection() {
                    return connection;
                }

                @Override
                public void closeConnection(Connection toClose) {
                    // The connection is closed by the test
                }
            });
            var serializableSessions = new JdbiStorageSessionFactory(singleConnectionJdbi,
                                                                     TransactionIsolationLevel.SERIALIZABLE,
                                                                     DatabaseConfiguration.DEFAULT_CONFLICT_SQL_STATES);

            // When
            var session = serializableSessions.openSession();
            session.begin();
            assertThat(connection.getTransactionIsolation()).isEqualTo(Connection.TRANSACTION_SERIALIZABLE);
            session.commit();
            session.close();

            // Then
            assertThat(originalIsolationLevel).isNotEqualTo(Connection.TRANSACTION_SERIALIZABLE);
            assertThat(connection.getTransactionIsolation()).isEqualTo(originalIsolationLevel);
            assertThat(connection.isClosed()).isFalse();
        }
    }
}
