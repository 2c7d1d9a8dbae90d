package dk.cloudcreate.essentials.domainpersistence.common.transaction;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyConflictExceptionTest {
    @Test
    void verify_a_version_conflict_describes_the_aggregate() {
        var aggregateId = UUID.randomUUID();

        var exception = new ConcurrencyConflictException(String.class, aggregateId, 3);

        assertThat(exception).isInstanceOf(UnitOfWorkException.class);
        assertThat(exception.aggregateType()).contains(String.class);
        assertThat(exception.aggregateId()).contains(aggregateId);
        assertThat(exception.expectedVersion()).contains(3);
        assertThat(exception.getMessage()).contains("java.lang.String", aggregateId.toString(), "expected stored version 3");
    }

    @Test
    void verify_a_conflict_reported_by_the_database_has_no_aggregate_details() {
        var cause = new RuntimeException("could not serialize access due to concurrent update");

        var exception = new ConcurrencyConflictException("Serialization failure", cause);

        assertThat(exception.getCause()).isSameAs(cause);
        assertThat(exception.aggregateType()).isEmpty();
        assertThat(exception.aggregateId()).isEmpty();
        assertThat(exception.expectedVersion()).isEmpty();
    }

    @Test
    void test_completed_statuses() {
        assertThat(UnitOfWorkStatus.Ready.isCompleted()).isFalse();
        assertThat(UnitOfWorkStatus.Started.isCompleted()).isFalse();
        assertThat(UnitOfWorkStatus.Committed.isCompleted()).isTrue();
        assertThat(UnitOfWorkStatus.RolledBack.isCompleted()).isTrue();
        assertThat(UnitOfWorkStatus.Closed.isCompleted()).isTrue();
    }
}
