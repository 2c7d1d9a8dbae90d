package dk.cloudcreate.essentials.domainpersistence.model;

import dk.cloudcreate.essentials.domainpersistence.model.test_data.Order;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class EntityTest {
    @Test
    void verify_a_new_entity_starts_at_the_initial_version() {
        // When
        var order = new Order(UUID.randomUUID(), UUID.randomUUID());

        // Then
        assertThat(order.version()).isEqualTo(Entity.INITIAL_VERSION);
        assertThat(order.isDiscarded()).isFalse();
        assertThat(order.updatedAt()).isEqualTo(order.registeredAt());
    }

    @Test
    void verify_each_update_increases_the_version_by_one() {
        // Given
        var order = new Order(UUID.randomUUID(), UUID.randomUUID());
        var previousUpdatedAt = order.updatedAt();

        for (int i = 1; i <= 10; i++) {
            // When
            order.update();

            // Then
            assertThat(order.version()).isEqualTo(Entity.INITIAL_VERSION + i);
            assertThat(order.updatedAt()).isAfterOrEqualTo(previousUpdatedAt);
            assertThat(order.updatedAt()).isAfterOrEqualTo(order.registeredAt());
            previousUpdatedAt = order.updatedAt();
        }
    }

    @Test
    void verify_update_fails_after_discard_and_leaves_the_state_untouched() {
        // Given
        var order = new Order(UUID.randomUUID(), UUID.randomUUID());
        assertThat(order.version()).isEqualTo(1);
        order.update();
        order.update();
        assertThat(order.version()).isEqualTo(3);

        // When
        order.discard();
        var updatedAtWhenDiscarded = order.updatedAt();

        // Then
        assertThat(order.isDiscarded()).isTrue();
        assertThatThrownBy(order::update)
                .isExactlyInstanceOf(EntityDiscardedException.class)
                .hasMessageContaining(order.id().toString());
        assertThat(order.version()).isEqualTo(3);
        assertThat(order.updatedAt()).isEqualTo(updatedAtWhenDiscarded);
        assertThat(order.isDiscarded()).isTrue();
    }

    @Test
    void verify_discard_is_irreversible() {
        // Given
        var order = new Order(UUID.randomUUID(), UUID.randomUUID());
        order.discard();

        // Then
        assertThatThrownBy(order::discard).isExactlyInstanceOf(EntityDiscardedException.class);
        assertThatThrownBy(() -> order.addProduct(UUID.randomUUID(), 1)).isExactlyInstanceOf(EntityDiscardedException.class);
        assertThat(order.version()).isEqualTo(1);
    }

    @Test
    void verify_equality_is_based_on_the_id() {
        // Given
        var orderId    = UUID.randomUUID();
        var registered = Instant.now();
        var order      = new Order(orderId, 5, false, registered, registered, UUID.randomUUID());
        var sameOrder  = new Order(orderId, 7, true, registered, registered.plusSeconds(10), UUID.randomUUID());
        var otherOrder = new Order(UUID.randomUUID(), 5, false, registered, registered, order.customerId());

        // Then
        assertThat(order).isEqualTo(sameOrder);
        assertThat(order.hashCode()).isEqualTo(sameOrder.hashCode());
        assertThat(order).isNotEqualTo(otherOrder);
    }

    @Test
    void verify_a_restored_entity_keeps_the_stored_state() {
        // Given
        var orderId      = UUID.randomUUID();
        var registeredAt = Instant.parse("2022-01-01T10:00:00Z");
        var updatedAt    = Instant.parse("2022-02-01T10:00:00Z");

        // When
        var order = new Order(orderId, 5, false, registeredAt, updatedAt, UUID.randomUUID());

        // Then
        assertThat(order.id()).isEqualTo(orderId);
        assertThat(order.version()).isEqualTo(5);
        assertThat(order.registeredAt()).isEqualTo(registeredAt);
        assertThat(order.updatedAt()).isEqualTo(updatedAt);
        assertThat(order.hasPendingEvents()).isFalse();
    }

    @Test
    void verify_a_restored_entity_must_have_valid_state() {
        var registeredAt = Instant.parse("2022-01-01T10:00:00Z");
        assertThatThrownBy(() -> new Order(UUID.randomUUID(), -1, false, registeredAt, registeredAt, UUID.randomUUID()))
                .isInstanceOf(RuntimeException.class);
        assertThatThrownBy(() -> new Order(UUID.randomUUID(), 1, false, registeredAt, registeredAt.minusSeconds(1), UUID.randomUUID()))
                .isInstanceOf(RuntimeException.class);
        assertThatThrownBy(() -> new Order(null, UUID.randomUUID()))
                .isInstanceOf(RuntimeException.class);
    }

    @Test
    void test_representation() {
        // Given
        var orderId    = UUID.randomUUID();
        var customerId = UUID.randomUUID();
        var order      = new Order(orderId, customerId);

        // Then
        assertThat(order.toString()).isEqualTo("<Order '" + orderId + "' (customerId=" + customerId + ")>");

        // When
        order.discard();

        // Then
        assertThat(order.toString()).isEqualTo("**DISCARDED** <Order '" + orderId + "' (customerId=" + customerId + ")>");
    }
}
