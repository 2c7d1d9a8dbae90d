package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

import dk.cloudcreate.essentials.domainpersistence.model.test_data.OrderCommands.PlaceOrder;
import dk.cloudcreate.essentials.domainpersistence.model.test_data.OrderEvents.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MessageTypeRegistryTest {
    @Test
    void test_type_locator_and_type_name_of_a_nested_class() {
        assertThat(MessageTypeRegistry.typeLocatorOf(OrderPlaced.class)).isEqualTo("dk.cloudcreate.essentials.domainpersistence.model.test_data");
        assertThat(MessageTypeRegistry.typeNameOf(OrderPlaced.class)).isEqualTo("OrderEvents$OrderPlaced");
        assertThat(MessageTypeRegistry.typeNameOf(String.class)).isEqualTo("String");
    }

    @Test
    void verify_registered_types_are_resolved() {
        // Given
        var registry = new MessageTypeRegistry().register(OrderPlaced.class);

        // When
        var registeredType = registry.resolve(MessageTypeRegistry.typeLocatorOf(OrderPlaced.class), "OrderEvents$OrderPlaced");

        // Then
        assertThat(registeredType.messageType).isEqualTo(OrderPlaced.class);
        assertThat(registeredType.factory()).isEmpty();
        assertThat(registry.isRegistered(registeredType.typeLocator, registeredType.typeName)).isTrue();
        assertThat(registry.isRegistered(registeredType.typeLocator, "OrderEvents$ProductAdded")).isFalse();
    }

    @Test
    void verify_registering_the_same_type_twice_is_allowed() {
        var registry = new MessageTypeRegistry().register(OrderPlaced.class);
        assertThatCode(() -> registry.register(OrderPlaced.class)).doesNotThrowAnyException();
    }

    @Test
    void verify_a_key_cannot_be_registered_for_two_different_types() {
        // Given
        var registry = new MessageTypeRegistry().register("com.acme", "Placed", OrderPlaced.class);

        // Then
        assertThatThrownBy(() -> registry.register("com.acme", "Placed", PlaceOrder.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_resolving_an_unknown_type_fails_closed() {
        assertThatThrownBy(() -> new MessageTypeRegistry().resolve("com.acme", "Unknown"))
                .isExactlyInstanceOf(TypeResolutionException.class)
                .hasMessageContaining("com.acme")
                .hasMessageContaining("Unknown");
    }
}
