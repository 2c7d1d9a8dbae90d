package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

import dk.cloudcreate.essentials.domainpersistence.model.message.Message;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Explicit registry of the {@link Message} types that a {@link PersistentMessageCodec} can reconstruct.<br>
 * Every module that defines message types registers them at process start:
 * <pre>{@code
 * registry.register(OrderPlaced.class)
 *         .register(ProductAdded.class)
 *         // OrderCreated was renamed to OrderPlaced
 *         .register("com.acme.orders", "OrderCreated", OrderPlaced.class);
 * }</pre>
 * Resolution is a plain lookup of the (type-locator, type-name) pair and fails closed with a {@link TypeResolutionException}.<br>
 * The type-locator of a class is its package name and the type-name is the class name relative to the package
 * (nested classes keep the <code>$</code> separator, e.g. <code>OrderEvents$OrderPlaced</code>)
 */
public final class MessageTypeRegistry {
    private static final Logger log = LoggerFactory.getLogger(MessageTypeRegistry.class);

    private final ConcurrentMap<TypeKey, RegisteredMessageType<?>> registeredTypes = new ConcurrentHashMap<>();

    /**
     * Register a message type under its own type-locator and type-name. The type is reconstructed using the
     * codec's Jackson <code>ObjectMapper</code>, i.e. it needs a Jackson creator (<code>@JsonCreator</code>) constructor
     *
     * @param messageType the concrete message type
     * @return this registry
     */
    public <M extends Message> MessageTypeRegistry register(Class<M> messageType) {
        requireNonNull(messageType, "No messageType provided");
        return register(typeLocatorOf(messageType), typeNameOf(messageType), messageType);
    }

    /**
     * Register a message type under an explicit type-locator and type-name, e.g. to keep messages stored under a
     * previous name of the type resolvable
     *
     * @param typeLocator the type-locator
     * @param typeName    the type-name
     * @param messageType the concrete message type
     * @return this registry
     */
    public <M extends Message> MessageTypeRegistry register(String typeLocator, String typeName, Class<M> messageType) {
        return add(new RegisteredMessageType<>(typeLocator, typeName, messageType, null));
    }

    /**
     * Register a message type with a custom factory
     *
     * @param typeLocator the type-locator
     * @param typeName    the type-name
     * @param messageType the concrete message type
     * @param factory     the factory that constructs the message from its field data
     * @return this registry
     */
    public <M extends Message> MessageTypeRegistry register(String typeLocator, String typeName, Class<M> messageType, MessageFactory<M> factory) {
        return add(new RegisteredMessageType<>(typeLocator, typeName, messageType, requireNonNull(factory, "No factory provided")));
    }

    private MessageTypeRegistry add(RegisteredMessageType<?> registeredType) {
        var key = new TypeKey(registeredType.typeLocator, registeredType.typeName);
        var existing = registeredTypes.putIfAbsent(key, registeredType);
        if (existing != null && !existing.messageType.equals(registeredType.messageType)) {
            throw new IllegalArgumentException(msg("type-locator '{}' and type-name '{}' is already registered for '{}' - cannot register '{}'",
                                                   key.typeLocator,
                                                   key.typeName,
                                                   existing.messageType.getName(),
                                                   registeredType.messageType.getName()));
        }
        if (existing == null) {
            log.debug("Registered message type '{}' as '{}' / '{}'", registeredType.messageType.getName(), key.typeLocator, key.typeName);
        }
        return this;
    }

    /**
     * Resolve a registered message type
     *
     * @param typeLocator the type-locator
     * @param typeName    the type-name
     * @return the registered message type
     * @throws TypeResolutionException if nothing is registered for the pair
     */
    public RegisteredMessageType<?> resolve(String typeLocator, String typeName) {
        var registeredType = registeredTypes.get(new TypeKey(typeLocator, typeName));
        if (registeredType == null) {
            throw new TypeResolutionException(typeLocator, typeName);
        }
        return registeredType;
    }

    public boolean isRegistered(String typeLocator, String typeName) {
        return registeredTypes.containsKey(new TypeKey(typeLocator, typeName));
    }

    /**
     * @return the type-locator of the given type, i.e. its package name
     */
    public static String typeLocatorOf(Class<?> type) {
        return requireNonNull(type, "No type provided").getPackageName();
    }

    /**
     * @return the type-name of the given type, i.e. its class name relative to its package
     */
    public static String typeNameOf(Class<?> type) {
        var typeLocator = typeLocatorOf(type);
        return typeLocator.isEmpty() ? type.getName() : type.getName().substring(typeLocator.length() + 1);
    }

    /**
     * A message type known by the {@link MessageTypeRegistry}
     *
     * @param <M> the message type
     */
    public static final class RegisteredMessageType<M extends Message> {
        public final String   typeLocator;
        public final String   typeName;
        public final Class<M> messageType;
        private final MessageFactory<M> factory;

        private RegisteredMessageType(String typeLocator, String typeName, Class<M> messageType, MessageFactory<M> factory) {
            this.typeLocator = requireNonNull(typeLocator, "No typeLocator provided");
            this.typeName = requireNonNull(typeName, "No typeName provided");
            this.messageType = requireNonNull(messageType, "No messageType provided");
            this.factory = factory;
        }

        /**
         * @return the custom factory, or {@link Optional#empty()} if the type is reconstructed by the codec's ObjectMapper
         */
        public Optional<MessageFactory<M>> factory() {
            return Optional.ofNullable(factory);
        }
    }

    private static final class TypeKey {
        private final String typeLocator;
        private final String typeName;

        private TypeKey(String typeLocator, String typeName) {
            this.typeLocator = requireNonNull(typeLocator, "No typeLocator provided");
            this.typeName = requireNonNull(typeName, "No typeName provided");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TypeKey)) return false;
            var that = (TypeKey) o;
            return typeLocator.equals(that.typeLocator) && typeName.equals(that.typeName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(typeLocator, typeName);
        }
    }
}
