package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.domainpersistence.model.message.Message;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Converts {@link Message}'s to and from {@link PersistentMessage}'s.<br>
 * The field data of a message is derived from the message's own fields (shallow) using Jackson, and the message is
 * reconstructed by resolving its type through the {@link MessageTypeRegistry}.<br>
 * Use {@link #createObjectMapper()} as the starting point if you supply your own {@link ObjectMapper}
 */
public final class PersistentMessageCodec {
    private static final Logger                                        log          = LoggerFactory.getLogger(PersistentMessageCodec.class);
    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_DATA   = new TypeReference<>() {
    };

    private final ObjectMapper        objectMapper;
    private final MessageTypeRegistry messageTypeRegistry;

    public PersistentMessageCodec(MessageTypeRegistry messageTypeRegistry) {
        this(createObjectMapper(), messageTypeRegistry);
    }

    public PersistentMessageCodec(ObjectMapper objectMapper, MessageTypeRegistry messageTypeRegistry) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
        this.messageTypeRegistry = requireNonNull(messageTypeRegistry, "No messageTypeRegistry provided");
    }

    /**
     * Create an {@link ObjectMapper} that maps messages by their fields, writes <code>java.time</code> values as
     * ISO-8601 strings and rejects unknown or missing creator properties
     */
    public static ObjectMapper createObjectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        objectMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES);
        objectMapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        objectMapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        objectMapper.setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY);
        return objectMapper;
    }

    public MessageTypeRegistry messageTypeRegistry() {
        return messageTypeRegistry;
    }

    /**
     * Capture the concrete type and the field data of a message
     *
     * @param message the message
     * @return the persistent version of the message
     */
    public PersistentMessage toPersistentMessage(Message message) {
        requireNonNull(message, "No message provided");
        var messageType = message.getClass();
        Map<String, Object> data;
        try {
            data = objectMapper.convertValue(message, FIELD_DATA);
        } catch (IllegalArgumentException e) {
            throw new MessageSerializationException(msg("Failed to extract the field data of message type '{}'", messageType.getName()), e);
        }
        return new PersistentMessage(MessageTypeRegistry.typeLocatorOf(messageType),
                                     MessageTypeRegistry.typeNameOf(messageType),
                                     data);
    }

    /**
     * Reconstruct the message held by a {@link PersistentMessage}
     *
     * @param persistentMessage the persistent message
     * @return the reconstructed message
     * @throws TypeResolutionException        if the type-locator/type-name isn't registered
     * @throws MessageReconstructionException if the field data doesn't match the fields of the resolved type
     */
    public Message load(PersistentMessage persistentMessage) {
        requireNonNull(persistentMessage, "No persistentMessage provided");
        var registeredType = messageTypeRegistry.resolve(persistentMessage.typeLocator(), persistentMessage.typeName());
        log.trace("Reconstructing '{}' from '{}' / '{}'", registeredType.messageType.getName(), persistentMessage.typeLocator(), persistentMessage.typeName());
        return reconstruct(registeredType, persistentMessage.data());
    }

    private <M extends Message> M reconstruct(MessageTypeRegistry.RegisteredMessageType<M> registeredType, Map<String, Object> data) {
        try {
            M message = registeredType.factory().isPresent() ?
                        registeredType.factory().get().create(data) :
                        objectMapper.convertValue(data, registeredType.messageType);
            if (message == null) {
                throw new MessageReconstructionException(msg("Reconstructing '{}' didn't produce a message", registeredType.messageType.getName()), null);
            }
            if (!registeredType.messageType.isInstance(message)) {
                throw new MessageReconstructionException(msg("Reconstructing '{}' produced a '{}'",
                                                             registeredType.messageType.getName(),
                                                             message.getClass().getName()),
                                                         null);
            }
            return message;
        } catch (MessageReconstructionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessageReconstructionException(msg("Field data {} doesn't match the fields of message type '{}'",
                                                         data.keySet(),
                                                         registeredType.messageType.getName()),
                                                     e);
        }
    }

    /**
     * Serialize a {@link PersistentMessage} to its JSON form
     */
    public String toJson(PersistentMessage persistentMessage) {
        requireNonNull(persistentMessage, "No persistentMessage provided");
        try {
            return objectMapper.writeValueAsString(persistentMessage);
        } catch (JsonProcessingException e) {
            throw new MessageSerializationException(msg("Failed to serialize {} to JSON", persistentMessage), e);
        }
    }

    /**
     * Deserialize a {@link PersistentMessage} from its JSON form
     */
    public PersistentMessage fromJson(String json) {
        requireNonNull(json, "No json provided");
        try {
            return objectMapper.readValue(json, PersistentMessage.class);
        } catch (JsonProcessingException e) {
            throw new MessageSerializationException("Failed to deserialize PersistentMessage JSON", e);
        }
    }
}
