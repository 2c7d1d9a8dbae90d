package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.essentials.domainpersistence.model.message.Message;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Storage neutral, type erased, representation of a {@link Message} that allows the message to be reconstructed
 * later without static knowledge of its concrete type
 * <pre>{@code
 * {"typeLocator": "com.acme.orders", "typeName": "OrderEvents$OrderPlaced", "data": {"raisedAt": "...", ...}}
 * }</pre>
 *
 * @see PersistentMessageCodec
 */
public final class PersistentMessage {
    private final String              typeLocator;
    private final String              typeName;
    private final Map<String, Object> data;

    @JsonCreator
    public PersistentMessage(@JsonProperty("typeLocator") String typeLocator,
                             @JsonProperty("typeName") String typeName,
                             @JsonProperty("data") Map<String, Object> data) {
        this.typeLocator = requireNonNull(typeLocator, "No typeLocator provided");
        this.typeName = requireNonNull(typeName, "No typeName provided");
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(data, "No data provided")));
    }

    /**
     * Capture the type and field data of the message
     *
     * @param message the message
     * @param codec   the codec that extracts the field data
     * @return the persistent version of the message
     */
    public static PersistentMessage create(Message message, PersistentMessageCodec codec) {
        return requireNonNull(codec, "No codec provided").toPersistentMessage(message);
    }

    /**
     * Reconstruct the original message
     *
     * @param codec the codec that resolves the message type
     * @return the reconstructed message
     * @throws TypeResolutionException        if the type isn't known by the codec's registry
     * @throws MessageReconstructionException if the field data doesn't match the type
     */
    public Message loadObject(PersistentMessageCodec codec) {
        return requireNonNull(codec, "No codec provided").load(this);
    }

    @JsonProperty("typeLocator")
    public String typeLocator() {
        return typeLocator;
    }

    @JsonProperty("typeName")
    public String typeName() {
        return typeName;
    }

    @JsonProperty("data")
    public Map<String, Object> data() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var that = (PersistentMessage) o;
        return typeLocator.equals(that.typeLocator) && typeName.equals(that.typeName) && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeLocator, typeName, data);
    }

    @Override
    public String toString() {
        return "PersistentMessage{" +
                "typeLocator='" + typeLocator + '\'' +
                ", typeName='" + typeName + '\'' +
                ", data=" + data +
                '}';
    }
}
