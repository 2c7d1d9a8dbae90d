package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

import dk.cloudcreate.essentials.domainpersistence.model.message.Message;

import java.util.Map;

/**
 * Constructs a concrete {@link Message} from the field data of a {@link PersistentMessage}
 *
 * @param <M> the message type
 */
@FunctionalInterface
public interface MessageFactory<M extends Message> {
    /**
     * @param data the flat field data (field name to value)
     * @return the reconstructed message
     * @throws RuntimeException if the data doesn't match the fields of the message type
     */
    M create(Map<String, Object> data);
}
