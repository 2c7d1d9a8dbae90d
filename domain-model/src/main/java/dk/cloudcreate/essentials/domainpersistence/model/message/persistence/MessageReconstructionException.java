package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

/**
 * The field data of a {@link PersistentMessage} didn't match the fields required by the resolved message type
 */
public class MessageReconstructionException extends MessageException {
    public MessageReconstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
