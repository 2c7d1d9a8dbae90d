package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

public class MessageSerializationException extends MessageException {
    public MessageSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
