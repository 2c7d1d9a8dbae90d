package dk.cloudcreate.essentials.domainpersistence.model.message.persistence;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The type locator and type name of a {@link PersistentMessage} couldn't be resolved to a registered message type,
 * e.g. because the type has been renamed or removed since the message was stored
 */
public class TypeResolutionException extends MessageException {
    public final String typeLocator;
    public final String typeName;

    public TypeResolutionException(String typeLocator, String typeName) {
        super(msg("No message type registered with type-locator '{}' and type-name '{}'", typeLocator, typeName));
        this.typeLocator = typeLocator;
        this.typeName = typeName;
    }
}
