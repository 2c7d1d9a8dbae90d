package dk.cloudcreate.essentials.domainpersistence.model;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a mutation is attempted on an {@link Entity} that has been {@link Entity#discard() discarded}
 */
public class EntityDiscardedException extends DomainModelException {
    public final Class<?> entityType;
    public final Object   entityId;

    public EntityDiscardedException(Class<?> entityType, Object entityId) {
        super(msg("{} with id '{}' is discarded", entityType.getSimpleName(), entityId));
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
