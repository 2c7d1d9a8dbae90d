package dk.cloudcreate.essentials.domainpersistence.model.message;

/**
 * An intent directed at the system. Commands don't refer to the aggregate that will handle them
 *
 * @see AbstractCommand
 */
public interface Command extends Message {
}
