package dk.cloudcreate.essentials.domainpersistence.common.transaction;

/**
 * Thrown when the session or a repository of a UnitOfWork is accessed while the UnitOfWork
 * isn't {@link UnitOfWorkStatus#Started}
 */
public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
    }

    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }

    public NoActiveUnitOfWorkException(String message, Throwable cause) {
        super(message, cause);
    }
}
