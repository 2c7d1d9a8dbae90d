package dk.cloudcreate.essentials.domainpersistence.postgresql;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.UnitOfWorkException;

/**
 * A SQL template couldn't be found or read
 */
public class QueryTemplateException extends UnitOfWorkException {
    public QueryTemplateException(String message) {
        super(message);
    }

    public QueryTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
