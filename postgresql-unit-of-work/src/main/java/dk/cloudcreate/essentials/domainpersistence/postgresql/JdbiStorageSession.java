package dk.cloudcreate.essentials.domainpersistence.postgresql;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.*;
import dk.cloudcreate.essentials.shared.Exceptions;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.transaction.TransactionIsolationLevel;
import org.slf4j.*;

import java.sql.SQLException;
import java.util.Set;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link StorageSession} backed by a single Jdbi {@link Handle}.<br>
 * Errors reported with one of the configured conflict SQL states are translated to {@link ConcurrencyConflictException},
 * all other errors propagate unchanged
 */
public final class JdbiStorageSession implements StorageSession {
    private static final Logger log = LoggerFactory.getLogger(JdbiStorageSession.class);

    private final Handle                    handle;
    private final TransactionIsolationLevel isolationLevel;
    private final Set<String>               conflictSqlStates;
    private       TransactionIsolationLevel isolationLevelToRestore;
    private       boolean                   closed;

    JdbiStorageSession(Handle handle, TransactionIsolationLevel isolationLevel, Set<String> conflictSqlStates) {
        this.handle = requireNonNull(handle, "No handle provided");
        this.isolationLevel = requireNonNull(isolationLevel, "No isolationLevel provided");
        this.conflictSqlStates = requireNonNull(conflictSqlStates, "No conflictSqlStates provided");
    }

    /**
     * The Jdbi handle that statements in this session must be executed on
     *
     * @throws NoActiveUnitOfWorkException if the session has been closed
     */
    public Handle handle() {
        if (closed) {
            throw new NoActiveUnitOfWorkException("The storage session has been closed");
        }
        return handle;
    }

    @Override
    public void begin() {
        log.trace("Beginning transaction with isolation level {}", isolationLevel);
        if (isolationLevel != TransactionIsolationLevel.NONE && isolationLevel != TransactionIsolationLevel.UNKNOWN) {
            var currentIsolationLevel = handle().getTransactionIsolationLevel();
            if (currentIsolationLevel != isolationLevel) {
                handle.setTransactionIsolationLevel(isolationLevel);
                if (isolationLevelToRestore == null) {
                    isolationLevelToRestore = currentIsolationLevel;
                }
            }
        }
        handle().begin();
    }

    @Override
    public void commit() {
        log.trace("Committing transaction");
        try {
            handle().commit();
        } catch (RuntimeException e) {
            throw translateException(e);
        }
    }

    @Override
    public void rollback() {
        if (handle().isInTransaction()) {
            log.trace("Rolling back transaction");
            handle.rollback();
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        log.trace("Closing JDBI handle");
        closed = true;
        try {
            restoreIsolationLevel();
        } finally {
            handle.close();
        }
    }

    /**
     * The connection may be returned to a pool, so it must leave with the isolation level it was opened with
     */
    private void restoreIsolationLevel() {
        if (isolationLevelToRestore == null || isolationLevelToRestore == TransactionIsolationLevel.UNKNOWN) {
            return;
        }
        if (handle.isInTransaction()) {
            log.warn("Rolling back transaction that was still open while closing the session");
            handle.rollback();
        }
        log.trace("Restoring transaction isolation level {}", isolationLevelToRestore);
        handle.setTransactionIsolationLevel(isolationLevelToRestore);
        isolationLevelToRestore = null;
    }

    @Override
    public boolean isActive() {
        return !closed && handle.isInTransaction();
    }

    /**
     * Translate a storage error to a {@link ConcurrencyConflictException} if its root cause is an {@link SQLException}
     * with one of the conflict SQL states
     *
     * @param e the storage error
     * @return the {@link ConcurrencyConflictException} or <code>e</code> unchanged
     */
    public RuntimeException translateException(RuntimeException e) {
        requireNonNull(e, "No exception provided");
        if (e instanceof ConcurrencyConflictException) {
            return e;
        }
        var rootCause = Exceptions.getRootCause(e);
        if (rootCause instanceof SQLException) {
            var sqlState = ((SQLException) rootCause).getSQLState();
            if (sqlState != null && conflictSqlStates.contains(sqlState)) {
                return new ConcurrencyConflictException(msg("Concurrency conflict reported by the database with SQL state {}: {}", sqlState, rootCause.getMessage()), e);
            }
        }
        return e;
    }
}
