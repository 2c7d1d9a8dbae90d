package dk.cloudcreate.essentials.domainpersistence.postgresql;

import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Set;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Logs the statements executed through a {@link JdbiStorageSession} using the <code>UnitOfWork.Sql</code> logger.<br>
 * Failures with one of the conflict SQL states are expected under concurrent load and are only logged at debug level
 */
public class UnitOfWorkSqlLogger implements org.jdbi.v3.core.statement.SqlLogger {
    private final Logger      log;
    private final Set<String> conflictSqlStates;

    public UnitOfWorkSqlLogger(Set<String> conflictSqlStates) {
        this.conflictSqlStates = Set.copyOf(requireNonNull(conflictSqlStates, "No conflictSqlStates provided"));
        log = LoggerFactory.getLogger("UnitOfWork.Sql");
    }

    @Override
    public void logBeforeExecution(StatementContext context) {

    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}", Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        var description = msg("Failed Execution time: {} ms - {}", Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis(), context.getRenderedSql());
        if (ex.getSQLState() != null && conflictSqlStates.contains(ex.getSQLState())) {
            log.debug(msg("{} - concurrency conflict with SQL state {}", description, ex.getSQLState()));
        } else {
            log.error(description, ex);
        }
    }
}
