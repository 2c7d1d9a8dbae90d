package dk.cloudcreate.essentials.domainpersistence.uow;

import dk.cloudcreate.essentials.domainpersistence.common.transaction.*;
import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * This interface creates {@link UnitOfWork}'s
 *
 * @param <SESSION> the storage session type of the {@link UnitOfWork}'s
 */
public interface UnitOfWorkFactory<SESSION extends StorageSession> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Create a new {@link UnitOfWork} with status {@link UnitOfWorkStatus#Ready}
     */
    UnitOfWork<SESSION> newUnitOfWork();

    /**
     * The repository slots every {@link UnitOfWork} is created with, in declaration order
     */
    List<RepositorySlot<SESSION, ?>> repositorySlots();

    UnitOfWorkConfiguration configuration();

    /**
     * Create and start a new {@link UnitOfWork}. Intended for try-with-resources
     */
    default UnitOfWork<SESSION> startUnitOfWork() {
        var unitOfWork = newUnitOfWork();
        unitOfWork.start();
        return unitOfWork;
    }

    /**
     * Start a new {@link UnitOfWork}, call the consumer with it and close it.<br>
     * The consumer must call {@link UnitOfWork#commit()} itself. If the consumer throws, the {@link UnitOfWork} is rolled back.
     * {@link RuntimeException}'s are rethrown unchanged, checked exceptions are wrapped in a {@link UnitOfWorkException}
     */
    default void usingUnitOfWork(CheckedConsumer<UnitOfWork<SESSION>> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        try (var unitOfWork = startUnitOfWork()) {
            try {
                unitOfWorkConsumer.accept(unitOfWork);
            } catch (RuntimeException e) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this usingUnitOfWork(CheckedConsumer) method call");
                rollbackKeepingCause(unitOfWork, e);
                throw e;
            } catch (Exception e) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this usingUnitOfWork(CheckedConsumer) method call");
                rollbackKeepingCause(unitOfWork, e);
                throw new UnitOfWorkException(e);
            }
        }
    }

    /**
     * Start a new {@link UnitOfWork}, call the function with it, close it and return the function's result.<br>
     * Same commit and exception semantics as {@link #usingUnitOfWork(CheckedConsumer)}
     */
    default <R> R withUnitOfWork(CheckedFunction<UnitOfWork<SESSION>, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        try (var unitOfWork = startUnitOfWork()) {
            try {
                return unitOfWorkFunction.apply(unitOfWork);
            } catch (RuntimeException e) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
                rollbackKeepingCause(unitOfWork, e);
                throw e;
            } catch (Exception e) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
                rollbackKeepingCause(unitOfWork, e);
                throw new UnitOfWorkException(e);
            }
        }
    }

    /**
     * Roll back after the scope threw <code>cause</code>. A rollback failure is added to <code>cause</code> as suppressed
     */
    private static void rollbackKeepingCause(UnitOfWork<?> unitOfWork, Exception cause) {
        try {
            unitOfWork.rollback(cause);
        } catch (RuntimeException rollbackException) {
            unitOfWorkLog.error("Failed to roll back the UnitOfWork", rollbackException);
            cause.addSuppressed(rollbackException);
        }
    }
}
