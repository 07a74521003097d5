package dk.eventchain.components.common.transaction;

import dk.eventchain.components.common.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * This interface creates a {@link UnitOfWork}
 *
 * @param <UOW> the {@link UnitOfWork} sub-type returned by the {@link UnitOfWorkFactory}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get a required active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the is no active {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * Get the current {@link UnitOfWork} or create a new {@link UnitOfWork}
     * if one is missing
     *
     * @return a {@link UnitOfWork}
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    /**
     * Run the <code>unitOfWorkConsumer</code> inside the current {@link UnitOfWork} or, if none is active, inside a new {@link UnitOfWork}
     * that is committed when the consumer returns and rolled back if it fails.<br>
     * A {@link RuntimeException} thrown by the consumer is rethrown as is, checked exceptions are wrapped in a {@link UnitOfWorkException}
     *
     * @param unitOfWorkConsumer the work to perform
     */
    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Run the <code>unitOfWorkFunction</code> inside the current {@link UnitOfWork} or, if none is active, inside a new {@link UnitOfWork}
     * that is committed when the function returns and rolled back if it fails.<br>
     * A {@link RuntimeException} thrown by the function is rethrown as is, checked exceptions are wrapped in a {@link UnitOfWorkException}
     *
     * @param unitOfWorkFunction the work to perform
     * @param <R>                the result type
     * @return the result of the <code>unitOfWorkFunction</code>
     */
    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.trace("Creating a new UnitOfWork for this withUnitOfWork(CheckedFunction) method call as there wasn't an existing UnitOfWork");
            return getOrCreateNewUnitOfWork();
        });
        existingUnitOfWork.ifPresent(uow -> unitOfWorkLog.trace("NestedUnitOfWork: Reusing existing UnitOfWork for this withUnitOfWork(CheckedFunction) method call"));
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.trace("Committing the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.commit();
            } else {
                unitOfWorkLog.trace("NestedUnitOfWork: Won't commit the UnitOfWork as it wasn't created by this withUnitOfWork(CheckedFunction) method call");
            }
            return result;
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Marking UnitOfWork as rollback only as it wasn't created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }
}
