package dk.eventchain.components.common.transaction.jdbi;

import dk.eventchain.components.common.transaction.*;
import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * {@link HandleAwareUnitOfWorkFactory} where the {@link UnitOfWork} manually manages the underlying
 * Jdbi {@link Handle} and database transaction.<br>
 * The active {@link UnitOfWork} is bound to the current thread until it's committed or rolled back, at which point
 * the {@link Handle} is closed.
 */
public class JdbiUnitOfWorkFactory implements HandleAwareUnitOfWorkFactory<JdbiUnitOfWorkFactory.JdbiUnitOfWork> {
    private static final Logger log = LoggerFactory.getLogger(JdbiUnitOfWorkFactory.class);

    private final Jdbi                         jdbi;
    private final ThreadLocal<JdbiUnitOfWork> unitOfWorks = new ThreadLocal<>();

    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public JdbiUnitOfWork getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public JdbiUnitOfWork getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            log.trace("Creating new UnitOfWork");
            unitOfWork = new JdbiUnitOfWork();
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<JdbiUnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    private void removeUnitOfWork() {
        log.trace("Removing UnitOfWork from the current thread");
        unitOfWorks.remove();
    }

    public class JdbiUnitOfWork implements HandleAwareUnitOfWork {
        private UnitOfWorkStatus status;
        private Handle           handle;
        private Exception        causeOfRollback;

        JdbiUnitOfWork() {
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted()) {
                log.trace("Starting UnitOfWork with initial status {}", status);
                handle = jdbi.open();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
            } else {
                close();
                throw new UnitOfWorkException(msg("Cannot start the UnitOfWork as it has status {} and not the expected status {}, {} or {}",
                                                  status,
                                                  UnitOfWorkStatus.Ready,
                                                  UnitOfWorkStatus.Committed,
                                                  UnitOfWorkStatus.RolledBack));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.Started) {
                log.trace("Committing UnitOfWork");
                try {
                    handle.commit();
                    status = UnitOfWorkStatus.Committed;
                } catch (RuntimeException e) {
                    causeOfRollback = e;
                    status = UnitOfWorkStatus.RolledBack;
                    throw new UnitOfWorkException("Failed to commit the UnitOfWork", e);
                } finally {
                    close();
                }
            } else if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                var cause = causeOfRollback;
                rollback(cause);
                throw new UnitOfWorkException("The UnitOfWork was marked as rollback only and has been rolled back", cause);
            } else {
                throw new UnitOfWorkException(msg("Cannot commit the UnitOfWork as it has status {} and not the expected status {}",
                                                  status,
                                                  UnitOfWorkStatus.Started));
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                causeOfRollback = cause != null ? cause : causeOfRollback;
                log.debug("Rolling back UnitOfWork with status {}. Cause: {}", status, causeOfRollback != null ? causeOfRollback.getMessage() : "n/a");
                try {
                    handle.rollback();
                } finally {
                    status = UnitOfWorkStatus.RolledBack;
                    close();
                }
            } else if (!status.isCompleted()) {
                close();
                throw new UnitOfWorkException(msg("Cannot rollback the UnitOfWork as it has status {} and not the expected status {} or {}",
                                                  status,
                                                  UnitOfWorkStatus.Started,
                                                  UnitOfWorkStatus.MarkedForRollbackOnly), cause);
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                log.debug("Marking UnitOfWork as rollback only. Cause: {}", cause != null ? cause.getMessage() : "n/a");
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            } else {
                throw new UnitOfWorkException(msg("Cannot mark the UnitOfWork as rollback only as it has status {} and not the expected status {}",
                                                  status,
                                                  UnitOfWorkStatus.Started));
            }
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted()) {
                throw new UnitOfWorkException(msg("No active transaction. UnitOfWork status {}", status));
            }
            return handle;
        }

        private void close() {
            removeUnitOfWork();
            if (handle == null) {
                return;
            }
            log.trace("Closing JDBI handle");
            try {
                handle.close();
            } catch (Exception e) {
                log.error("Failed to close JDBI handle", e);
            }
            handle = null;
        }
    }
}
