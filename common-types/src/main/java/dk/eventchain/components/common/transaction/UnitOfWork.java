package dk.eventchain.components.common.transaction;

/**
 * A scoped store session, i.e. a transaction together with the resources it holds.<br>
 * A {@link UnitOfWork} is obtained from a {@link UnitOfWorkFactory} and is always completed by either
 * {@link #commit()} or {@link #rollback(Exception)}, which releases any underlying resources.
 *
 * @see UnitOfWorkFactory#usingUnitOfWork(dk.eventchain.components.common.functional.CheckedConsumer)
 * @see UnitOfWorkFactory#withUnitOfWork(dk.eventchain.components.common.functional.CheckedFunction)
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and any underlying transaction
     */
    void start();

    /**
     * Commit the {@link UnitOfWork} and any underlying transaction - see {@link UnitOfWorkStatus#Committed}
     */
    void commit();

    /**
     * Roll back the {@link UnitOfWork} and any underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback
     */
    void rollback(Exception cause);

    /**
     * Get the status of the {@link UnitOfWork}
     */
    UnitOfWorkStatus status();

    /**
     * The cause of a Rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }

    void markAsRollbackOnly(Exception cause);

    /**
     * Roll back the {@link UnitOfWork} and any underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     */
    default void rollback() {
        // Use any exception saved using #markAsRollbackOnly(Exception)
        rollback(getCauseOfRollback());
    }
}
