package dk.eventchain.components.common.transaction;

public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork");
    }

    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }
}
