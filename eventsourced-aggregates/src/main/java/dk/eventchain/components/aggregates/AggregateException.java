package dk.eventchain.components.aggregates;

public class AggregateException extends RuntimeException {
    public AggregateException() {
    }

    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregateException(Throwable cause) {
        super(cause);
    }
}
