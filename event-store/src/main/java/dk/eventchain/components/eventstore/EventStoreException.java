package dk.eventchain.components.eventstore;

/**
 * Base exception for all failures reported by the {@link EventStore} and its collaborators
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException() {
    }

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventStoreException(Throwable cause) {
        super(cause);
    }
}
