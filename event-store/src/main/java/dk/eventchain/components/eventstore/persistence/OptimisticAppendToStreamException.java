package dk.eventchain.components.eventstore.persistence;

/**
 * Thrown when events couldn't be appended because another writer already stored events for the same
 * aggregate versions (or the aggregate's persisted version differs from the expected version)
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public OptimisticAppendToStreamException(String msg) {
        super(msg);
    }

    public OptimisticAppendToStreamException(String msg, RuntimeException cause) {
        super(msg, cause);
    }
}
