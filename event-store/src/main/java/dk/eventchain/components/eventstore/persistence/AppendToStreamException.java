package dk.eventchain.components.eventstore.persistence;

import dk.eventchain.components.eventstore.EventStoreException;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, RuntimeException cause) {
        super(msg, cause);
    }
}
