package dk.eventchain.components.eventstore.serializer;

import dk.eventchain.components.eventstore.EventStoreException;

public class EventSerializationException extends EventStoreException {
    public EventSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
