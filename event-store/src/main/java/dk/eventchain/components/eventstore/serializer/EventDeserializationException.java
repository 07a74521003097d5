package dk.eventchain.components.eventstore.serializer;

import dk.eventchain.components.eventstore.EventStoreException;

public class EventDeserializationException extends EventStoreException {
    public EventDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
