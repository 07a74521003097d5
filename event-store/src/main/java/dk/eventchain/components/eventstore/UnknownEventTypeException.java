package dk.eventchain.components.eventstore;

import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Thrown when an event type cannot be resolved to a Java class or when no handler matches an event payload
 */
public class UnknownEventTypeException extends EventStoreException {
    public final CharSequence eventType;

    public UnknownEventTypeException(CharSequence eventType, Throwable cause) {
        super(msg("Couldn't resolve event type '{}'", eventType), cause);
        this.eventType = eventType;
    }

    public UnknownEventTypeException(String message, CharSequence eventType) {
        super(message);
        this.eventType = eventType;
    }
}
