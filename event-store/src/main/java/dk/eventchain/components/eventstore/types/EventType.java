package dk.eventchain.components.eventstore.types;

import dk.eventchain.components.eventstore.UnknownEventTypeException;
import dk.eventchain.components.common.types.CharSequenceType;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * The type tag (aka. topic) of an event payload.<br>
 * The serialized form is {@value #FQCN_PREFIX} followed by the Fully Qualified Class Name of the payload class,
 * e.g. <code>FQCN:com.acme.OrderPlaced</code>
 */
public class EventType extends CharSequenceType<EventType> {
    public static final String FQCN_PREFIX = "FQCN:";

    public EventType(CharSequence value) {
        super(ensureSerializedForm(value));
    }

    private static CharSequence ensureSerializedForm(CharSequence value) {
        requireNonNull(value, "No value provided");
        var stringValue = value.toString();
        requireFalse(stringValue.isBlank(), "The event type value must not be blank");
        if (isSerializedEventType(stringValue)) {
            requireTrue(stringValue.length() > FQCN_PREFIX.length(), msg("The event type value '{}' doesn't contain a class name", stringValue));
            return stringValue;
        }
        return FQCN_PREFIX + stringValue;
    }

    /**
     * Create an {@link EventType} from either a Fully Qualified Class Name or from the serialized form (prefixed with {@value #FQCN_PREFIX})
     */
    public static EventType of(CharSequence fqcnOrSerializedEventType) {
        return new EventType(fqcnOrSerializedEventType);
    }

    public static EventType of(Class<?> eventType) {
        requireNonNull(eventType, "No eventType provided");
        return new EventType(eventType.getName());
    }

    public static boolean isSerializedEventType(CharSequence value) {
        return value != null && value.toString().startsWith(FQCN_PREFIX);
    }

    /**
     * @return the Fully Qualified Class Name without the {@value #FQCN_PREFIX}
     */
    public String getJavaTypeName() {
        return value().substring(FQCN_PREFIX.length());
    }

    /**
     * Resolve the Java class that this event type represents
     *
     * @return the Java class
     * @throws UnknownEventTypeException in case the class cannot be resolved
     */
    public Class<?> toJavaClass() {
        var javaTypeName = getJavaTypeName();
        try {
            return Class.forName(javaTypeName, false, resolveClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new UnknownEventTypeException(this, e);
        }
    }

    private static ClassLoader resolveClassLoader() {
        var contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : EventType.class.getClassLoader();
    }
}
