package dk.eventchain.components.eventstore.serializer;

import dk.eventchain.components.eventstore.hashchain.HashChain;
import dk.eventchain.components.eventstore.types.EventType;

/**
 * Serializer and deserializer of event payloads.<br>
 * Implementations MUST be deterministic, i.e. serializing two equal payloads MUST produce byte identical results,
 * since the serialized bytes are part of the hash computed by the {@link HashChain}
 */
public interface EventSerializer {
    /**
     * Serialize an event payload
     *
     * @param payload the payload to serialize
     * @return the serialized payload
     * @throws EventSerializationException in case the payload couldn't be serialized
     */
    byte[] serialize(Object payload);

    /**
     * Deserialize the <code>serializedPayload</code> into the Java type specified by the <code>eventType</code>
     *
     * @param serializedPayload the serialized payload
     * @param eventType         the type of the payload
     * @return the deserialized payload
     * @throws EventDeserializationException in case the payload couldn't be deserialized
     * @throws dk.eventchain.components.eventstore.UnknownEventTypeException in case the event type couldn't be resolved to a Java class
     */
    default Object deserialize(byte[] serializedPayload, EventType eventType) {
        return deserialize(serializedPayload, eventType.toJavaClass());
    }

    /**
     * Deserialize the <code>serializedPayload</code> into the specified <code>javaType</code>
     *
     * @param serializedPayload the serialized payload
     * @param javaType          the Java type that the payload should be deserialized into
     * @param <T>               the corresponding Java type
     * @return the deserialized payload
     * @throws EventDeserializationException in case the payload couldn't be deserialized
     */
    <T> T deserialize(byte[] serializedPayload, Class<T> javaType);
}
