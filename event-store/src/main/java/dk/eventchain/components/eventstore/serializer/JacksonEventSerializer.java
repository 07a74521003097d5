package dk.eventchain.components.eventstore.serializer;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Jackson based {@link EventSerializer} that serializes payloads to UTF-8 encoded JSON.<br>
 * Use {@link #createCanonicalObjectMapper()} (the default) to get JSON that is stable across JVM runs: properties and map entries are
 * written in sorted order and only fields are serialized.
 */
public class JacksonEventSerializer implements EventSerializer {
    private final ObjectMapper objectMapper;

    public JacksonEventSerializer() {
        this(createCanonicalObjectMapper());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No object mapper instance provided");
    }

    /**
     * Create an {@link ObjectMapper} that produces deterministic JSON
     *
     * @return the canonical {@link ObjectMapper}
     */
    public static ObjectMapper createCanonicalObjectMapper() {
        return JsonMapper.builder()
                         .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                         .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                         .visibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .visibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY)
                         .addModule(new Jdk8Module())
                         .addModule(new JavaTimeModule())
                         .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public byte[] serialize(Object payload) {
        requireNonNull(payload, "No payload provided");
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new EventSerializationException(msg("Failed to serialize payload of type '{}'", payload.getClass().getName()), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] serializedPayload, Class<T> javaType) {
        requireNonNull(serializedPayload, "No serializedPayload provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(serializedPayload, javaType);
        } catch (IOException e) {
            throw new EventDeserializationException(msg("Failed to deserialize payload to type '{}'", javaType.getName()), e);
        }
    }
}
