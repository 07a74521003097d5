package dk.eventchain.components.aggregates.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.eventchain.components.aggregates.*;
import dk.eventchain.components.eventstore.serializer.JacksonEventSerializer;

import java.io.IOException;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * {@link AggregateStateSerializer} that writes the non transient fields of the concrete aggregate as JSON.<br>
 * The default {@link ObjectMapper} is {@link JacksonEventSerializer#createCanonicalObjectMapper()}, which only looks at fields, so the
 * aggregate and the types of its fields don't need getters or setters
 */
public class JacksonAggregateStateSerializer implements AggregateStateSerializer {
    private final ObjectMapper objectMapper;

    public JacksonAggregateStateSerializer() {
        this(JacksonEventSerializer.createCanonicalObjectMapper());
    }

    public JacksonAggregateStateSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No object mapper instance provided");
    }

    @Override
    public byte[] serialize(AggregateRoot<?> aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        try {
            return objectMapper.writeValueAsBytes(aggregate);
        } catch (IOException e) {
            throw new AggregateException(msg("Failed to serialize the state of aggregate '{}' with id '{}'",
                                             aggregate.getClass().getName(),
                                             aggregate.aggregateId()),
                                         e);
        }
    }

    @Override
    public <AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> AGGREGATE_TYPE deserializeInto(byte[] state, AGGREGATE_TYPE aggregate) {
        requireNonNull(state, "No state provided");
        requireNonNull(aggregate, "No aggregate provided");
        try {
            return objectMapper.readerForUpdating(aggregate).readValue(state);
        } catch (IOException e) {
            throw new AggregateException(msg("Failed to restore the state of aggregate '{}' from a snapshot", aggregate.getClass().getName()), e);
        }
    }
}
