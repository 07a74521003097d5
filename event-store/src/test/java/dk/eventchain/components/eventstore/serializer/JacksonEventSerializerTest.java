package dk.eventchain.components.eventstore.serializer;

import dk.eventchain.components.eventstore.UnknownEventTypeException;
import dk.eventchain.components.eventstore.test_data.OrderEvents.*;
import dk.eventchain.components.eventstore.types.EventType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class JacksonEventSerializerTest {
    private final JacksonEventSerializer serializer = new JacksonEventSerializer();

    @Test
    void verify_properties_and_map_entries_are_written_in_sorted_order() {
        // Given
        var attributes = new LinkedHashMap<String, String>();
        attributes.put("size", "L");
        attributes.put("color", "red");

        // When
        var json = new String(serializer.serialize(new ProductAdded("p-1", 2, new BigDecimal("12.50"), attributes)), StandardCharsets.UTF_8);

        // Then
        assertThat(json).isEqualTo("{\"attributes\":{\"color\":\"red\",\"size\":\"L\"},\"price\":12.50,\"productId\":\"p-1\",\"quantity\":2}");
    }

    @Test
    void verify_equal_payloads_serialize_to_identical_bytes() {
        var attributes1 = new HashMap<String, String>();
        attributes1.put("a", "1");
        attributes1.put("b", "2");
        var attributes2 = new LinkedHashMap<String, String>();
        attributes2.put("b", "2");
        attributes2.put("a", "1");

        assertThat(serializer.serialize(new ProductAdded("p-1", 1, BigDecimal.ONE, attributes1)))
                .isEqualTo(serializer.serialize(new ProductAdded("p-1", 1, BigDecimal.ONE, attributes2)));
    }

    @Test
    void verify_deserialization_using_the_event_type() {
        // Given
        var payload = new OrderPlaced("Alice", 42);
        var bytes   = serializer.serialize(payload);

        // When
        var result = serializer.deserialize(bytes, EventType.of(OrderPlaced.class));

        // Then
        assertThat(result).isEqualTo(payload);
    }

    @Test
    void verify_unknown_properties_are_ignored() {
        var result = serializer.deserialize("{\"customerName\":\"Alice\",\"orderNumber\":1,\"addedLater\":true}".getBytes(StandardCharsets.UTF_8),
                                            OrderPlaced.class);

        assertThat(result).isEqualTo(new OrderPlaced("Alice", 1));
    }

    @Test
    void verify_invalid_json_fails_with_an_EventDeserializationException() {
        assertThatThrownBy(() -> serializer.deserialize("not json".getBytes(StandardCharsets.UTF_8), OrderPlaced.class))
                .isExactlyInstanceOf(EventDeserializationException.class);
    }

    @Test
    void verify_an_unresolvable_event_type_fails_with_an_UnknownEventTypeException() {
        assertThatThrownBy(() -> serializer.deserialize("{}".getBytes(StandardCharsets.UTF_8), EventType.of("com.acme.Unknown")))
                .isExactlyInstanceOf(UnknownEventTypeException.class);
    }
}
