package dk.eventchain.components.eventstore.notificationlog;

import dk.eventchain.components.eventstore.DefaultEventStore;
import dk.eventchain.components.eventstore.persistence.inmemory.InMemoryRecordBackend;
import dk.eventchain.components.eventstore.test_data.OrderEvents.*;
import dk.eventchain.components.eventstore.test_data.TestEvents;
import dk.eventchain.components.eventstore.types.OriginatorVersion;
import org.junit.jupiter.api.*;

import java.util.*;

import static dk.eventchain.components.eventstore.notificationlog.LocalNotificationLogTest.ids;
import static org.assertj.core.api.Assertions.*;

class NotificationLogReaderTest {
    private DefaultEventStore     eventStore;
    private NotificationLogReader reader;

    @BeforeEach
    void setup() {
        eventStore = new DefaultEventStore(new InMemoryRecordBackend());
        reader = new NotificationLogReader(new LocalNotificationLog(eventStore, 3));
    }

    @Test
    void verify_the_reader_follows_sections_and_remembers_its_position() {
        // Given
        appendEvents(7);

        // When
        var firstRead = reader.read();

        // Then
        assertThat(ids(firstRead)).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
        assertThat(reader.position()).isEqualTo(8);

        // And only new notifications are read the next time
        assertThat(reader.read()).isEmpty();
        appendEvents(2);
        assertThat(ids(reader.read())).containsExactly(8L, 9L);
        assertThat(reader.position()).isEqualTo(10);
    }

    @Test
    void verify_seek_starts_reading_in_the_middle_of_a_section() {
        // Given
        appendEvents(7);

        // When
        reader.seek(5);

        // Then
        assertThat(ids(reader.read())).containsExactly(5L, 6L, 7L);
        assertThatThrownBy(() -> reader.seek(0)).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_readList_advances_by_at_most_the_requested_number_of_notifications() {
        // Given
        appendEvents(5);

        // Then
        assertThat(ids(reader.readList(4))).containsExactly(1L, 2L, 3L, 4L);
        assertThat(reader.position()).isEqualTo(5);
        assertThat(ids(reader.readList(4))).containsExactly(5L);
        assertThat(reader.readList(4)).isEmpty();
        assertThat(reader.readList(0)).isEmpty();
    }

    @Test
    void verify_the_reader_can_be_iterated() {
        // Given
        appendEvents(4);
        var visited = new ArrayList<Long>();

        // When
        for (var notification : reader) {
            visited.add(notification.id().longValue());
            if (visited.size() == 2) {
                break;
            }
        }

        // Then
        assertThat(visited).containsExactly(1L, 2L);
        assertThat(reader.position()).isEqualTo(3);
        assertThat(ids(reader.read())).containsExactly(3L, 4L);
    }

    @Test
    void verify_an_exhausted_iterator_throws_NoSuchElementException() {
        var iterator = reader.iterator();

        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isExactlyInstanceOf(NoSuchElementException.class);
    }

    private void appendEvents(int numberOfEvents) {
        for (int i = 0; i < numberOfEvents; i++) {
            var orderId = UUID.randomUUID();
            eventStore.appendToStream(orderId,
                                      OriginatorVersion.NO_EVENTS_PERSISTED,
                                      TestEvents.chain(orderId, new OrderPlaced("Customer " + i, i)));
        }
    }
}
