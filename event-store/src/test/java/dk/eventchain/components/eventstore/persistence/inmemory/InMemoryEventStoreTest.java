package dk.eventchain.components.eventstore.persistence.inmemory;

import dk.eventchain.components.eventstore.AbstractEventStoreTest;
import dk.eventchain.components.eventstore.persistence.*;
import dk.eventchain.components.eventstore.test_data.OrderEvents.OrderPlaced;
import dk.eventchain.components.eventstore.test_data.TestEvents;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventStoreTest extends AbstractEventStoreTest {
    @Override
    protected RecordBackend createRecordBackend() {
        return new TamperableInMemoryRecordBackend();
    }

    @Override
    protected void replaceRecord(StoredRecord replacement) {
        ((TamperableInMemoryRecordBackend) recordBackend).overwrite(replacement);
    }

    @Test
    void verify_a_batch_with_duplicate_versions_is_rejected_without_side_effects() {
        var orderId = UUID.randomUUID();
        var event   = TestEvents.chain(orderId, new OrderPlaced("Alice", 1)).get(0);
        var mapper  = new StoredRecordMapper(eventStore.getConfiguration().eventSerializer(), Optional.empty());
        var record  = mapper.toRecord(event);

        assertThatThrownBy(() -> recordBackend.insert(List.of(record, record)))
                .isExactlyInstanceOf(RecordConflictException.class);
        assertThat(recordBackend.maxNotificationId()).isEqualTo(0);
        assertThat(recordBackend.selectLastRecord(orderId)).isEmpty();
    }
}
