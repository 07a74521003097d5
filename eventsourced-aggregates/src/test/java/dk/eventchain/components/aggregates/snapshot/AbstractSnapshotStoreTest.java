package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.aggregates.Order;
import dk.eventchain.components.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.time.*;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

public abstract class AbstractSnapshotStoreTest {
    protected SnapshotStore snapshotStore;

    protected abstract SnapshotStore createSnapshotStore();

    @BeforeEach
    void setupSnapshotStore() {
        snapshotStore = createSnapshotStore();
    }

    @Test
    void verify_the_latest_snapshot_at_or_before_a_version_is_loaded() {
        // Given
        var orderId = UUID.randomUUID();
        snapshotStore.saveSnapshot(snapshot(orderId, 2, "a", "{\"customerName\":\"Alice\"}"));
        snapshotStore.saveSnapshot(snapshot(orderId, 5, "b", "{\"customerName\":\"Bob\"}"));
        snapshotStore.saveSnapshot(snapshot(UUID.randomUUID(), 7, "c", "{}"));

        // Then
        var latest = snapshotStore.loadLatestSnapshot(orderId, Order.class).orElseThrow();
        assertThat(latest.aggregateVersion()).isEqualTo(OriginatorVersion.of(5));
        assertThatObject(latest.head()).isEqualTo(EventHash.of("b".repeat(64)));
        assertThat(new String(latest.state(), StandardCharsets.UTF_8)).isEqualTo("{\"customerName\":\"Bob\"}");
        assertThat(latest.aggregateType()).isEqualTo(Order.class.getName());
        assertThat(snapshotStore.loadLatestSnapshot(orderId, Order.class, OriginatorVersion.of(4)).orElseThrow().aggregateVersion())
                .isEqualTo(OriginatorVersion.of(2));
        assertThat(snapshotStore.loadLatestSnapshot(orderId, Order.class, OriginatorVersion.FIRST_VERSION)).isEmpty();
        assertThat(snapshotStore.loadLatestSnapshot(orderId, String.class)).isEmpty();
        assertThat(snapshotStore.loadLatestSnapshot(UUID.randomUUID(), Order.class)).isEmpty();
    }

    @Test
    void verify_an_existing_snapshot_is_kept() {
        // Given
        var orderId = UUID.randomUUID();
        snapshotStore.saveSnapshot(snapshot(orderId, 3, "a", "{\"customerName\":\"Alice\"}"));

        // When
        snapshotStore.saveSnapshot(snapshot(orderId, 3, "e", "{\"customerName\":\"Eve\"}"));

        // Then
        assertThatObject(snapshotStore.loadLatestSnapshot(orderId, Order.class).orElseThrow().head()).isEqualTo(EventHash.of("a".repeat(64)));
    }

    @Test
    void verify_snapshots_can_be_deleted() {
        // Given
        var orderId      = UUID.randomUUID();
        var otherOrderId = UUID.randomUUID();
        snapshotStore.saveSnapshot(snapshot(orderId, 1, "a", "{}"));
        snapshotStore.saveSnapshot(snapshot(orderId, 2, "b", "{}"));
        snapshotStore.saveSnapshot(snapshot(otherOrderId, 1, "c", "{}"));

        // When
        snapshotStore.deleteSnapshots(orderId);

        // Then
        assertThat(snapshotStore.loadLatestSnapshot(orderId, Order.class)).isEmpty();
        assertThat(snapshotStore.loadLatestSnapshot(otherOrderId, Order.class)).isPresent();
    }

    private static AggregateSnapshot snapshot(UUID orderId, long version, String hashCharacter, String state) {
        return new AggregateSnapshot(orderId,
                                     Order.class.getName(),
                                     OriginatorVersion.of(version),
                                     EventHash.of(hashCharacter.repeat(64)),
                                     state.getBytes(StandardCharsets.UTF_8),
                                     OffsetDateTime.now(ZoneOffset.UTC));
    }
}
