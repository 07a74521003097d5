package dk.eventchain.components.aggregates;

import dk.eventchain.components.aggregates.snapshot.*;
import dk.eventchain.components.eventstore.*;
import dk.eventchain.components.eventstore.persistence.RecordBackend;
import dk.eventchain.components.eventstore.persistence.inmemory.InMemoryRecordBackend;
import dk.eventchain.components.eventstore.types.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.*;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the repository scenarios through a {@link SnapshottingAggregateRepository} that snapshots every second version
 */
class SnapshottingAggregateRepositoryTest extends AbstractAggregateRepositoryTest {
    private InMemorySnapshotStore snapshotStore;

    @Override
    protected RecordBackend createRecordBackend() {
        return new InMemoryRecordBackend();
    }

    @Override
    protected AggregateRepository<Order> createRepository(EventStore eventStore) {
        snapshotStore = new InMemorySnapshotStore();
        return SnapshottingAggregateRepository.from(eventStore, Order.class, snapshotStore, 2);
    }

    private SnapshottingAggregateRepository<Order> snapshottingRepository() {
        return (SnapshottingAggregateRepository<Order>) repository;
    }

    @Test
    void verify_snapshots_are_taken_when_a_save_crosses_the_interval() {
        // Given
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);

        // When
        repository.save(order);

        // Then
        assertThat(snapshotStore.loadLatestSnapshot(orderId, Order.class)).isEmpty();

        // When
        order.addProduct("p-1", 2);
        order.addProduct("p-2", 1);
        repository.save(order);

        // Then
        var snapshot = snapshotStore.loadLatestSnapshot(orderId, Order.class).orElseThrow();
        assertThat(snapshot.aggregateVersion()).isEqualTo(OriginatorVersion.of(3));
        assertThatObject(snapshot.head()).isEqualTo(order.head());
        assertThat(snapshot.aggregateType()).isEqualTo(Order.class.getName());
        assertThat(new String(snapshot.state(), StandardCharsets.UTF_8)).contains("Alice")
                                                                         .doesNotContain("uncommittedChanges")
                                                                         .doesNotContain(order.head().toString());
    }

    @Test
    void verify_the_state_is_restored_from_the_snapshot_and_later_events_are_replayed() {
        // Given
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        repository.save(order);
        var snapshot = snapshottingRepository().takeSnapshot(order).orElseThrow();

        // A snapshot whose state differs from the events shows that the state isn't replayed from the first event
        var otherState = new String(snapshot.state(), StandardCharsets.UTF_8).replace("Alice", "Carol").getBytes(StandardCharsets.UTF_8);
        snapshotStore.deleteSnapshots(orderId);
        snapshotStore.saveSnapshot(new AggregateSnapshot(orderId,
                                                         snapshot.aggregateType(),
                                                         snapshot.aggregateVersion(),
                                                         snapshot.head(),
                                                         otherState,
                                                         snapshot.takenAt()));
        order.accept("Bob");
        repository.save(order);

        // When
        var loadedOrder = repository.load(orderId);

        // Then
        assertThat(loadedOrder.customerName()).isEqualTo("Carol");
        assertThat(loadedOrder.orderNumber()).isEqualTo(123);
        assertThat(loadedOrder.productAndQuantity()).containsEntry("p-1", 2);
        assertThat(loadedOrder.isAccepted()).isTrue();
        assertThat(loadedOrder.version()).isEqualTo(OriginatorVersion.of(3));
        assertThatObject(loadedOrder.head()).isEqualTo(order.head());
        assertThat(loadedOrder.hasBeenRehydrated()).isTrue();

        // And new events link to the head of the loaded aggregate
        var discarded = loadedOrder.discard();
        assertThatObject(discarded.previousHash()).isEqualTo(order.head());
        assertThat(discarded.originatorVersion()).isEqualTo(OriginatorVersion.of(4));
        repository.save(loadedOrder);
        assertThat(eventStore.verifyChain(orderId).numberOfEvents()).isEqualTo(4);
    }

    @Test
    void verify_a_historic_load_uses_a_snapshot_taken_at_or_before_the_version() {
        // Given snapshots at version 2 and 4
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        repository.save(order);
        order.addProduct("p-2", 1);
        order.removeProduct("p-1");
        repository.save(order);
        assertThat(snapshotStore.loadLatestSnapshot(orderId, Order.class).orElseThrow().aggregateVersion()).isEqualTo(OriginatorVersion.of(4));

        // When
        var historicOrder = repository.load(orderId, OriginatorVersion.of(3));

        // Then
        assertThat(historicOrder.version()).isEqualTo(OriginatorVersion.of(3));
        assertThat(historicOrder.productAndQuantity()).containsEntry("p-1", 2).containsEntry("p-2", 1);
        assertThat(repository.load(orderId, OriginatorVersion.of(10)).version()).isEqualTo(OriginatorVersion.of(4));
        assertThat(repository.load(orderId, OriginatorVersion.FIRST_VERSION).productAndQuantity()).isEmpty();
    }

    @Test
    void verify_a_snapshot_that_doesnt_match_the_hash_chain_is_rejected() {
        // Given
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        repository.save(order);
        var snapshot = snapshotStore.loadLatestSnapshot(orderId, Order.class).orElseThrow();
        snapshotStore.deleteSnapshots(orderId);

        // When
        snapshotStore.saveSnapshot(new AggregateSnapshot(orderId,
                                                         snapshot.aggregateType(),
                                                         snapshot.aggregateVersion(),
                                                         EventHash.of("c".repeat(64)),
                                                         snapshot.state(),
                                                         snapshot.takenAt()));

        // Then
        assertThatThrownBy(() -> repository.load(orderId))
                .isExactlyInstanceOf(EventIntegrityException.class)
                .satisfies(e -> assertThat(((EventIntegrityException) e).originatorVersion()).contains(OriginatorVersion.of(2)));
    }

    @Test
    void verify_a_snapshot_ahead_of_the_events_is_rejected() {
        // Given
        var orderId = UUID.randomUUID();
        repository.save(new Order(orderId, "Alice", 123));

        // When
        snapshotStore.saveSnapshot(new AggregateSnapshot(orderId,
                                                         Order.class.getName(),
                                                         OriginatorVersion.of(5),
                                                         EventHash.of("d".repeat(64)),
                                                         "{}".getBytes(StandardCharsets.UTF_8),
                                                         OffsetDateTime.now(ZoneOffset.UTC)));

        // Then
        assertThatThrownBy(() -> repository.load(orderId))
                .isExactlyInstanceOf(EventIntegrityException.class);
    }

    @Test
    void verify_snapshots_require_a_saved_and_live_aggregate() {
        // Given
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);

        // Then
        assertThatThrownBy(() -> snapshottingRepository().takeSnapshot(order))
                .isExactlyInstanceOf(IllegalArgumentException.class);

        // When
        repository.save(order);
        order.discard();
        repository.save(order);

        // Then
        assertThat(snapshottingRepository().takeSnapshot(order)).isEmpty();
        assertThat(snapshotStore.loadLatestSnapshot(orderId, Order.class)).isEmpty();
        assertThat(repository.tryLoad(orderId)).isEmpty();
    }
}
