package dk.eventchain.components.aggregates;

import dk.eventchain.components.aggregates.OrderEvents.*;
import dk.eventchain.components.eventstore.*;
import dk.eventchain.components.eventstore.eventstream.DomainEvent;
import dk.eventchain.components.eventstore.notificationlog.*;
import dk.eventchain.components.eventstore.persistence.*;
import dk.eventchain.components.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Behaviour of the {@link AggregateRepository} on top of a {@link DefaultEventStore} with a given {@link RecordBackend}
 */
public abstract class AbstractAggregateRepositoryTest {
    protected EventStore                 eventStore;
    protected AggregateRepository<Order> repository;

    protected abstract RecordBackend createRecordBackend();

    protected AggregateRepository<Order> createRepository(EventStore eventStore) {
        return AggregateRepository.from(eventStore, Order.class);
    }

    @BeforeEach
    protected void setupRepository() {
        eventStore = new DefaultEventStore(createRecordBackend());
        repository = createRepository(eventStore);
    }

    @Test
    void verify_the_complete_lifecycle_of_an_aggregate() {
        // Given a new aggregate with 3 events
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        order.accept("Bob");
        assertThat(order.version()).isEqualTo(OriginatorVersion.of(3));
        assertThat(order.uncommittedChanges()).hasSize(3);

        // When
        var notificationIds = repository.save(order);

        // Then
        assertThat(notificationIds).containsExactly(NotificationId.of(1), NotificationId.of(2), NotificationId.of(3));
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.versionBeforeUncommittedChanges()).isEqualTo(OriginatorVersion.of(3));
        assertThat(eventStore.fetchStream(orderId).orElseThrow().eventList())
                .extracting(DomainEvent::originatorVersion)
                .containsExactly(OriginatorVersion.of(1), OriginatorVersion.of(2), OriginatorVersion.of(3));
        var section = new LocalNotificationLog(eventStore).currentSection();
        assertThat(section.items()).extracting(Notification::id)
                                   .containsExactly(NotificationId.of(1), NotificationId.of(2), NotificationId.of(3));

        // And the historic state at version 2 only reflects the first 2 events
        var historicOrder = repository.load(orderId, OriginatorVersion.of(2));
        assertThat(historicOrder.version()).isEqualTo(OriginatorVersion.of(2));
        assertThat(historicOrder.productAndQuantity()).containsEntry("p-1", 2);
        assertThat(historicOrder.isAccepted()).isFalse();

        // When the aggregate is discarded
        var loadedOrder = repository.load(orderId);
        assertThat(loadedOrder.isAccepted()).isTrue();
        loadedOrder.discard();
        assertThat(repository.save(loadedOrder)).containsExactly(NotificationId.of(4));

        // Then it can't be loaded but its history is still available
        assertThatThrownBy(() -> repository.load(orderId))
                .isExactlyInstanceOf(AggregateNotFoundException.class);
        assertThat(repository.tryLoad(orderId)).isEmpty();
        var history = eventStore.getEvents(orderId, Optional.empty(), Optional.empty()).eventList();
        assertThat(history).hasSize(4);
        assertThat(history.get(3).payload()).isInstanceOf(AggregateDiscarded.class);
        assertThat(repository.load(orderId, OriginatorVersion.of(4)).isDiscarded()).isTrue();
        assertThat(eventStore.verifyChain(orderId).numberOfEvents()).isEqualTo(4);
    }

    @Test
    void verify_a_loaded_aggregate_equals_the_saved_aggregate() {
        // Given
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        order.addProduct("p-2", 7);
        order.removeProduct("p-1");
        repository.save(order);

        // When
        var loadedOrder = repository.load(orderId);

        // Then
        assertThat(loadedOrder).usingRecursiveComparison()
                               .ignoringFields("invoker", "uncommittedChanges", "hasBeenRehydrated")
                               .isEqualTo(order);
        assertThat(loadedOrder.hasBeenRehydrated()).isTrue();
    }

    @Test
    void verify_changes_to_a_loaded_aggregate_are_appended() {
        // Given
        var orderId = UUID.randomUUID();
        repository.save(new Order(orderId, "Alice", 123));

        // When
        var order = repository.load(orderId);
        order.addProduct("p-1", 1);
        var notificationIds = repository.save(order);

        // Then
        assertThat(notificationIds).containsExactly(NotificationId.of(2));
        assertThat(repository.load(orderId).productAndQuantity()).containsEntry("p-1", 1);
        assertThat(eventStore.currentVersion(orderId)).isEqualTo(OriginatorVersion.of(2));
    }

    @Test
    void verify_saving_without_changes_does_nothing() {
        var orderId = UUID.randomUUID();
        repository.save(new Order(orderId, "Alice", 123));
        var order = repository.load(orderId);

        assertThat(repository.save(order)).isEmpty();
        assertThat(eventStore.maxNotificationId()).isEqualTo(1);
    }

    @Test
    void verify_only_one_of_two_concurrent_writers_succeeds() {
        // Given two independent loads of the same aggregate
        var orderId = UUID.randomUUID();
        repository.save(new Order(orderId, "Alice", 123));
        var order1 = repository.load(orderId);
        var order2 = repository.load(orderId);

        // When both change and save
        order1.addProduct("p-1", 1);
        order2.accept("Bob");
        repository.save(order1);

        // Then
        assertThatThrownBy(() -> repository.save(order2))
                .isExactlyInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(order2.uncommittedChanges()).hasSize(1);
        var reloadedOrder = repository.load(orderId);
        assertThat(reloadedOrder.isAccepted()).isFalse();
        assertThat(reloadedOrder.productAndQuantity()).containsEntry("p-1", 1);
        assertThat(eventStore.maxNotificationId()).isEqualTo(2);

        // And the losing writer can retry with fresh state
        reloadedOrder.accept("Bob");
        assertThat(repository.save(reloadedOrder)).containsExactly(NotificationId.of(3));
    }

    @Test
    void verify_loading_an_unknown_aggregate() {
        var unknownId = UUID.randomUUID();

        assertThat(repository.tryLoad(unknownId)).isEmpty();
        assertThatThrownBy(() -> repository.load(unknownId))
                .isExactlyInstanceOf(AggregateNotFoundException.class)
                .satisfies(e -> assertThat(((AggregateNotFoundException) e).aggregateImplementationType).isEqualTo(Order.class));
        assertThatThrownBy(() -> repository.load(unknownId, OriginatorVersion.of(1)))
                .isExactlyInstanceOf(AggregateNotFoundException.class);
        assertThatThrownBy(() -> repository.load(unknownId, OriginatorVersion.NO_EVENTS_PERSISTED))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_the_repository_works_with_the_default_constructor_factory() {
        // Given
        var defaultConstructorRepository = AggregateRepository.from(eventStore,
                                                                    AggregateRootInstanceFactory.defaultConstructorFactory(),
                                                                    Order.class);
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        defaultConstructorRepository.save(order);

        // When
        var loadedOrder = defaultConstructorRepository.load(orderId);

        // Then
        assertThat(loadedOrder.productAndQuantity()).containsEntry("p-1", 2);
        assertThat(defaultConstructorRepository.aggregateImplementationType()).isEqualTo(Order.class);
    }
}
