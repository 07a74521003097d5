package dk.eventchain.components.aggregates;

import dk.eventchain.components.aggregates.OrderEvents.*;
import dk.eventchain.components.eventstore.*;
import dk.eventchain.components.eventstore.eventstream.DomainEvent;
import dk.eventchain.components.eventstore.hashchain.HashChain;
import dk.eventchain.components.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class AggregateRootTest {
    @Test
    void verify_triggered_events_are_versioned_and_hash_linked() {
        // Given
        var orderId = UUID.randomUUID();

        // When
        var order = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        order.accept("Bob");

        // Then
        assertThat(order.aggregateId()).isEqualTo(orderId);
        assertThat(order.version()).isEqualTo(OriginatorVersion.of(3));
        assertThat(order.versionBeforeUncommittedChanges()).isEqualTo(OriginatorVersion.NO_EVENTS_PERSISTED);
        var events = order.uncommittedChanges();
        assertThat(events).hasSize(3);
        assertThat(events).extracting(DomainEvent::originatorVersion)
                          .containsExactly(OriginatorVersion.of(1), OriginatorVersion.of(2), OriginatorVersion.of(3));
        assertThat(events).extracting(DomainEvent::originatorId).containsOnly(orderId);
        assertThatObject(events.get(0).previousHash()).isEqualTo(EventHash.GENESIS);
        assertThatObject(events.get(1).previousHash()).isEqualTo(events.get(0).eventHash());
        assertThatObject(events.get(2).previousHash()).isEqualTo(events.get(1).eventHash());
        assertThatObject(order.head()).isEqualTo(events.get(2).eventHash());
        assertThatObject(events.get(1).eventType()).isEqualTo(EventType.of(ProductAddedToOrder.class));
        assertThat(events.get(1).payload()).isEqualTo(new ProductAddedToOrder("p-1", 2));
        assertThat(HashChain.defaultHashChain().verifyChain(events).numberOfEvents()).isEqualTo(3);

        assertThat(order.customerName()).isEqualTo("Alice");
        assertThat(order.productAndQuantity()).containsEntry("p-1", 2);
        assertThat(order.isAccepted()).isTrue();
        assertThat(order.hasBeenRehydrated()).isFalse();
    }

    @Test
    void verify_markChangesAsCommitted_resets_uncommittedChanges() {
        // Given
        var order = new Order(UUID.randomUUID(), "Alice", 123);
        order.addProduct("p-1", 2);

        // When
        order.markChangesAsCommitted();

        // Then
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.version()).isEqualTo(OriginatorVersion.of(2));
        assertThat(order.versionBeforeUncommittedChanges()).isEqualTo(OriginatorVersion.of(2));

        order.removeProduct("p-1");
        assertThat(order.uncommittedChanges()).hasSize(1);
        assertThatObject(order.uncommittedChanges().get(0).previousHash()).isNotEqualTo(EventHash.GENESIS);
        assertThat(order.versionBeforeUncommittedChanges()).isEqualTo(OriginatorVersion.of(2));
    }

    @Test
    void verify_uncommittedChanges_cannot_be_modified_from_outside() {
        var order = new Order(UUID.randomUUID(), "Alice", 123);

        assertThatThrownBy(() -> order.uncommittedChanges().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void verify_rehydrating_using_objenesis_reproduces_the_state() {
        verifyReplayDeterminism(AggregateRootInstanceFactory.objenesisAggregateRootFactory());
    }

    @Test
    void verify_rehydrating_using_the_default_constructor_reproduces_the_state() {
        verifyReplayDeterminism(AggregateRootInstanceFactory.defaultConstructorFactory());
    }

    private void verifyReplayDeterminism(AggregateRootInstanceFactory factory) {
        // Given
        var order = new Order(UUID.randomUUID(), "Alice", 123);
        order.addProduct("p-1", 2);
        order.addProduct("p-2", 1);
        order.addProduct("p-1", 3);
        order.removeProduct("p-2");
        order.accept("Bob");

        // When
        var rehydratedOrder = factory.create(Order.class)
                                     .rehydrate(order.uncommittedChanges().stream());

        // Then
        assertThat(rehydratedOrder).usingRecursiveComparison()
                                   .ignoringFields("invoker", "uncommittedChanges", "hasBeenRehydrated")
                                   .isEqualTo(order);
        assertThat(rehydratedOrder.productAndQuantity()).containsExactly(entry("p-1", 5));
        assertThat(rehydratedOrder.version()).isEqualTo(OriginatorVersion.of(6));
        assertThatObject(rehydratedOrder.head()).isEqualTo(order.head());
        assertThat(rehydratedOrder.uncommittedChanges()).isEmpty();
        assertThat(rehydratedOrder.hasBeenRehydrated()).isTrue();

        // And the rehydrated aggregate continues the chain
        rehydratedOrder.addProduct("p-3", 1);
        var nextEvent = rehydratedOrder.uncommittedChanges().get(0);
        assertThat(nextEvent.originatorVersion()).isEqualTo(OriginatorVersion.of(7));
        assertThatObject(nextEvent.previousHash()).isEqualTo(order.head());
        assertThat(rehydratedOrder.versionBeforeUncommittedChanges()).isEqualTo(OriginatorVersion.of(6));
    }

    @Test
    void verify_a_historic_replay_only_reflects_the_events_up_to_the_bound() {
        // Given
        var order = new Order(UUID.randomUUID(), "Alice", 123);
        order.addProduct("p-1", 2);
        order.accept("Bob");

        // When
        var historicOrder = AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                        .create(Order.class)
                                                        .rehydrate(order.uncommittedChanges().stream().limit(2));

        // Then
        assertThat(historicOrder.version()).isEqualTo(OriginatorVersion.of(2));
        assertThat(historicOrder.productAndQuantity()).containsEntry("p-1", 2);
        assertThat(historicOrder.isAccepted()).isFalse();
    }

    @Test
    void verify_a_discarded_aggregate_rejects_new_events() {
        // Given
        var order = new Order(UUID.randomUUID(), "Alice", 123);

        // When
        var discardEvent = order.discard();

        // Then
        assertThat(discardEvent.payload()).isInstanceOf(AggregateDiscarded.class);
        assertThat(order.isDiscarded()).isTrue();
        assertThat(order.version()).isEqualTo(OriginatorVersion.of(2));
        assertThatThrownBy(() -> order.addProduct("p-1", 1))
                .isExactlyInstanceOf(AggregateDiscardedException.class);
        assertThatThrownBy(order::discard)
                .isExactlyInstanceOf(AggregateDiscardedException.class);
        assertThat(order.version()).isEqualTo(OriginatorVersion.of(2));
    }

    @Test
    void verify_rehydrating_a_discarded_aggregate() {
        // Given
        var order = new Order(UUID.randomUUID(), "Alice", 123);
        order.discard();
        var history = new ArrayList<>(order.uncommittedChanges());

        // When
        var rehydratedOrder = AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                          .create(Order.class)
                                                          .rehydrate(history.stream());

        // Then
        assertThat(rehydratedOrder.isDiscarded()).isTrue();
        assertThatThrownBy(() -> rehydratedOrder.accept("Bob"))
                .isExactlyInstanceOf(AggregateDiscardedException.class);
    }

    @Test
    void verify_an_event_without_an_EventHandler_is_rejected() {
        // Given
        var aggregate = new AggregateWithoutHandlers(UUID.randomUUID());

        // Then
        assertThatThrownBy(() -> aggregate.doSomething())
                .isExactlyInstanceOf(UnknownEventTypeException.class);
        assertThat(aggregate.version()).isEqualTo(OriginatorVersion.NO_EVENTS_PERSISTED);
        assertThat(aggregate.uncommittedChanges()).isEmpty();
    }

    @Test
    void verify_rehydrating_with_a_version_gap_fails() {
        // Given
        var order = new Order(UUID.randomUUID(), "Alice", 123);
        order.addProduct("p-1", 2);
        order.accept("Bob");
        var events = order.uncommittedChanges();

        // Then
        assertThatThrownBy(() -> AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                             .create(Order.class)
                                                             .rehydrate(List.of(events.get(0), events.get(2)).stream()))
                .isExactlyInstanceOf(EventIntegrityException.class);
    }

    @Test
    void verify_rehydrating_with_a_broken_link_fails() {
        // Given
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        var first   = order.uncommittedChanges().get(0);
        var unlinked = HashChain.defaultHashChain().seal(orderId,
                                                         OriginatorVersion.of(2),
                                                         new ProductAddedToOrder("p-1", 1),
                                                         OffsetDateTime.now(ZoneOffset.UTC),
                                                         EventHash.GENESIS);

        // Then
        assertThatThrownBy(() -> AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                             .create(Order.class)
                                                             .rehydrate(List.of(first, unlinked).stream()))
                .isExactlyInstanceOf(EventIntegrityException.class);
    }

    @Test
    void verify_events_of_another_aggregate_are_rejected() {
        var order      = new Order(UUID.randomUUID(), "Alice", 123);
        var otherOrder = new Order(UUID.randomUUID(), "Carol", 456);
        otherOrder.addProduct("p-1", 1);

        assertThatThrownBy(() -> AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                             .create(Order.class)
                                                             .rehydrate(List.of(order.uncommittedChanges().get(0),
                                                                                otherOrder.uncommittedChanges().get(1)).stream()))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_the_most_specific_EventHandler_is_called() {
        // Given
        var aggregate = new SpecialisedAggregate(UUID.randomUUID());

        // When
        aggregate.happen(new SpecialThingHappened());
        aggregate.happen(new SomethingHappened());

        // Then
        assertThat(aggregate.handledBy).containsExactly("special", "general");
        assertThat(aggregate.version()).isEqualTo(OriginatorVersion.of(2));
    }

    @Test
    void verify_a_checked_exception_from_an_EventHandler_is_wrapped() {
        var aggregate = new SpecialisedAggregate(UUID.randomUUID());

        assertThatThrownBy(() -> aggregate.happen(new FailingThingHappened()))
                .isExactlyInstanceOf(AggregateException.class)
                .hasCauseExactlyInstanceOf(java.io.IOException.class);
        assertThat(aggregate.uncommittedChanges()).isEmpty();
    }

    @Test
    void verify_an_EventHandler_with_more_than_one_parameter_is_rejected() {
        assertThatThrownBy(() -> new AggregateWithInvalidHandler(UUID.randomUUID()))
                .isExactlyInstanceOf(AggregateException.class)
                .hasMessageContaining("must have exactly one parameter");
    }

    @Test
    void verify_a_snapshot_position_can_only_be_restored_on_an_empty_aggregate() {
        var order = new Order(UUID.randomUUID(), "Alice", 123);

        assertThatThrownBy(() -> order.restoreSnapshotPosition(order.aggregateId(), OriginatorVersion.of(5), EventHash.GENESIS))
                .isExactlyInstanceOf(IllegalArgumentException.class);

        var restored = AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                   .create(Order.class)
                                                   .restoreSnapshotPosition(order.aggregateId(), OriginatorVersion.FIRST_VERSION, order.head());
        assertThat(restored.version()).isEqualTo(OriginatorVersion.FIRST_VERSION);
        assertThatObject(restored.head()).isEqualTo(order.head());
        assertThat(restored.hasBeenRehydrated()).isTrue();
    }

    private static class AggregateWithoutHandlers extends AggregateRoot<AggregateWithoutHandlers> {
        AggregateWithoutHandlers(UUID aggregateId) {
            super(aggregateId);
        }

        void doSomething() {
            trigger(new SomethingHappened());
        }
    }

    private static class SomethingHappened {
    }

    private static class SpecialThingHappened extends SomethingHappened {
    }

    private static class FailingThingHappened {
    }

    private static class GeneralAggregate<AGGREGATE_TYPE extends GeneralAggregate<AGGREGATE_TYPE>> extends AggregateRoot<AGGREGATE_TYPE> {
        final List<String> handledBy = new ArrayList<>();

        GeneralAggregate(UUID aggregateId) {
            super(aggregateId);
        }

        void happen(Object payload) {
            trigger(payload);
        }

        @EventHandler
        private void on(SomethingHappened e) {
            handledBy.add("general");
        }
    }

    private static class SpecialisedAggregate extends GeneralAggregate<SpecialisedAggregate> {
        SpecialisedAggregate(UUID aggregateId) {
            super(aggregateId);
        }

        @EventHandler
        private void on(SpecialThingHappened e) {
            handledBy.add("special");
        }

        @EventHandler
        private void on(FailingThingHappened e) throws java.io.IOException {
            throw new java.io.IOException("Disk full");
        }
    }

    private static class AggregateWithInvalidHandler extends AggregateRoot<AggregateWithInvalidHandler> {
        AggregateWithInvalidHandler(UUID aggregateId) {
            super(aggregateId);
        }

        @EventHandler
        private void on(SomethingHappened e, String extra) {
        }
    }
}
