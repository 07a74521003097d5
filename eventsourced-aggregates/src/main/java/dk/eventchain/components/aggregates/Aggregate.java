package dk.eventchain.components.aggregates;

import dk.eventchain.components.eventstore.eventstream.*;
import dk.eventchain.components.eventstore.types.*;

import java.util.*;

/**
 * Common interface that all concrete {@link Aggregate}'s must implement. Most concrete implementations choose to extend the {@link AggregateRoot} class.
 *
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 * @see AggregateRoot
 */
public interface Aggregate<AGGREGATE_TYPE extends Aggregate<AGGREGATE_TYPE>> {
    /**
     * The id of the aggregate (aka. the originator id)
     */
    UUID aggregateId();

    /**
     * The version of the aggregate, which is equal to the number of events applied to it (including uncommitted events)
     */
    OriginatorVersion version();

    /**
     * The hash of the last applied event or {@link EventHash#GENESIS} if no events have been applied
     */
    EventHash head();

    /**
     * Has the aggregate been discarded. A discarded aggregate doesn't accept any new events
     */
    boolean isDiscarded();

    /**
     * Has the aggregate been initialized using previously persisted events (aka. historic events) using the {@link #rehydrate(AggregateEventStream)} method
     */
    boolean hasBeenRehydrated();

    /**
     * Effectively performs a leftFold over all the previously persisted events related to this aggregate instance
     *
     * @param persistedEvents the previous persisted events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    AGGREGATE_TYPE rehydrate(AggregateEventStream persistedEvents);

    /**
     * The events that have been applied to this aggregate instance but not yet persisted
     */
    List<DomainEvent> uncommittedChanges();

    /**
     * The version the aggregate had before any of the {@link #uncommittedChanges()} were applied
     */
    OriginatorVersion versionBeforeUncommittedChanges();

    /**
     * Resets the {@link #uncommittedChanges()} - effectively marking them as having been persisted
     */
    void markChangesAsCommitted();
}
