package dk.eventchain.components.eventstore;

import dk.eventchain.components.eventstore.eventstream.*;
import dk.eventchain.components.eventstore.hashchain.*;
import dk.eventchain.components.eventstore.persistence.*;
import dk.eventchain.components.eventstore.types.*;
import dk.eventchain.components.common.types.LongRange;

import java.util.*;
import java.util.stream.Stream;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * The event store stores the {@link DomainEvent}s of aggregates under a per aggregate version sequence, detects concurrent
 * modifications and assigns every stored event a {@link NotificationId} that reflects the global append order.
 *
 * @see DefaultEventStore
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public interface EventStore {
    /**
     * Append events to the stream of the aggregate with id <code>originatorId</code>.<br>
     * The events must all belong to the aggregate, have contiguous versions where the first version is <code>expectedVersion + 1</code>
     * and form a valid continuation of the aggregate's hash chain.
     *
     * @param originatorId    the aggregate id
     * @param expectedVersion the version of the last event the caller expects to be persisted ({@link OriginatorVersion#NO_EVENTS_PERSISTED} for a new aggregate)
     * @param events          the events to append. An empty list results in no write
     * @return the persisted events including their assigned {@link NotificationId}
     * @throws OptimisticAppendToStreamException in case another writer already appended events for the same versions
     *                                           or the persisted version differs from the <code>expectedVersion</code>
     * @throws AppendToStreamException           in case the events couldn't be appended for other reasons
     * @throws IllegalArgumentException          in case the events don't belong to the aggregate or aren't contiguous
     */
    List<PersistedEvent> appendToStream(UUID originatorId, OriginatorVersion expectedVersion, List<DomainEvent> events);

    /**
     * Fetch all events related to the aggregate
     *
     * @param originatorId the aggregate id
     * @return the aggregate's event stream or {@link Optional#empty()} in case no events exist
     */
    default Optional<AggregateEventStream> fetchStream(UUID originatorId) {
        return fetchStream(originatorId, LongRange.from(OriginatorVersion.FIRST_VERSION.longValue()));
    }

    /**
     * Fetch the events related to the aggregate within the <code>versionRange</code>.<br>
     * When verification on read is enabled, a {@link EventIntegrityException} is thrown while the stream is being consumed
     * if an event has been tampered with
     *
     * @param originatorId the aggregate id
     * @param versionRange the range of versions to fetch
     * @return the aggregate's event stream or {@link Optional#empty()} in case no events exist within the range
     */
    Optional<AggregateEventStream> fetchStream(UUID originatorId, LongRange versionRange);

    /**
     * Get the events related to the aggregate
     *
     * @param originatorId the aggregate id
     * @param fromVersion  the first version to include (default {@link OriginatorVersion#FIRST_VERSION})
     * @param toVersion    the last version to include (default: the latest version)
     * @return the aggregate's event stream
     * @throws AggregateNotFoundException in case no events exist within the range
     */
    default AggregateEventStream getEvents(UUID originatorId, Optional<Long> fromVersion, Optional<Long> toVersion) {
        requireNonNull(fromVersion, "No fromVersion option provided");
        requireNonNull(toVersion, "No toVersion option provided");
        long from  = fromVersion.orElse(OriginatorVersion.FIRST_VERSION.longValue());
        var  range = toVersion.map(to -> LongRange.between(from, to)).orElseGet(() -> LongRange.from(from));
        return fetchStream(originatorId, range).orElseThrow(() -> new AggregateNotFoundException(originatorId));
    }

    /**
     * Verify the complete hash chain of the aggregate
     *
     * @param originatorId the aggregate id
     * @return the verification result (with zero events in case the aggregate doesn't have any events)
     * @throws EventIntegrityException naming the version where the chain broke
     */
    ChainVerificationResult verifyChain(UUID originatorId);

    /**
     * Load the last persisted event related to the aggregate
     *
     * @param originatorId the aggregate id
     * @return the last persisted event or {@link Optional#empty()} in case no events exist
     */
    Optional<PersistedEvent> loadLastPersistedEventRelatedTo(UUID originatorId);

    /**
     * @param originatorId the aggregate id
     * @return the version of the last persisted event or {@link OriginatorVersion#NO_EVENTS_PERSISTED}
     */
    default OriginatorVersion currentVersion(UUID originatorId) {
        return loadLastPersistedEventRelatedTo(originatorId).map(PersistedEvent::originatorVersion)
                                                            .orElse(OriginatorVersion.NO_EVENTS_PERSISTED);
    }

    /**
     * Load the {@link Notification}s (stored form, i.e. the state is encrypted if a cipher is configured) within the notification id range
     *
     * @param notificationIdRange the range of notification ids
     * @return the notifications ordered by ascending notification id
     */
    Stream<Notification> loadEventsByNotificationId(LongRange notificationIdRange);

    /**
     * Load the decrypted and deserialized events within the notification id range
     *
     * @param notificationIdRange the range of notification ids
     * @return the events ordered by ascending notification id
     */
    Stream<PersistedEvent> loadPersistedEventsByNotificationId(LongRange notificationIdRange);

    /**
     * @return the highest assigned {@link NotificationId} or 0 if no events have been stored
     */
    long maxNotificationId();

    /**
     * @return the configuration used by this event store
     */
    EventStoreConfiguration getConfiguration();
}
