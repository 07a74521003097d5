package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.aggregates.*;
import dk.eventchain.components.common.types.LongRange;
import dk.eventchain.components.eventstore.*;
import dk.eventchain.components.eventstore.eventstream.AggregateEventStream;
import dk.eventchain.components.eventstore.types.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * {@link AggregateRepository} decorator that loads aggregates from their latest {@link AggregateSnapshot} and only replays the events after it.<br>
 * When loading from a snapshot, the event at the snapshot version is read as well and its hash must equal the snapshot's head, otherwise
 * an {@link EventIntegrityException} is thrown. Aggregates without a usable snapshot are loaded by the decorated repository.<br>
 * Saving is delegated to the decorated repository. If a <code>snapshotEvery</code> interval is configured, a snapshot is taken each time a save
 * moves the aggregate's version across a multiple of the interval.
 * Discarded aggregates are never snapshotted.
 *
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
public class SnapshottingAggregateRepository<AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> implements AggregateRepository<AGGREGATE_TYPE> {
    private static final Logger log = LoggerFactory.getLogger(SnapshottingAggregateRepository.class);

    private final AggregateRepository<AGGREGATE_TYPE> delegate;
    private final EventStore                          eventStore;
    private final AggregateRootInstanceFactory        aggregateRootInstanceFactory;
    private final SnapshotStore                       snapshotStore;
    private final AggregateStateSerializer            stateSerializer;
    private final long                                snapshotEvery;

    /**
     * @param delegate                     the repository used for saving and for aggregates without a snapshot
     * @param eventStore                   the event store the delegate uses
     * @param aggregateRootInstanceFactory creates the empty aggregate instances the snapshot state is restored into
     * @param snapshotStore                the snapshot storage
     * @param stateSerializer              serializes the aggregate state
     * @param snapshotEvery                take a snapshot every <code>snapshotEvery</code> versions while saving. 0 disables automatic snapshots
     */
    public SnapshottingAggregateRepository(AggregateRepository<AGGREGATE_TYPE> delegate,
                                           EventStore eventStore,
                                           AggregateRootInstanceFactory aggregateRootInstanceFactory,
                                           SnapshotStore snapshotStore,
                                           AggregateStateSerializer stateSerializer,
                                           long snapshotEvery) {
        this.delegate = requireNonNull(delegate, "You must supply a delegate AggregateRepository");
        this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
        this.aggregateRootInstanceFactory = requireNonNull(aggregateRootInstanceFactory, "You must supply an AggregateRootInstanceFactory instance");
        this.snapshotStore = requireNonNull(snapshotStore, "You must supply a SnapshotStore instance");
        this.stateSerializer = requireNonNull(stateSerializer, "You must supply an AggregateStateSerializer instance");
        requireTrue(snapshotEvery >= 0, msg("snapshotEvery must be 0 or positive, but was {}", snapshotEvery));
        this.snapshotEvery = snapshotEvery;
    }

    /**
     * Decorate a repository created with {@link AggregateRepository#from(EventStore, Class)}, using a {@link JacksonAggregateStateSerializer}
     */
    public static <AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> SnapshottingAggregateRepository<AGGREGATE_TYPE> from(EventStore eventStore,
                                                                                                                           Class<AGGREGATE_TYPE> aggregateImplementationType,
                                                                                                                           SnapshotStore snapshotStore,
                                                                                                                           long snapshotEvery) {
        var aggregateRootInstanceFactory = AggregateRootInstanceFactory.objenesisAggregateRootFactory();
        return new SnapshottingAggregateRepository<>(AggregateRepository.from(eventStore, aggregateRootInstanceFactory, aggregateImplementationType),
                                                     eventStore,
                                                     aggregateRootInstanceFactory,
                                                     snapshotStore,
                                                     new JacksonAggregateStateSerializer(),
                                                     snapshotEvery);
    }

    @Override
    public Optional<AGGREGATE_TYPE> tryLoad(UUID aggregateId) {
        requireNonNull(aggregateId, "You must supply an aggregateId");
        var snapshot = snapshotStore.loadLatestSnapshot(aggregateId, aggregateImplementationType());
        if (snapshot.isEmpty()) {
            return delegate.tryLoad(aggregateId);
        }
        var aggregate = loadFromSnapshot(snapshot.get(), Optional.empty());
        if (aggregate.isDiscarded()) {
            log.debug("Found {} with id '{}' but it has been discarded at version {}",
                      aggregateImplementationType().getName(),
                      aggregateId,
                      aggregate.version());
            return Optional.empty();
        }
        return Optional.of(aggregate);
    }

    @Override
    public AGGREGATE_TYPE load(UUID aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateImplementationType()));
    }

    @Override
    public AGGREGATE_TYPE load(UUID aggregateId, OriginatorVersion atVersion) {
        requireNonNull(aggregateId, "You must supply an aggregateId");
        requireNonNull(atVersion, "You must supply an atVersion");
        requireTrue(atVersion.longValue() >= OriginatorVersion.FIRST_VERSION.longValue(),
                    msg("atVersion must be at least {}, but was {}", OriginatorVersion.FIRST_VERSION, atVersion));
        var snapshot = snapshotStore.loadLatestSnapshot(aggregateId, aggregateImplementationType(), atVersion);
        if (snapshot.isEmpty()) {
            return delegate.load(aggregateId, atVersion);
        }
        return loadFromSnapshot(snapshot.get(), Optional.of(atVersion));
    }

    private AGGREGATE_TYPE loadFromSnapshot(AggregateSnapshot snapshot, Optional<OriginatorVersion> atVersion) {
        var snapshotVersion = snapshot.aggregateVersion().longValue();
        var versionRange = atVersion.map(version -> LongRange.between(snapshotVersion, version.longValue()))
                                    .orElseGet(() -> LongRange.from(snapshotVersion));
        var events = eventStore.fetchStream(snapshot.aggregateId(), versionRange)
                               .map(AggregateEventStream::eventList)
                               .orElse(List.of());
        if (events.isEmpty() || !snapshot.aggregateVersion().equals(events.get(0).originatorVersion())) {
            throw new EventIntegrityException(msg("Snapshot of aggregate '{}' at version {} has no matching event",
                                                  snapshot.aggregateId(),
                                                  snapshot.aggregateVersion()),
                                              snapshot.aggregateId(),
                                              snapshot.aggregateVersion());
        }
        var snapshotEvent = events.get(0);
        if (!snapshot.head().equals(snapshotEvent.eventHash())) {
            throw new EventIntegrityException(msg("Snapshot of aggregate '{}' at version {} has head '{}' but the event has hash '{}'",
                                                  snapshot.aggregateId(),
                                                  snapshot.aggregateVersion(),
                                                  snapshot.head(),
                                                  snapshotEvent.eventHash()),
                                              snapshot.aggregateId(),
                                              snapshot.aggregateVersion());
        }

        var aggregate = stateSerializer.deserializeInto(snapshot.state(), aggregateRootInstanceFactory.create(aggregateImplementationType()));
        aggregate.restoreSnapshotPosition(snapshot.aggregateId(), snapshot.aggregateVersion(), snapshot.head());
        var eventsAfterSnapshot = events.subList(1, events.size());
        aggregate.rehydrate(eventsAfterSnapshot.stream());
        log.debug("Loaded {} with id '{}' at version {} from the snapshot at version {} and {} later event(s)",
                  aggregateImplementationType().getName(),
                  snapshot.aggregateId(),
                  aggregate.version(),
                  snapshot.aggregateVersion(),
                  eventsAfterSnapshot.size());
        return aggregate;
    }

    @Override
    public List<NotificationId> save(AGGREGATE_TYPE aggregate) {
        requireNonNull(aggregate, "You must supply an aggregate");
        var versionBeforeSave = aggregate.versionBeforeUncommittedChanges().longValue();
        var notificationIds   = delegate.save(aggregate);
        if (snapshotEvery > 0 && !notificationIds.isEmpty() && versionBeforeSave / snapshotEvery != aggregate.version().longValue() / snapshotEvery) {
            try {
                takeSnapshot(aggregate);
            } catch (RuntimeException e) {
                log.warn(msg("Failed to take a snapshot of {} with id '{}' at version {}. The events were saved",
                             aggregateImplementationType().getName(),
                             aggregate.aggregateId(),
                             aggregate.version()),
                         e);
            }
        }
        return notificationIds;
    }

    /**
     * Take a snapshot of an aggregate without uncommitted changes
     *
     * @param aggregate the aggregate
     * @return the snapshot, or {@link Optional#empty()} if the aggregate has been discarded
     */
    public Optional<AggregateSnapshot> takeSnapshot(AGGREGATE_TYPE aggregate) {
        requireNonNull(aggregate, "You must supply an aggregate");
        requireTrue(aggregate.uncommittedChanges().isEmpty(),
                    msg("{} with id '{}' has {} uncommitted change(s). Save it before taking a snapshot",
                        aggregateImplementationType().getName(),
                        aggregate.aggregateId(),
                        aggregate.uncommittedChanges().size()));
        requireTrue(aggregate.version().longValue() >= OriginatorVersion.FIRST_VERSION.longValue(),
                    "Can't take a snapshot of an aggregate without events");
        if (aggregate.isDiscarded()) {
            log.debug("Won't take a snapshot of discarded {} with id '{}'", aggregateImplementationType().getName(), aggregate.aggregateId());
            return Optional.empty();
        }
        var snapshot = new AggregateSnapshot(aggregate.aggregateId(),
                                             aggregateImplementationType().getName(),
                                             aggregate.version(),
                                             aggregate.head(),
                                             stateSerializer.serialize(aggregate),
                                             OffsetDateTime.now(ZoneOffset.UTC));
        snapshotStore.saveSnapshot(snapshot);
        log.debug("Took a snapshot of {} with id '{}' at version {}", aggregateImplementationType().getName(), aggregate.aggregateId(), aggregate.version());
        return Optional.of(snapshot);
    }

    @Override
    public Class<AGGREGATE_TYPE> aggregateImplementationType() {
        return delegate.aggregateImplementationType();
    }

    @Override
    public String toString() {
        return "SnapshottingAggregateRepository{" +
                "aggregateImplementationType=" + aggregateImplementationType().getName() +
                ", snapshotEvery=" + snapshotEvery +
                '}';
    }
}
