package dk.eventchain.components.eventstore;

import dk.eventchain.components.eventstore.eventstream.*;
import dk.eventchain.components.eventstore.hashchain.*;
import dk.eventchain.components.eventstore.persistence.*;
import dk.eventchain.components.eventstore.types.*;
import dk.eventchain.components.common.types.LongRange;
import org.slf4j.*;

import java.util.*;
import java.util.stream.*;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * {@link EventStore} that stores events as {@link StoredRecord}s in a {@link RecordBackend}.<br>
 * The atomicity of an append (uniqueness check and notification id assignment) is delegated to the {@link RecordBackend#insert(List)}
 */
public class DefaultEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(DefaultEventStore.class);

    private final RecordBackend           recordBackend;
    private final EventStoreConfiguration configuration;
    private final StoredRecordMapper      recordMapper;

    public DefaultEventStore(RecordBackend recordBackend) {
        this(recordBackend, EventStoreConfiguration.defaultConfiguration());
    }

    public DefaultEventStore(RecordBackend recordBackend, EventStoreConfiguration configuration) {
        this.recordBackend = requireNonNull(recordBackend, "No recordBackend provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.recordMapper = new StoredRecordMapper(configuration.eventSerializer(), configuration.compressor, configuration.cipher);
    }

    @Override
    public EventStoreConfiguration getConfiguration() {
        return configuration;
    }

    public RecordBackend getRecordBackend() {
        return recordBackend;
    }

    @Override
    public List<PersistedEvent> appendToStream(UUID originatorId, OriginatorVersion expectedVersion, List<DomainEvent> events) {
        requireNonNull(originatorId, "No originatorId provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            log.trace("No events to append to the stream of aggregate '{}'", originatorId);
            return List.of();
        }
        validateEventsToAppend(originatorId, expectedVersion, events);

        var lastPersistedRecord = recordBackend.selectLastRecord(originatorId);
        var persistedVersion = lastPersistedRecord.map(StoredRecord::originatorVersion)
                                                  .orElse(OriginatorVersion.NO_EVENTS_PERSISTED);
        if (!persistedVersion.equals(expectedVersion)) {
            throw new OptimisticAppendToStreamException(msg("Optimistic Concurrency Exception: Failed to append {} event(s) to the stream of aggregate '{}'. " +
                                                                    "Expected persisted version {} but the persisted version is {}",
                                                            events.size(),
                                                            originatorId,
                                                            expectedVersion,
                                                            persistedVersion));
        }
        var head = lastPersistedRecord.map(StoredRecord::eventHash).orElse(EventHash.GENESIS);
        var firstEvent = events.get(0);
        if (!head.equals(firstEvent.previousHash())) {
            throw new EventIntegrityException(msg("The first event to append to the stream of aggregate '{}' (version {}) links to '{}' but the persisted head is '{}'",
                                                  originatorId,
                                                  firstEvent.originatorVersion(),
                                                  firstEvent.previousHash(),
                                                  head),
                                              originatorId,
                                              firstEvent.originatorVersion());
        }

        var verifier = configuration.hashChain.verifierForRange();
        var records = events.stream()
                            .map(event -> {
                                var plainState = configuration.eventSerializer().serialize(event.payload());
                                verifier.accept(event, plainState);
                                return recordMapper.toRecord(event, plainState);
                            })
                            .collect(Collectors.toList());

        List<StoredRecord> insertedRecords;
        try {
            insertedRecords = recordBackend.insert(records);
        } catch (RecordConflictException e) {
            if (e.conflict() == RecordConflictException.Conflict.ORIGINATOR_VERSION) {
                throw new OptimisticAppendToStreamException(msg("Optimistic Concurrency Exception: Failed to append {} event(s) to the stream of aggregate '{}'. " +
                                                                        "First event was appended with version {}. Details: {}",
                                                                events.size(),
                                                                originatorId,
                                                                firstEvent.originatorVersion(),
                                                                e.getMessage()),
                                                            e);
            }
            throw new AppendToStreamException(msg("Failed to append {} event(s) to the stream of aggregate '{}' due to a {} conflict",
                                                  events.size(),
                                                  originatorId,
                                                  e.conflict()),
                                              e);
        } catch (EventStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AppendToStreamException(msg("Failed to append {} event(s) to the stream of aggregate '{}'",
                                                  events.size(),
                                                  originatorId),
                                              e);
        }

        var persistedEvents = new ArrayList<PersistedEvent>(events.size());
        for (int i = 0; i < events.size(); i++) {
            persistedEvents.add(PersistedEvent.from(events.get(i),
                                                    insertedRecords.get(i).notificationId().orElseThrow()));
        }
        log.debug("Appended {} event(s) with versions {} to {} to the stream of aggregate '{}'. Notification ids {} to {}",
                  persistedEvents.size(),
                  firstEvent.originatorVersion(),
                  events.get(events.size() - 1).originatorVersion(),
                  originatorId,
                  persistedEvents.get(0).notificationId(),
                  persistedEvents.get(persistedEvents.size() - 1).notificationId());
        return persistedEvents;
    }

    private void validateEventsToAppend(UUID originatorId, OriginatorVersion expectedVersion, List<DomainEvent> events) {
        var nextVersion = expectedVersion.increment();
        for (var event : events) {
            requireNonNull(event, "The list of events contains a null element");
            requireTrue(originatorId.equals(event.originatorId()),
                        msg("Cannot append event with version {} belonging to aggregate '{}' to the stream of aggregate '{}'",
                            event.originatorVersion(),
                            event.originatorId(),
                            originatorId));
            requireTrue(nextVersion.equals(event.originatorVersion()),
                        msg("Events appended to the stream of aggregate '{}' must have contiguous versions. Expected version {} but got version {}",
                            originatorId,
                            nextVersion,
                            event.originatorVersion()));
            nextVersion = nextVersion.increment();
        }
    }

    @Override
    public Optional<AggregateEventStream> fetchStream(UUID originatorId, LongRange versionRange) {
        requireNonNull(originatorId, "No originatorId provided");
        requireNonNull(versionRange, "No versionRange provided");
        var records = recordBackend.selectRecords(originatorId, versionRange);
        log.debug("Fetched {} record(s) for aggregate '{}' within version range {}", records.size(), originatorId, versionRange);
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(AggregateEventStream.of(originatorId,
                                                   versionRange,
                                                   mapRecords(records.stream(), configuration.verifyOnRead)));
    }

    /**
     * Maps the records lazily. With <code>verify</code> each record is hash verified and linked to its predecessor before its payload
     * is deserialized, while the stream is consumed
     */
    private Stream<DomainEvent> mapRecords(Stream<StoredRecord> records, boolean verify) {
        if (!verify) {
            return records.map(recordMapper::toDomainEvent);
        }
        var verifier = configuration.hashChain.verifierForRange();
        return records.map(record -> {
            var plainState = plainStateOf(record);
            verifier.accept(record, plainState);
            return recordMapper.toDomainEvent(record, plainState);
        });
    }

    @Override
    public ChainVerificationResult verifyChain(UUID originatorId) {
        requireNonNull(originatorId, "No originatorId provided");
        var verifier = configuration.hashChain.verifierFromGenesis();
        recordBackend.selectRecords(originatorId, LongRange.from(OriginatorVersion.FIRST_VERSION.longValue()))
                     .forEach(record -> verifier.accept(record, plainStateOf(record)));
        var result = verifier.result();
        log.debug("Verified the hash chain of aggregate '{}': {}", originatorId, result);
        return result;
    }

    /**
     * Decrypt and decompress the state of the record, naming the record if the state can't be restored
     */
    private byte[] plainStateOf(StoredRecord record) {
        try {
            return recordMapper.plainState(record);
        } catch (EventIntegrityException e) {
            throw new EventIntegrityException(msg("Failed to restore the state of aggregate '{}' at version {}: {}",
                                                  record.originatorId(),
                                                  record.originatorVersion(),
                                                  e.getMessage()),
                                              record.originatorId(),
                                              record.originatorVersion(),
                                              e);
        }
    }

    @Override
    public Optional<PersistedEvent> loadLastPersistedEventRelatedTo(UUID originatorId) {
        requireNonNull(originatorId, "No originatorId provided");
        var lastPersistedEvent = recordBackend.selectLastRecord(originatorId)
                                              .map(recordMapper::toPersistedEvent);
        log.debug("Found Last-Persisted-Event for aggregate with id '{}': {}", originatorId, lastPersistedEvent);
        return lastPersistedEvent;
    }

    @Override
    public Stream<Notification> loadEventsByNotificationId(LongRange notificationIdRange) {
        requireNonNull(notificationIdRange, "No notificationIdRange provided");
        return recordBackend.selectNotifications(notificationIdRange)
                            .stream()
                            .map(StoredRecord::toNotification);
    }

    @Override
    public Stream<PersistedEvent> loadPersistedEventsByNotificationId(LongRange notificationIdRange) {
        requireNonNull(notificationIdRange, "No notificationIdRange provided");
        return recordBackend.selectNotifications(notificationIdRange)
                            .stream()
                            .map(recordMapper::toPersistedEvent);
    }

    @Override
    public long maxNotificationId() {
        return recordBackend.maxNotificationId();
    }
}
