package dk.eventchain.components.eventstore.persistence.inmemory;

import dk.eventchain.components.eventstore.persistence.*;
import dk.eventchain.components.eventstore.types.NotificationId;
import dk.eventchain.components.common.types.LongRange;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * {@link RecordBackend} that keeps all records in memory.<br>
 * A single lock guards both the per aggregate records and the notification sequence, so inserts are atomic
 * and notification ids are contiguous.
 */
public class InMemoryRecordBackend implements RecordBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordBackend.class);

    protected final ReentrantLock                          lock                 = new ReentrantLock();
    protected final Map<UUID, TreeMap<Long, StoredRecord>> recordsPerOriginator = new HashMap<>();
    /**
     * Index = notification id - 1
     */
    protected final List<StoredRecord>                     notifications        = new ArrayList<>();

    @Override
    public List<StoredRecord> insert(List<StoredRecord> records) {
        requireNonNull(records, "No records provided");
        if (records.isEmpty()) {
            return List.of();
        }
        lock.lock();
        try {
            var keysInBatch = new HashSet<String>();
            for (var record : records) {
                var existing = recordsPerOriginator.get(record.originatorId());
                var version  = record.originatorVersion().longValue();
                if ((existing != null && existing.containsKey(version)) || !keysInBatch.add(record.originatorId() + "/" + version)) {
                    throw new RecordConflictException(msg("A record for aggregate '{}' with version {} already exists",
                                                          record.originatorId(),
                                                          version),
                                                      RecordConflictException.Conflict.ORIGINATOR_VERSION);
                }
            }

            var inserted = new ArrayList<StoredRecord>(records.size());
            for (var record : records) {
                var assigned = record.withNotificationId(NotificationId.of(notifications.size() + 1L));
                recordsPerOriginator.computeIfAbsent(record.originatorId(), originatorId -> new TreeMap<>())
                                    .put(record.originatorVersion().longValue(), assigned);
                notifications.add(assigned);
                inserted.add(assigned);
            }
            log.trace("Inserted {} record(s). Max notification id is now {}", inserted.size(), notifications.size());
            return inserted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredRecord> selectRecords(UUID originatorId, LongRange versionRange) {
        requireNonNull(originatorId, "No originatorId provided");
        requireNonNull(versionRange, "No versionRange provided");
        lock.lock();
        try {
            var records = recordsPerOriginator.get(originatorId);
            if (records == null) {
                return List.of();
            }
            long toInclusive = versionRange.isClosedRange() ? versionRange.toInclusive : Long.MAX_VALUE;
            if (toInclusive < versionRange.fromInclusive) {
                return List.of();
            }
            return new ArrayList<>(records.subMap(versionRange.fromInclusive, true, toInclusive, true).values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StoredRecord> selectLastRecord(UUID originatorId) {
        requireNonNull(originatorId, "No originatorId provided");
        lock.lock();
        try {
            var records = recordsPerOriginator.get(originatorId);
            if (records == null || records.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(records.lastEntry().getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredRecord> selectNotifications(LongRange notificationIdRange) {
        requireNonNull(notificationIdRange, "No notificationIdRange provided");
        lock.lock();
        try {
            long fromInclusive = Math.max(NotificationId.FIRST_NOTIFICATION_ID.longValue(), notificationIdRange.fromInclusive);
            long toInclusive   = notificationIdRange.isClosedRange() ? Math.min(notificationIdRange.toInclusive, notifications.size()) : notifications.size();
            if (fromInclusive > toInclusive) {
                return List.of();
            }
            return notifications.subList((int) fromInclusive - 1, (int) toInclusive)
                                .stream()
                                .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long maxNotificationId() {
        lock.lock();
        try {
            return notifications.size();
        } finally {
            lock.unlock();
        }
    }
}
