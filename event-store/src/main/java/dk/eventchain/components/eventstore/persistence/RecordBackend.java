package dk.eventchain.components.eventstore.persistence;

import dk.eventchain.components.eventstore.persistence.inmemory.InMemoryRecordBackend;
import dk.eventchain.components.eventstore.persistence.jdbi.JdbiRecordBackend;
import dk.eventchain.components.eventstore.types.NotificationId;
import dk.eventchain.components.common.types.LongRange;

import java.util.*;

/**
 * Durable storage of {@link StoredRecord}s.<br>
 * Implementations must guarantee that {@link #insert(List)} is atomic: either all records are stored and assigned
 * contiguous {@link NotificationId}s or none are.
 *
 * @see InMemoryRecordBackend
 * @see JdbiRecordBackend
 */
public interface RecordBackend {
    /**
     * Atomically insert the records and assign each of them the next {@link NotificationId}, in list order
     *
     * @param records the records to insert
     * @return the inserted records with their assigned {@link NotificationId}
     * @throws RecordConflictException in case a record with the same originator id and version already exists
     */
    List<StoredRecord> insert(List<StoredRecord> records);

    /**
     * Select the records related to the aggregate within the version range, ordered by ascending version
     *
     * @param originatorId the aggregate id
     * @param versionRange the range of versions to select
     * @return the matching records
     */
    List<StoredRecord> selectRecords(UUID originatorId, LongRange versionRange);

    /**
     * Select the record with the highest version related to the aggregate
     */
    Optional<StoredRecord> selectLastRecord(UUID originatorId);

    /**
     * Select the records with a {@link NotificationId} within the range, ordered by ascending notification id
     */
    List<StoredRecord> selectNotifications(LongRange notificationIdRange);

    /**
     * @return the highest assigned {@link NotificationId} or 0 in case no records have been stored
     */
    long maxNotificationId();
}
