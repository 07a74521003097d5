package dk.eventchain.components.eventstore.persistence;

import dk.eventchain.components.eventstore.hashchain.ChainLink;
import dk.eventchain.components.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * The stored form of a single event. The combination of {@link #originatorId()} and {@link #originatorVersion()} is unique.<br>
 * The {@link #state()} contains the serialized payload, optionally encrypted.
 * The {@link #notificationId()} is only present after the record has been inserted by a {@link RecordBackend}
 */
public final class StoredRecord implements ChainLink {
    private final UUID              originatorId;
    private final OriginatorVersion originatorVersion;
    private final EventType         eventType;
    private final byte[]            state;
    private final EventHash         eventHash;
    private final EventHash         previousHash;
    private final OffsetDateTime    timestamp;
    private final NotificationId    notificationId;

    public StoredRecord(UUID originatorId,
                        OriginatorVersion originatorVersion,
                        EventType eventType,
                        byte[] state,
                        EventHash eventHash,
                        EventHash previousHash,
                        OffsetDateTime timestamp,
                        NotificationId notificationId) {
        this.originatorId = requireNonNull(originatorId, "No originatorId provided");
        this.originatorVersion = requireNonNull(originatorVersion, "No originatorVersion provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.state = requireNonNull(state, "No state provided").clone();
        this.eventHash = requireNonNull(eventHash, "No eventHash provided");
        this.previousHash = requireNonNull(previousHash, "No previousHash provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
        this.notificationId = notificationId;
    }

    /**
     * Create a record that hasn't been assigned a {@link NotificationId} yet
     */
    public static StoredRecord unassigned(UUID originatorId,
                                          OriginatorVersion originatorVersion,
                                          EventType eventType,
                                          byte[] state,
                                          EventHash eventHash,
                                          EventHash previousHash,
                                          OffsetDateTime timestamp) {
        return new StoredRecord(originatorId,
                                originatorVersion,
                                eventType,
                                state,
                                eventHash,
                                previousHash,
                                timestamp,
                                null);
    }

    /**
     * Copy this record with the given {@link NotificationId}
     */
    public StoredRecord withNotificationId(NotificationId notificationId) {
        requireNonNull(notificationId, "No notificationId provided");
        return new StoredRecord(originatorId,
                                originatorVersion,
                                eventType,
                                state,
                                eventHash,
                                previousHash,
                                timestamp,
                                notificationId);
    }

    @Override
    public UUID originatorId() {
        return originatorId;
    }

    @Override
    public OriginatorVersion originatorVersion() {
        return originatorVersion;
    }

    @Override
    public EventType eventType() {
        return eventType;
    }

    public byte[] state() {
        return state.clone();
    }

    @Override
    public EventHash eventHash() {
        return eventHash;
    }

    @Override
    public EventHash previousHash() {
        return previousHash;
    }

    @Override
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    public Optional<NotificationId> notificationId() {
        return Optional.ofNullable(notificationId);
    }

    /**
     * @return the {@link Notification} view of this record
     * @throws IllegalStateException if the record hasn't been assigned a {@link NotificationId}
     */
    public Notification toNotification() {
        if (notificationId == null) {
            throw new IllegalStateException("The record hasn't been assigned a notification id");
        }
        return new Notification(notificationId,
                                originatorId,
                                originatorVersion,
                                eventType,
                                state);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredRecord)) return false;
        StoredRecord that = (StoredRecord) o;
        return originatorId.equals(that.originatorId) &&
                originatorVersion.equals(that.originatorVersion) &&
                eventType.equals(that.eventType) &&
                Arrays.equals(state, that.state) &&
                eventHash.equals(that.eventHash) &&
                previousHash.equals(that.previousHash) &&
                timestamp.isEqual(that.timestamp) &&
                Objects.equals(notificationId, that.notificationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(originatorId, originatorVersion, eventHash);
    }

    @Override
    public String toString() {
        return "StoredRecord{" +
                "originatorId=" + originatorId +
                ", originatorVersion=" + originatorVersion +
                ", eventType=" + eventType +
                ", eventHash=" + eventHash +
                ", previousHash=" + previousHash +
                ", timestamp=" + timestamp +
                ", notificationId=" + notificationId +
                '}';
    }
}
