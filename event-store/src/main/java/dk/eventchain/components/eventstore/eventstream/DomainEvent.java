package dk.eventchain.components.eventstore.eventstream;

import dk.eventchain.components.eventstore.hashchain.*;
import dk.eventchain.components.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Immutable envelope around an event payload that belongs to the aggregate identified by {@link #originatorId()}.<br>
 * The envelope carries the position of the event within the aggregate's {@link AggregateEventStream} ({@link #originatorVersion()})
 * and the hash chain link ({@link #previousHash()} and {@link #eventHash()}).<br>
 * New instances are created by {@link HashChain#seal(UUID, OriginatorVersion, Object, OffsetDateTime, EventHash)} or when events are read back
 * from storage.
 */
public final class DomainEvent implements ChainLink {
    private final UUID              originatorId;
    private final OriginatorVersion originatorVersion;
    private final EventType         eventType;
    private final Object            payload;
    private final OffsetDateTime    timestamp;
    private final EventHash         previousHash;
    private final EventHash         eventHash;

    private DomainEvent(UUID originatorId,
                        OriginatorVersion originatorVersion,
                        EventType eventType,
                        Object payload,
                        OffsetDateTime timestamp,
                        EventHash previousHash,
                        EventHash eventHash) {
        this.originatorId = requireNonNull(originatorId, "No originatorId provided");
        this.originatorVersion = requireNonNull(originatorVersion, "No originatorVersion provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.payload = requireNonNull(payload, "No payload provided");
        this.timestamp = HashChain.normalizeTimestamp(requireNonNull(timestamp, "No timestamp provided"));
        this.previousHash = requireNonNull(previousHash, "No previousHash provided");
        this.eventHash = requireNonNull(eventHash, "No eventHash provided");
    }

    public static DomainEvent from(UUID originatorId,
                                   OriginatorVersion originatorVersion,
                                   EventType eventType,
                                   Object payload,
                                   OffsetDateTime timestamp,
                                   EventHash previousHash,
                                   EventHash eventHash) {
        return new DomainEvent(originatorId,
                               originatorVersion,
                               eventType,
                               payload,
                               timestamp,
                               previousHash,
                               eventHash);
    }

    /**
     * The id of the aggregate this event belongs to
     */
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

    public Object payload() {
        return payload;
    }

    /**
     * Get the payload cast to the given type
     *
     * @param payloadType the expected payload type
     * @param <T>         the payload type
     * @return the payload
     */
    public <T> T payloadAs(Class<T> payloadType) {
        requireNonNull(payloadType, "No payloadType provided");
        return payloadType.cast(payload);
    }

    /**
     * When the event was created (UTC, microsecond precision)
     */
    @Override
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    /**
     * The {@link #eventHash()} of the preceding event or {@link EventHash#GENESIS} for the first event
     */
    @Override
    public EventHash previousHash() {
        return previousHash;
    }

    @Override
    public EventHash eventHash() {
        return eventHash;
    }

    public boolean isFirstEvent() {
        return OriginatorVersion.FIRST_VERSION.equals(originatorVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainEvent)) return false;
        DomainEvent that = (DomainEvent) o;
        return originatorId.equals(that.originatorId) &&
                originatorVersion.equals(that.originatorVersion) &&
                eventHash.equals(that.eventHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(originatorId, originatorVersion, eventHash);
    }

    @Override
    public String toString() {
        return "DomainEvent{" +
                "originatorId=" + originatorId +
                ", originatorVersion=" + originatorVersion +
                ", eventType=" + eventType +
                ", timestamp=" + timestamp +
                ", previousHash=" + previousHash +
                ", eventHash=" + eventHash +
                '}';
    }
}
