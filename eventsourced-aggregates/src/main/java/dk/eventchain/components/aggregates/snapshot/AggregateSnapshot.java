package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.eventchain.components.common.FailFast.*;

/**
 * The serialized state of an aggregate as it was after applying the event with {@link #aggregateVersion()}.<br>
 * {@link #head()} is the hash of that event, which ties the snapshot to the aggregate's hash chain
 */
public final class AggregateSnapshot {
    private final UUID              aggregateId;
    private final String            aggregateType;
    private final OriginatorVersion aggregateVersion;
    private final EventHash         head;
    private final byte[]            state;
    private final OffsetDateTime    takenAt;

    public AggregateSnapshot(UUID aggregateId,
                             String aggregateType,
                             OriginatorVersion aggregateVersion,
                             EventHash head,
                             byte[] state,
                             OffsetDateTime takenAt) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateVersion = requireNonNull(aggregateVersion, "No aggregateVersion provided");
        this.head = requireNonNull(head, "No head provided");
        this.state = requireNonNull(state, "No state provided").clone();
        this.takenAt = requireNonNull(takenAt, "No takenAt provided");
        requireTrue(aggregateVersion.longValue() >= OriginatorVersion.FIRST_VERSION.longValue(),
                    "A snapshot can only be taken of an aggregate with at least one event");
    }

    public UUID aggregateId() {
        return aggregateId;
    }

    /**
     * Fully qualified class name of the aggregate
     */
    public String aggregateType() {
        return aggregateType;
    }

    public OriginatorVersion aggregateVersion() {
        return aggregateVersion;
    }

    public EventHash head() {
        return head;
    }

    public byte[] state() {
        return state.clone();
    }

    public OffsetDateTime takenAt() {
        return takenAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateSnapshot)) return false;
        var that = (AggregateSnapshot) o;
        return aggregateId.equals(that.aggregateId) &&
                aggregateType.equals(that.aggregateType) &&
                aggregateVersion.equals(that.aggregateVersion) &&
                head.equals(that.head) &&
                Arrays.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, aggregateVersion, head);
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{" +
                "aggregateId=" + aggregateId +
                ", aggregateType='" + aggregateType + '\'' +
                ", aggregateVersion=" + aggregateVersion +
                ", head=" + head +
                ", takenAt=" + takenAt +
                '}';
    }
}
