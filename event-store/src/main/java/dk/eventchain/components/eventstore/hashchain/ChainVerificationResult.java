package dk.eventchain.components.eventstore.hashchain;

import dk.eventchain.components.eventstore.types.*;

import java.util.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Result of a successful hash chain verification
 */
public final class ChainVerificationResult {
    private final Optional<UUID>    originatorId;
    private final long              numberOfEvents;
    private final EventHash         head;
    private final OriginatorVersion lastVersion;

    public ChainVerificationResult(Optional<UUID> originatorId, long numberOfEvents, EventHash head, OriginatorVersion lastVersion) {
        this.originatorId = requireNonNull(originatorId, "No originatorId option provided");
        this.numberOfEvents = numberOfEvents;
        this.head = requireNonNull(head, "No head provided");
        this.lastVersion = requireNonNull(lastVersion, "No lastVersion provided");
    }

    /**
     * The aggregate the verified events belong to (empty when no events were verified)
     */
    public Optional<UUID> originatorId() {
        return originatorId;
    }

    public long numberOfEvents() {
        return numberOfEvents;
    }

    /**
     * The hash of the last verified event, or {@link EventHash#GENESIS} when no events were verified
     */
    public EventHash head() {
        return head;
    }

    public OriginatorVersion lastVersion() {
        return lastVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainVerificationResult)) return false;
        ChainVerificationResult that = (ChainVerificationResult) o;
        return numberOfEvents == that.numberOfEvents &&
                originatorId.equals(that.originatorId) &&
                head.equals(that.head) &&
                lastVersion.equals(that.lastVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(originatorId, numberOfEvents, head, lastVersion);
    }

    @Override
    public String toString() {
        return "ChainVerificationResult{" +
                "originatorId=" + originatorId +
                ", numberOfEvents=" + numberOfEvents +
                ", head=" + head +
                ", lastVersion=" + lastVersion +
                '}';
    }
}
