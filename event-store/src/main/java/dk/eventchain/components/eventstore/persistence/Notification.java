package dk.eventchain.components.eventstore.persistence;

import dk.eventchain.components.eventstore.notificationlog.NotificationLog;
import dk.eventchain.components.eventstore.types.*;

import java.util.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * An entry in the {@link NotificationLog}. The {@link #state()} is the stored state of the event,
 * i.e. it's encrypted when the event store uses a cipher
 */
public final class Notification {
    private final NotificationId    id;
    private final UUID              originatorId;
    private final OriginatorVersion originatorVersion;
    private final EventType         eventType;
    private final byte[]            state;

    public Notification(NotificationId id,
                        UUID originatorId,
                        OriginatorVersion originatorVersion,
                        EventType eventType,
                        byte[] state) {
        this.id = requireNonNull(id, "No id provided");
        this.originatorId = requireNonNull(originatorId, "No originatorId provided");
        this.originatorVersion = requireNonNull(originatorVersion, "No originatorVersion provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.state = requireNonNull(state, "No state provided").clone();
    }

    public NotificationId id() {
        return id;
    }

    public UUID originatorId() {
        return originatorId;
    }

    public OriginatorVersion originatorVersion() {
        return originatorVersion;
    }

    /**
     * The event type (aka. topic)
     */
    public EventType eventType() {
        return eventType;
    }

    public byte[] state() {
        return state.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Notification)) return false;
        Notification that = (Notification) o;
        return id.equals(that.id) &&
                originatorId.equals(that.originatorId) &&
                originatorVersion.equals(that.originatorVersion) &&
                eventType.equals(that.eventType) &&
                Arrays.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, originatorId, originatorVersion);
    }

    @Override
    public String toString() {
        return "Notification{" +
                "id=" + id +
                ", originatorId=" + originatorId +
                ", originatorVersion=" + originatorVersion +
                ", eventType=" + eventType +
                '}';
    }
}
