package dk.eventchain.components.eventstore.eventstream;

import dk.eventchain.components.eventstore.types.*;

import java.util.Objects;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * A {@link DomainEvent} that has been durably stored together with the {@link NotificationId} it was assigned
 */
public final class PersistedEvent {
    private final DomainEvent    event;
    private final NotificationId notificationId;

    public PersistedEvent(DomainEvent event, NotificationId notificationId) {
        this.event = requireNonNull(event, "No event provided");
        this.notificationId = requireNonNull(notificationId, "No notificationId provided");
    }

    public static PersistedEvent from(DomainEvent event, NotificationId notificationId) {
        return new PersistedEvent(event, notificationId);
    }

    public DomainEvent event() {
        return event;
    }

    /**
     * The global position of the event in the notification log
     */
    public NotificationId notificationId() {
        return notificationId;
    }

    public OriginatorVersion originatorVersion() {
        return event.originatorVersion();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        PersistedEvent that = (PersistedEvent) o;
        return event.equals(that.event) && notificationId.equals(that.notificationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, notificationId);
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "notificationId=" + notificationId +
                ", event=" + event +
                '}';
    }
}
