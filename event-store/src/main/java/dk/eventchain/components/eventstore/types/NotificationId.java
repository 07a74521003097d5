package dk.eventchain.components.eventstore.types;

import dk.eventchain.components.eventstore.EventStore;
import dk.eventchain.components.common.types.LongType;

/**
 * The Notification Id is a sequential ever-growing number, which tracks the order in which events have been stored in the {@link EventStore}
 * across all aggregates.<br>
 * The first notification id has value 1 and the ids are contiguous, i.e. there are no gaps between the ids of committed events.
 */
public class NotificationId extends LongType<NotificationId> {
    /**
     * Special value that contains the {@link NotificationId} of the FIRST Event persisted in the {@link EventStore}
     */
    public static final NotificationId FIRST_NOTIFICATION_ID = NotificationId.of(1);

    public NotificationId(Long value) {
        super(value);
    }

    public static NotificationId of(long value) {
        return new NotificationId(value);
    }

    public NotificationId increment() {
        return new NotificationId(value() + 1);
    }
}
