package dk.eventchain.components.eventstore.notificationlog;

import dk.eventchain.components.eventstore.persistence.Notification;
import dk.eventchain.components.eventstore.types.NotificationId;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;

/**
 * Read access to all stored events in the order they were appended, identified by their {@link NotificationId}.<br>
 * The log is gap free: notification ids start at {@link NotificationId#FIRST_NOTIFICATION_ID} and are contiguous.
 *
 * @see LocalNotificationLog
 */
public interface NotificationLog {
    String CURRENT_SECTION_ID = "current";

    /**
     * Read the notifications with ids in <code>[startId, startId + limit)</code> that exist
     *
     * @param startId the first notification id to include
     * @param limit   the maximum number of notifications
     * @return the notifications in ascending id order
     */
    List<Notification> read(long startId, int limit);

    /**
     * Get a section of the log
     *
     * @param sectionId either <code>"first,last"</code> (1-based, inclusive) or {@value #CURRENT_SECTION_ID}
     * @return the section
     * @throws IllegalArgumentException if the section id is malformed
     */
    Section section(String sectionId);

    /**
     * The section containing the most recently appended notification
     */
    default Section currentSection() {
        return section(CURRENT_SECTION_ID);
    }

    /**
     * The number of notifications in a full section
     */
    int sectionSize();

    /**
     * Continuously poll the log for new notifications starting at <code>fromId</code>
     *
     * @param fromId          the first notification id to emit
     * @param batchSize       the maximum number of notifications read per poll
     * @param pollingInterval the interval between polls
     * @return a {@link Flux} that emits every notification from <code>fromId</code> and onwards, in order
     */
    Flux<Notification> pollNotifications(long fromId, int batchSize, Duration pollingInterval);
}
