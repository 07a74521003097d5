package dk.eventchain.components.eventstore.notificationlog;

import dk.eventchain.components.eventstore.persistence.Notification;
import dk.eventchain.components.eventstore.types.NotificationId;

import java.util.*;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Reads a {@link NotificationLog} by following the {@link Section#nextId()} links.<br>
 * The reader remembers the position of the next notification to read, so repeated calls to {@link #read()} only return
 * notifications that were appended after the previous call. Instances are not thread safe.
 */
public class NotificationLogReader implements Iterable<Notification> {
    private final NotificationLog notificationLog;
    private       long            position;

    public NotificationLogReader(NotificationLog notificationLog) {
        this.notificationLog = requireNonNull(notificationLog, "No notificationLog provided");
        this.position = NotificationId.FIRST_NOTIFICATION_ID.longValue();
    }

    /**
     * Set the id of the next notification to read
     */
    public NotificationLogReader seek(long position) {
        requireTrue(position >= NotificationId.FIRST_NOTIFICATION_ID.longValue(), msg("position must be at least 1, but was {}", position));
        this.position = position;
        return this;
    }

    /**
     * @return the id of the next notification to read
     */
    public long position() {
        return position;
    }

    /**
     * Read all remaining notifications and advance the position past them
     */
    public List<Notification> read() {
        var result = new ArrayList<Notification>();
        iterator().forEachRemaining(result::add);
        return result;
    }

    /**
     * Read at most <code>advanceBy</code> notifications and advance the position past them
     */
    public List<Notification> readList(int advanceBy) {
        requireTrue(advanceBy >= 0, msg("advanceBy must not be negative, but was {}", advanceBy));
        var result   = new ArrayList<Notification>(Math.min(advanceBy, notificationLog.sectionSize()));
        var iterator = iterator();
        while (result.size() < advanceBy && iterator.hasNext()) {
            result.add(iterator.next());
        }
        return result;
    }

    /**
     * Lazily iterate over the remaining notifications. The position is advanced as notifications are returned
     */
    @Override
    public Iterator<Notification> iterator() {
        return new SectionIterator();
    }

    private class SectionIterator implements Iterator<Notification> {
        private Iterator<Notification> currentItems = Collections.emptyIterator();
        private Optional<String>       nextSectionId;

        private SectionIterator() {
            nextSectionId = Optional.of(LocalNotificationLog.formatSectionId(position, position + notificationLog.sectionSize() - 1));
        }

        @Override
        public boolean hasNext() {
            while (!currentItems.hasNext()) {
                if (nextSectionId.isEmpty()) {
                    return false;
                }
                var section = notificationLog.section(nextSectionId.get());
                nextSectionId = section.nextId();
                currentItems = section.items()
                                      .stream()
                                      .filter(notification -> notification.id().longValue() >= position)
                                      .iterator();
            }
            return true;
        }

        @Override
        public Notification next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var notification = currentItems.next();
            position = notification.id().longValue() + 1;
            return notification;
        }
    }
}
