package dk.eventchain.components.eventstore.notificationlog;

import dk.eventchain.components.eventstore.EventStore;
import dk.eventchain.components.eventstore.persistence.Notification;
import dk.eventchain.components.eventstore.types.NotificationId;
import dk.eventchain.components.common.types.LongRange;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * {@link NotificationLog} that reads notifications directly from an {@link EventStore}.<br>
 * Sections are aligned to the section size: with the default size of {@value #DEFAULT_SECTION_SIZE} the sections are
 * <code>1,20</code>, <code>21,40</code>, etc. A requested section id is normalized to the aligned section that contains its first id.
 */
public class LocalNotificationLog implements NotificationLog {
    public static final  int    DEFAULT_SECTION_SIZE = 20;
    private static final Logger log                  = LoggerFactory.getLogger(LocalNotificationLog.class);

    private final EventStore eventStore;
    private final int        sectionSize;

    public LocalNotificationLog(EventStore eventStore) {
        this(eventStore, DEFAULT_SECTION_SIZE);
    }

    public LocalNotificationLog(EventStore eventStore, int sectionSize) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        requireTrue(sectionSize > 0, msg("sectionSize must be positive, but was {}", sectionSize));
        this.sectionSize = sectionSize;
    }

    @Override
    public int sectionSize() {
        return sectionSize;
    }

    @Override
    public List<Notification> read(long startId, int limit) {
        requireTrue(limit >= 0, msg("limit must not be negative, but was {}", limit));
        if (limit == 0) {
            return List.of();
        }
        var fromInclusive = Math.max(NotificationId.FIRST_NOTIFICATION_ID.longValue(), startId);
        var toInclusive   = startId + limit - 1;
        if (toInclusive < fromInclusive) {
            return List.of();
        }
        return eventStore.loadEventsByNotificationId(LongRange.between(fromInclusive, toInclusive))
                         .collect(Collectors.toList());
    }

    @Override
    public Section section(String sectionId) {
        requireNonNull(sectionId, "No sectionId provided");
        long start;
        if (CURRENT_SECTION_ID.equals(sectionId.trim())) {
            var maxNotificationId = eventStore.maxNotificationId();
            start = alignedStart(Math.max(NotificationId.FIRST_NOTIFICATION_ID.longValue(), maxNotificationId));
        } else {
            start = alignedStart(parseFirstId(sectionId));
        }
        var end   = start + sectionSize - 1;
        var items = read(start, sectionSize);
        var previousId = start > NotificationId.FIRST_NOTIFICATION_ID.longValue() ?
                         Optional.of(formatSectionId(start - sectionSize, start - 1)) :
                         Optional.<String>empty();
        var nextId = items.size() == sectionSize ?
                     Optional.of(formatSectionId(end + 1, end + sectionSize)) :
                     Optional.<String>empty();
        var section = new Section(formatSectionId(start, end), items, previousId, nextId);
        log.trace("Resolved section '{}' to {}", sectionId, section);
        return section;
    }

    private long alignedStart(long firstId) {
        return ((firstId - 1) / sectionSize) * sectionSize + 1;
    }

    private static long parseFirstId(String sectionId) {
        var parts = sectionId.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException(msg("Malformed section id '{}'. Expected '{}' or '<first>,<last>'", sectionId, CURRENT_SECTION_ID));
        }
        long first;
        long last;
        try {
            first = Long.parseLong(parts[0].trim());
            last = Long.parseLong(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(msg("Malformed section id '{}'. The first and last ids must be numbers", sectionId), e);
        }
        if (first < NotificationId.FIRST_NOTIFICATION_ID.longValue() || last < first) {
            throw new IllegalArgumentException(msg("Malformed section id '{}'. Expected 1 <= first <= last", sectionId));
        }
        return first;
    }

    static String formatSectionId(long first, long last) {
        return first + "," + last;
    }

    @Override
    public Flux<Notification> pollNotifications(long fromId, int batchSize, Duration pollingInterval) {
        requireTrue(batchSize > 0, msg("batchSize must be positive, but was {}", batchSize));
        requireNonNull(pollingInterval, "You must supply a pollingInterval");

        var streamLogName = "NotificationLog:" + UUID.randomUUID();
        var pollingLog    = LoggerFactory.getLogger(NotificationLog.class.getName() + ".Polling");
        pollingLog.debug("[{}] Creating polling notification stream with fromId {} and batch size {}",
                         streamLogName,
                         fromId,
                         batchSize);
        final AtomicLong nextFromId = new AtomicLong(Math.max(NotificationId.FIRST_NOTIFICATION_ID.longValue(), fromId));
        var notificationsFlux = Flux.defer(() -> {
            try {
                var notifications = read(nextFromId.get(), batchSize);
                if (notifications.size() > 0) {
                    pollingLog.debug("[{}] read using fromId {} returned {} notifications",
                                     streamLogName,
                                     nextFromId.get(),
                                     notifications.size());
                } else {
                    pollingLog.trace("[{}] read using fromId {} returned no notifications",
                                     streamLogName,
                                     nextFromId.get());
                }
                return Flux.fromIterable(notifications);
            } catch (RuntimeException e) {
                pollingLog.error(msg("[{}] Polling failed using fromId {}",
                                     streamLogName,
                                     nextFromId.get()),
                                 e);
                return Flux.error(e);
            }
        }).doOnNext(notification -> {
            final long nextId = notification.id().longValue() + 1L;
            pollingLog.trace("[{}] Updating nextFromId from {} to {}",
                             streamLogName,
                             nextFromId.get(),
                             nextId);
            nextFromId.set(nextId);
        });

        return notificationsFlux
                .repeatWhen(longFlux -> Flux.interval(pollingInterval));
    }
}
