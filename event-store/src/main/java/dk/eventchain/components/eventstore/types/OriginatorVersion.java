package dk.eventchain.components.eventstore.types;

import dk.eventchain.components.eventstore.eventstream.*;
import dk.eventchain.components.common.types.LongType;

/**
 * Each {@link DomainEvent} has its own unique position within the {@link AggregateEventStream} of the aggregate it belongs to,
 * also known as the originator-version.<br>
 * <br>
 * The first version is 1 and every following event increments the version by exactly one, i.e. the version of an aggregate
 * is equal to the number of events that have been applied to it.<br>
 * This is related to a <b>specific</b> aggregate instance (as opposed to the {@link PersistedEvent#notificationId()}, which contains
 * the order of ALL events stored in the event store)
 */
public class OriginatorVersion extends LongType<OriginatorVersion> {
    /**
     * Special value that signifies that no events have been persisted in relation to a given aggregate
     */
    public static final OriginatorVersion NO_EVENTS_PERSISTED = OriginatorVersion.of(0);
    /**
     * Special value that contains the {@link OriginatorVersion} of the FIRST Event persisted in context of a given aggregate id
     */
    public static final OriginatorVersion FIRST_VERSION       = OriginatorVersion.of(1);

    public OriginatorVersion(Long value) {
        super(value);
    }

    public static OriginatorVersion of(long value) {
        return new OriginatorVersion(value);
    }

    public OriginatorVersion increment() {
        return new OriginatorVersion(value() + 1);
    }

    public OriginatorVersion decrement() {
        return new OriginatorVersion(value() - 1);
    }
}
