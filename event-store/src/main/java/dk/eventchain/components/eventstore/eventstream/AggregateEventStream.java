package dk.eventchain.components.eventstore.eventstream;

import dk.eventchain.components.common.types.LongRange;

import java.util.*;
import java.util.function.*;
import java.util.stream.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * The (possibly partial) event stream of a single aggregate.<br>
 * The events are provided as a lazy, finite and <b>single use</b> {@link Stream} ordered by ascending originator version.
 */
public final class AggregateEventStream {
    private final UUID                originatorId;
    private final LongRange           versionRange;
    private final Stream<DomainEvent> eventStream;

    private AggregateEventStream(UUID originatorId, LongRange versionRange, Stream<DomainEvent> eventStream) {
        this.originatorId = requireNonNull(originatorId, "No originatorId provided");
        this.versionRange = requireNonNull(versionRange, "No versionRange provided");
        this.eventStream = requireNonNull(eventStream, "No eventStream provided");
    }

    public static AggregateEventStream of(UUID originatorId, LongRange versionRange, Stream<DomainEvent> eventStream) {
        return new AggregateEventStream(originatorId, versionRange, eventStream);
    }

    public UUID originatorId() {
        return originatorId;
    }

    /**
     * The version range that was requested when the stream was loaded
     */
    public LongRange versionRange() {
        return versionRange;
    }

    /**
     * The events in the stream. Can only be consumed once
     */
    public Stream<DomainEvent> events() {
        return eventStream;
    }

    public List<DomainEvent> eventList() {
        return eventStream.collect(Collectors.toList());
    }

    public <R> Stream<R> map(Function<? super DomainEvent, ? extends R> mapper) {
        return eventStream.map(mapper);
    }

    public void forEach(Consumer<? super DomainEvent> consumer) {
        eventStream.forEach(consumer);
    }

    @Override
    public String toString() {
        return "AggregateEventStream{" +
                "originatorId=" + originatorId +
                ", versionRange=" + versionRange +
                '}';
    }
}
