package dk.eventchain.components.aggregates;

import java.util.UUID;

import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Thrown when an event is triggered on, or applied to, an aggregate that has been discarded
 */
public class AggregateDiscardedException extends AggregateException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;

    public AggregateDiscardedException(UUID aggregateId, Class<?> aggregateType) {
        super(msg("The '{}' aggregate with id '{}' has been discarded", aggregateType.getName(), aggregateId));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
