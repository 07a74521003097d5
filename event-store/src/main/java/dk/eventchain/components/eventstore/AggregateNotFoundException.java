package dk.eventchain.components.eventstore;

import java.util.UUID;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

public class AggregateNotFoundException extends EventStoreException {
    public final UUID     originatorId;
    public final Class<?> aggregateImplementationType;

    public AggregateNotFoundException(UUID originatorId) {
        super(msg("Couldn't find any events related to the aggregate with id '{}'", originatorId));
        this.originatorId = requireNonNull(originatorId, "You must supply an originatorId");
        this.aggregateImplementationType = null;
    }

    public AggregateNotFoundException(UUID originatorId, Class<?> aggregateImplementationType) {
        super(generateMessage(originatorId, aggregateImplementationType));
        this.originatorId = requireNonNull(originatorId, "You must supply an originatorId");
        this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
    }

    public AggregateNotFoundException(String message, UUID originatorId) {
        super(message);
        this.originatorId = requireNonNull(originatorId, "You must supply an originatorId");
        this.aggregateImplementationType = null;
    }

    public AggregateNotFoundException(String message, UUID originatorId, Class<?> aggregateImplementationType) {
        super(message);
        this.originatorId = requireNonNull(originatorId, "You must supply an originatorId");
        this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
    }

    private static String generateMessage(UUID originatorId, Class<?> aggregateImplementationType) {
        return msg("Couldn't find a '{}' aggregate with id '{}'",
                   aggregateImplementationType.getName(),
                   originatorId);
    }
}
