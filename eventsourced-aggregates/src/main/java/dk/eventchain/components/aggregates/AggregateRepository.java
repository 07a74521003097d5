package dk.eventchain.components.aggregates;

import dk.eventchain.components.eventstore.*;
import dk.eventchain.components.eventstore.eventstream.PersistedEvent;
import dk.eventchain.components.eventstore.persistence.OptimisticAppendToStreamException;
import dk.eventchain.components.eventstore.types.*;
import dk.eventchain.components.common.types.LongRange;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Repository that loads {@link AggregateRoot}s by replaying their events from an {@link EventStore} and saves their uncommitted changes.<br>
 * A repository holds no state besides its collaborators, so create one instance per aggregate type.
 *
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
public interface AggregateRepository<AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> {
    /**
     * Create an {@link AggregateRepository} that uses {@link AggregateRootInstanceFactory#objenesisAggregateRootFactory()}
     */
    static <AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> AggregateRepository<AGGREGATE_TYPE> from(EventStore eventStore,
                                                                                                        Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return from(eventStore, AggregateRootInstanceFactory.objenesisAggregateRootFactory(), aggregateImplementationType);
    }

    static <AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> AggregateRepository<AGGREGATE_TYPE> from(EventStore eventStore,
                                                                                                        AggregateRootInstanceFactory aggregateRootInstanceFactory,
                                                                                                        Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return new DefaultAggregateRepository<>(eventStore, aggregateRootInstanceFactory, aggregateImplementationType);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Load the current state of the aggregate
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate or {@link Optional#empty()} if no events exist or if the aggregate has been discarded
     */
    Optional<AGGREGATE_TYPE> tryLoad(UUID aggregateId);

    /**
     * Load the current state of the aggregate
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate
     * @throws AggregateNotFoundException if no events exist or if the aggregate has been discarded
     */
    AGGREGATE_TYPE load(UUID aggregateId);

    /**
     * Load the historic state of the aggregate as it was at <code>atVersion</code>.<br>
     * Discarded aggregates can be loaded, since their history is still available
     *
     * @param aggregateId the id of the aggregate
     * @param atVersion   the last version to replay. If the aggregate doesn't have that many events the latest version is returned
     * @return the aggregate
     * @throws AggregateNotFoundException if no events exist for the aggregate
     */
    AGGREGATE_TYPE load(UUID aggregateId, OriginatorVersion atVersion);

    /**
     * Append the {@link AggregateRoot#uncommittedChanges()} to the {@link EventStore} and mark them as committed.<br>
     * If the append fails, e.g. with an {@link OptimisticAppendToStreamException}, the uncommitted changes are kept and the exception is rethrown
     *
     * @param aggregate the aggregate to save
     * @return the notification ids assigned to the saved events (empty if there were no uncommitted changes)
     */
    List<NotificationId> save(AGGREGATE_TYPE aggregate);

    Class<AGGREGATE_TYPE> aggregateImplementationType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultAggregateRepository<AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> implements AggregateRepository<AGGREGATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

        private final EventStore                   eventStore;
        private final AggregateRootInstanceFactory aggregateRootInstanceFactory;
        private final Class<AGGREGATE_TYPE>        aggregateImplementationType;

        public DefaultAggregateRepository(EventStore eventStore,
                                          AggregateRootInstanceFactory aggregateRootInstanceFactory,
                                          Class<AGGREGATE_TYPE> aggregateImplementationType) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.aggregateRootInstanceFactory = requireNonNull(aggregateRootInstanceFactory, "You must supply an AggregateRootInstanceFactory instance");
            this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
        }

        @Override
        public Optional<AGGREGATE_TYPE> tryLoad(UUID aggregateId) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            log.trace("Trying to load {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
            var aggregate = rehydrate(aggregateId, LongRange.from(OriginatorVersion.FIRST_VERSION.longValue()));
            if (aggregate.isEmpty()) {
                log.trace("Didn't find a {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
                return Optional.empty();
            }
            if (aggregate.get().isDiscarded()) {
                log.debug("Found {} with id '{}' but it has been discarded at version {}",
                          aggregateImplementationType.getName(),
                          aggregateId,
                          aggregate.get().version());
                return Optional.empty();
            }
            log.debug("Loaded {} with id '{}' at version {}", aggregateImplementationType.getName(), aggregateId, aggregate.get().version());
            return aggregate;
        }

        @Override
        public AGGREGATE_TYPE load(UUID aggregateId) {
            return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateImplementationType));
        }

        @Override
        public AGGREGATE_TYPE load(UUID aggregateId, OriginatorVersion atVersion) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            requireNonNull(atVersion, "You must supply an atVersion");
            requireTrue(atVersion.longValue() >= OriginatorVersion.FIRST_VERSION.longValue(),
                        msg("atVersion must be at least {}, but was {}", OriginatorVersion.FIRST_VERSION, atVersion));
            var aggregate = rehydrate(aggregateId, LongRange.between(OriginatorVersion.FIRST_VERSION.longValue(), atVersion.longValue()))
                    .orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateImplementationType));
            log.debug("Loaded {} with id '{}' as of version {}", aggregateImplementationType.getName(), aggregateId, aggregate.version());
            return aggregate;
        }

        private Optional<AGGREGATE_TYPE> rehydrate(UUID aggregateId, LongRange versionRange) {
            return eventStore.fetchStream(aggregateId, versionRange)
                             .map(eventStream -> aggregateRootInstanceFactory.create(aggregateImplementationType)
                                                                             .rehydrate(eventStream));
        }

        @Override
        public List<NotificationId> save(AGGREGATE_TYPE aggregate) {
            requireNonNull(aggregate, "You must supply an aggregate");
            var eventsToPersist = aggregate.uncommittedChanges();
            if (eventsToPersist.isEmpty()) {
                log.trace("No changes detected for '{}' with id '{}'", aggregateImplementationType.getName(), aggregate.aggregateId());
                return List.of();
            }
            log.debug("Persisting {} event(s) related to '{}' with id '{}'",
                      eventsToPersist.size(),
                      aggregateImplementationType.getName(),
                      aggregate.aggregateId());
            var persistedEvents = eventStore.appendToStream(aggregate.aggregateId(),
                                                            aggregate.versionBeforeUncommittedChanges(),
                                                            eventsToPersist);
            aggregate.markChangesAsCommitted();
            return persistedEvents.stream()
                                  .map(PersistedEvent::notificationId)
                                  .collect(Collectors.toList());
        }

        @Override
        public Class<AGGREGATE_TYPE> aggregateImplementationType() {
            return aggregateImplementationType;
        }

        @Override
        public String toString() {
            return "AggregateRepository{" +
                    "aggregateImplementationType=" + aggregateImplementationType.getName() +
                    '}';
        }
    }
}
