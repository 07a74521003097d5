package dk.eventchain.components.aggregates;

import dk.eventchain.components.eventstore.*;
import dk.eventchain.components.eventstore.eventstream.*;
import dk.eventchain.components.eventstore.hashchain.HashChain;
import dk.eventchain.components.eventstore.types.*;

import java.time.*;
import java.util.*;
import java.util.stream.Stream;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * A specialized and opinionated mutable {@link Aggregate} design<br>
 * Commands on the concrete aggregate call {@link #trigger(Object)} with an event payload. The {@link AggregateRoot} seals the payload into a
 * {@link DomainEvent} with the next {@link OriginatorVersion} that links to the hash of the previous event, applies it and keeps it as an
 * uncommitted change until the {@link AggregateRepository} has persisted it.<br>
 * State changes are performed in (private) methods annotated with {@link EventHandler}, which take the payload type as their single argument.
 * These methods are called both when an event is triggered and when the aggregate is rehydrated from its history, which guarantees that
 * replaying the history results in the same state.
 * <p>
 * Example:
 * <pre>{@code
 * public class Order extends AggregateRoot<Order> {
 *     private boolean accepted;
 *
 *     public Order(UUID orderId, String customerName) {
 *         super(orderId);
 *         trigger(new OrderPlaced(customerName));
 *     }
 *
 *     public void accept() {
 *         if (!accepted) {
 *             trigger(new OrderAccepted());
 *         }
 *     }
 *
 *     @EventHandler
 *     private void on(OrderAccepted e) {
 *         accepted = true;
 *     }
 * }
 * }</pre>
 * Aggregates that are loaded by the {@link AggregateRepository} are created using an {@link AggregateRootInstanceFactory}, which either calls the
 * default constructor or uses Objenesis (in which case no constructor is called and no fields are initialized).
 *
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class AggregateRoot<AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> implements Aggregate<AGGREGATE_TYPE> {
    // Transient fields aren't part of a snapshot of the aggregate state
    private transient EventHandlerInvoker invoker;
    private transient UUID                aggregateId;
    private transient OriginatorVersion   version;
    private transient EventHash           head;
    private transient List<DomainEvent>   uncommittedChanges;
    private transient boolean             discarded;
    private transient boolean             hasBeenRehydrated;
    private transient boolean             isRehydrating;

    /**
     * Used when the aggregate is created prior to being rehydrated
     */
    protected AggregateRoot() {
        initialize();
    }

    /**
     * Used when a new aggregate is created by a command
     *
     * @param aggregateId the id of the new aggregate
     */
    protected AggregateRoot(UUID aggregateId) {
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        initialize();
    }

    /**
     * Initialize the aggregate, e.g. resolving its {@link EventHandler} methods
     */
    protected void initialize() {
        invoker = new EventHandlerInvoker(this);
    }

    /**
     * The {@link HashChain} used to seal new events. Must use the same serializer as the event store the aggregate is persisted in
     */
    protected HashChain hashChain() {
        return HashChain.defaultHashChain();
    }

    /**
     * The timestamp of new events
     */
    protected OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }

    @Override
    public AGGREGATE_TYPE rehydrate(AggregateEventStream persistedEvents) {
        requireNonNull(persistedEvents, "You must provide a persistedEvents stream");
        return rehydrate(persistedEvents.events());
    }

    /**
     * Effectively performs a leftFold over the previous events related to this aggregate instance in ascending version order
     *
     * @param previousEvents the previous events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    @SuppressWarnings("unchecked")
    public AGGREGATE_TYPE rehydrate(Stream<DomainEvent> previousEvents) {
        requireNonNull(previousEvents, "You must provide a previousEvents stream");
        isRehydrating = true;
        try {
            previousEvents.forEach(this::applyEvent);
        } finally {
            isRehydrating = false;
        }
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Position an aggregate, whose state was restored from a snapshot, at the version and head the snapshot was taken at.
     * Events after the snapshot are applied afterwards using {@link #rehydrate(Stream)}
     *
     * @param aggregateId the id of the aggregate
     * @param version     the version the snapshot was taken at
     * @param head        the hash of the event with that version
     * @return the same aggregate instance (self)
     */
    @SuppressWarnings("unchecked")
    public AGGREGATE_TYPE restoreSnapshotPosition(UUID aggregateId, OriginatorVersion version, EventHash head) {
        requireNonNull(aggregateId, "You must supply an aggregateId");
        requireNonNull(version, "You must supply a version");
        requireNonNull(head, "You must supply a head");
        requireTrue(version().equals(OriginatorVersion.NO_EVENTS_PERSISTED) && _uncommittedChanges().isEmpty(),
                    msg("Aggregate '{}' with aggregateId '{}' has already applied events up to version {}",
                        getClass().getName(),
                        this.aggregateId,
                        version()));
        requireTrue(version.longValue() >= OriginatorVersion.FIRST_VERSION.longValue(),
                    msg("A snapshot version must be at least {}, but was {}", OriginatorVersion.FIRST_VERSION, version));
        if (invoker == null) {
            initialize();
        }
        this.aggregateId = aggregateId;
        this.version = version;
        this.head = head;
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Seal the payload into a new {@link DomainEvent}, apply it to this aggregate and register it as an uncommitted change
     *
     * @param payload the event payload
     * @return the new event
     * @throws AggregateDiscardedException if the aggregate has been discarded
     * @throws UnknownEventTypeException   if the aggregate doesn't have an {@link EventHandler} for the payload
     */
    protected DomainEvent trigger(Object payload) {
        requireNonNull(payload, "You must supply an event payload");
        if (isDiscarded()) {
            throw new AggregateDiscardedException(aggregateId, getClass());
        }
        var event = hashChain().seal(aggregateId(),
                                     version().increment(),
                                     payload,
                                     now(),
                                     head());
        applyEvent(event);
        _uncommittedChanges().add(event);
        return event;
    }

    /**
     * Discard the aggregate by triggering the terminal {@link AggregateDiscarded} event
     *
     * @return the discard event
     */
    public DomainEvent discard() {
        return trigger(new AggregateDiscarded());
    }

    private void applyEvent(DomainEvent event) {
        requireNonNull(event, "You must supply an event");
        if (aggregateId == null) {
            // The FIRST historic event tells the aggregate its id
            aggregateId = event.originatorId();
        }
        if (isDiscarded()) {
            throw new AggregateDiscardedException(aggregateId, getClass());
        }
        requireTrue(aggregateId.equals(event.originatorId()),
                    msg("Aggregate Id's do not match! Cannot apply event with version {} belonging to aggregate '{}' to Aggregate '{}' with aggregateId '{}'",
                        event.originatorVersion(),
                        event.originatorId(),
                        getClass().getName(),
                        aggregateId));
        var expectedVersion = version().increment();
        if (!expectedVersion.equals(event.originatorVersion())) {
            throw new EventIntegrityException(msg("Cannot apply event with version {} to Aggregate '{}' with aggregateId '{}'. Expected version {}",
                                                  event.originatorVersion(),
                                                  getClass().getName(),
                                                  aggregateId,
                                                  expectedVersion),
                                              aggregateId,
                                              event.originatorVersion());
        }
        if (!head().equals(event.previousHash())) {
            throw new EventIntegrityException(msg("Cannot apply event with version {} to Aggregate '{}' with aggregateId '{}'. The event links to '{}' but the aggregate head is '{}'",
                                                  event.originatorVersion(),
                                                  getClass().getName(),
                                                  aggregateId,
                                                  event.previousHash(),
                                                  head()),
                                              aggregateId,
                                              event.originatorVersion());
        }
        applyEventToTheAggregate(event);
        version = event.originatorVersion();
        head = event.eventHash();
    }

    /**
     * Apply the event to the aggregate instance to reflect the event as a state change to the aggregate<br/>
     * The default implementation will automatically call any (private) methods annotated with
     * {@link EventHandler} that accept the payload type. {@link AggregateDiscarded} is handled by the {@link AggregateRoot}
     * and doesn't require an {@link EventHandler}
     *
     * @param event the event to apply to the aggregate
     * @see #isRehydrating()
     */
    protected void applyEventToTheAggregate(DomainEvent event) {
        if (invoker == null) {
            // Instance was created by Objenesis
            initialize();
        }
        var payload = event.payload();
        if (payload instanceof AggregateDiscarded) {
            discarded = true;
            invoker.invoke(payload, unmatchedPayload -> {
                // Handling the discard event is optional
            });
            return;
        }
        invoker.invoke(payload, unmatchedPayload -> {
            throw new UnknownEventTypeException(msg("Aggregate '{}' has no @EventHandler for event type '{}' (aggregateId '{}', version {})",
                                                    getClass().getName(),
                                                    event.eventType(),
                                                    aggregateId,
                                                    event.originatorVersion()),
                                                event.eventType());
        });
    }

    @Override
    public UUID aggregateId() {
        requireNonNull(aggregateId, "The aggregate id has not been set on the AggregateRoot. Use the AggregateRoot(UUID) constructor or rehydrate the aggregate");
        return aggregateId;
    }

    @Override
    public OriginatorVersion version() {
        if (version == null) {
            // Objenesis doesn't initialize fields
            version = OriginatorVersion.NO_EVENTS_PERSISTED;
        }
        return version;
    }

    @Override
    public EventHash head() {
        if (head == null) {
            head = EventHash.GENESIS;
        }
        return head;
    }

    @Override
    public boolean isDiscarded() {
        return discarded;
    }

    @Override
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    /**
     * Is the event being supplied to {@link #applyEventToTheAggregate(DomainEvent)} a historic event
     */
    protected final boolean isRehydrating() {
        return isRehydrating;
    }

    @Override
    public List<DomainEvent> uncommittedChanges() {
        return Collections.unmodifiableList(_uncommittedChanges());
    }

    @Override
    public OriginatorVersion versionBeforeUncommittedChanges() {
        return OriginatorVersion.of(version().longValue() - _uncommittedChanges().size());
    }

    @Override
    public void markChangesAsCommitted() {
        uncommittedChanges = new ArrayList<>();
    }

    /**
     * Since the aggregate instance MAY have been created using Objenesis (which doesn't
     * initialize fields nor call a constructor) the list is initialized lazily
     */
    private List<DomainEvent> _uncommittedChanges() {
        if (uncommittedChanges == null) {
            uncommittedChanges = new ArrayList<>();
        }
        return uncommittedChanges;
    }
}
