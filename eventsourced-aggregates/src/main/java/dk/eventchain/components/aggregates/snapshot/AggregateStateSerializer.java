package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.aggregates.AggregateRoot;

/**
 * Serializes the state of an {@link AggregateRoot} for an {@link AggregateSnapshot} and restores it into an empty aggregate instance
 */
public interface AggregateStateSerializer {
    byte[] serialize(AggregateRoot<?> aggregate);

    /**
     * Restore the serialized state into the empty <code>aggregate</code>
     *
     * @return the same aggregate instance
     */
    <AGGREGATE_TYPE extends AggregateRoot<AGGREGATE_TYPE>> AGGREGATE_TYPE deserializeInto(byte[] state, AGGREGATE_TYPE aggregate);
}
