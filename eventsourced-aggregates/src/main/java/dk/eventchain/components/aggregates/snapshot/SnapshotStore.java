package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.eventstore.types.OriginatorVersion;

import java.util.*;

/**
 * Storage for {@link AggregateSnapshot}s. Snapshots are a cache: they can be deleted at any time, since the aggregate can always be rehydrated
 * from its events
 */
public interface SnapshotStore {
    /**
     * Save the snapshot. Saving a snapshot for an aggregate id and version that already has one keeps the existing snapshot
     */
    void saveSnapshot(AggregateSnapshot snapshot);

    /**
     * Load the snapshot with the highest version that is less than or equal to <code>atOrBeforeVersion</code>
     *
     * @param aggregateId       the id of the aggregate
     * @param aggregateType     the aggregate type (snapshots of other types are ignored)
     * @param atOrBeforeVersion the highest acceptable snapshot version
     * @return the snapshot or {@link Optional#empty()}
     */
    Optional<AggregateSnapshot> loadLatestSnapshot(UUID aggregateId, Class<?> aggregateType, OriginatorVersion atOrBeforeVersion);

    default Optional<AggregateSnapshot> loadLatestSnapshot(UUID aggregateId, Class<?> aggregateType) {
        return loadLatestSnapshot(aggregateId, aggregateType, OriginatorVersion.of(Long.MAX_VALUE));
    }

    /**
     * Delete all snapshots of the aggregate
     */
    void deleteSnapshots(UUID aggregateId);
}
