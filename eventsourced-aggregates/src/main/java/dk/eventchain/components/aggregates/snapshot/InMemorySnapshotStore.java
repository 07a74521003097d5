package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.eventstore.types.OriginatorVersion;

import java.util.*;
import java.util.concurrent.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;

public class InMemorySnapshotStore implements SnapshotStore {
    private final ConcurrentMap<UUID, ConcurrentSkipListMap<Long, AggregateSnapshot>> snapshotsPerAggregate = new ConcurrentHashMap<>();

    @Override
    public void saveSnapshot(AggregateSnapshot snapshot) {
        requireNonNull(snapshot, "No snapshot provided");
        snapshotsPerAggregate.computeIfAbsent(snapshot.aggregateId(), aggregateId -> new ConcurrentSkipListMap<>())
                             .putIfAbsent(snapshot.aggregateVersion().longValue(), snapshot);
    }

    @Override
    public Optional<AggregateSnapshot> loadLatestSnapshot(UUID aggregateId, Class<?> aggregateType, OriginatorVersion atOrBeforeVersion) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(atOrBeforeVersion, "No atOrBeforeVersion provided");
        var snapshots = snapshotsPerAggregate.get(aggregateId);
        if (snapshots == null) {
            return Optional.empty();
        }
        return snapshots.headMap(atOrBeforeVersion.longValue(), true)
                        .descendingMap()
                        .values()
                        .stream()
                        .filter(snapshot -> snapshot.aggregateType().equals(aggregateType.getName()))
                        .findFirst();
    }

    @Override
    public void deleteSnapshots(UUID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        snapshotsPerAggregate.remove(aggregateId);
    }
}
