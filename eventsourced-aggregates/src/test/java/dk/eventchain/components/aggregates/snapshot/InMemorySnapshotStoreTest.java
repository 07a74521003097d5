package dk.eventchain.components.aggregates.snapshot;

class InMemorySnapshotStoreTest extends AbstractSnapshotStoreTest {
    @Override
    protected SnapshotStore createSnapshotStore() {
        return new InMemorySnapshotStore();
    }
}
