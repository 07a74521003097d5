package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.aggregates.Order;
import dk.eventchain.components.common.transaction.jdbi.JdbiUnitOfWorkFactory;
import dk.eventchain.components.eventstore.types.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class JdbiSnapshotStoreTest extends AbstractSnapshotStoreTest {
    private JdbiUnitOfWorkFactory unitOfWorkFactory;

    @Override
    protected SnapshotStore createSnapshotStore() {
        var jdbi = Jdbi.create("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(jdbi);
        return new JdbiSnapshotStore(unitOfWorkFactory, "order_snapshots");
    }

    @Test
    void verify_an_existing_table_is_reused() {
        // Given
        var orderId = UUID.randomUUID();
        snapshotStore.saveSnapshot(new AggregateSnapshot(orderId,
                                                         Order.class.getName(),
                                                         OriginatorVersion.of(4),
                                                         EventHash.of("f".repeat(64)),
                                                         new byte[]{1, 2, 3},
                                                         OffsetDateTime.now(ZoneOffset.UTC)));

        // When
        var otherStore = new JdbiSnapshotStore(unitOfWorkFactory, "order_snapshots");

        // Then
        var snapshot = otherStore.loadLatestSnapshot(orderId, Order.class).orElseThrow();
        assertThat(snapshot.aggregateVersion()).isEqualTo(OriginatorVersion.of(4));
        assertThat(snapshot.state()).containsExactly(1, 2, 3);
    }

    @Test
    void verify_the_table_name_is_validated() {
        assertThatThrownBy(() -> new JdbiSnapshotStore(unitOfWorkFactory, "order_snapshots; DROP TABLE order_events"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
