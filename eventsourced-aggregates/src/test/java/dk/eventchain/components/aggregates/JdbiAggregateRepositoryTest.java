package dk.eventchain.components.aggregates;

import dk.eventchain.components.common.transaction.jdbi.JdbiUnitOfWorkFactory;
import dk.eventchain.components.eventstore.EventIntegrityException;
import dk.eventchain.components.eventstore.persistence.RecordBackend;
import dk.eventchain.components.eventstore.persistence.jdbi.*;
import dk.eventchain.components.eventstore.types.OriginatorVersion;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class JdbiAggregateRepositoryTest extends AbstractAggregateRepositoryTest {
    private Jdbi jdbi;

    @Override
    protected RecordBackend createRecordBackend() {
        jdbi = Jdbi.create("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        return new JdbiRecordBackend(new JdbiUnitOfWorkFactory(jdbi),
                                     RecordTableConfiguration.standardConfiguration("order_events"));
    }

    @Test
    void verify_loading_a_tampered_aggregate_fails() {
        // Given
        var orderId = UUID.randomUUID();
        var order   = new Order(orderId, "Alice", 123);
        order.addProduct("p-1", 2);
        repository.save(order);

        // When the quantity is changed directly in the table
        var storedState = jdbi.withHandle(handle -> handle.createQuery("SELECT state FROM order_events WHERE originator_id = :orderId AND originator_version = 2")
                                                          .bind("orderId", orderId)
                                                          .mapTo(byte[].class)
                                                          .one());
        var tamperedState = new String(storedState, StandardCharsets.UTF_8).replace("2", "200").getBytes(StandardCharsets.UTF_8);
        jdbi.useHandle(handle -> handle.createUpdate("UPDATE order_events SET state = :state WHERE originator_id = :orderId AND originator_version = 2")
                                       .bind("state", tamperedState)
                                       .bind("orderId", orderId)
                                       .execute());

        // Then
        assertThatThrownBy(() -> repository.load(orderId))
                .isExactlyInstanceOf(EventIntegrityException.class);
        assertThat(repository.load(orderId, OriginatorVersion.FIRST_VERSION).customerName())
                .isEqualTo("Alice");
    }
}
