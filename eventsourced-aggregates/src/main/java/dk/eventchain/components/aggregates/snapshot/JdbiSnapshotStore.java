package dk.eventchain.components.aggregates.snapshot;

import dk.eventchain.components.common.transaction.*;
import dk.eventchain.components.eventstore.types.*;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.regex.Pattern;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.NamedArgumentBinding.arg;
import static dk.eventchain.components.common.MessageFormatter.*;

/**
 * {@link SnapshotStore} that keeps snapshots in a SQL table using Jdbi. The table has the primary key (aggregate id, aggregate version).<br>
 * Every operation runs inside the caller's active {@link UnitOfWork} or, if there is none, inside its own {@link UnitOfWork}
 */
public class JdbiSnapshotStore implements SnapshotStore {
    public static final String DEFAULT_TABLE_NAME = "aggregate_snapshots";

    private static final Logger  log        = LoggerFactory.getLogger(JdbiSnapshotStore.class);
    private static final Pattern VALID_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final String                                                        tableName;

    public JdbiSnapshotStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, DEFAULT_TABLE_NAME);
    }

    /**
     * @param unitOfWorkFactory the unit of work factory
     * @param tableName         the snapshot table name. It's inlined into the SQL statements, so only simple lower case identifiers are accepted
     */
    public JdbiSnapshotStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory, String tableName) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        requireNonNull(tableName, "No tableName provided");
        requireTrue(VALID_NAME.matcher(tableName).matches(), msg("Invalid tableName '{}'. Must match {}", tableName, VALID_NAME.pattern()));
        this.tableName = tableName;
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> createSnapshotTable(unitOfWork.handle()));
    }

    private void createSnapshotTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "    aggregate_id uuid NOT NULL,\n" +
                                    "    aggregate_version bigint NOT NULL,\n" +
                                    "    aggregate_type varchar(512) NOT NULL,\n" +
                                    "    head varchar(64) NOT NULL,\n" +
                                    "    state bytea NOT NULL,\n" +
                                    "    taken_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "    PRIMARY KEY (aggregate_id, aggregate_version)\n" +
                                    ")",
                            arg("tableName", tableName)));
        log.debug("Ensured snapshot table '{}' exists", tableName);
    }

    @Override
    public void saveSnapshot(AggregateSnapshot snapshot) {
        requireNonNull(snapshot, "No snapshot provided");
        var sql = bind("INSERT INTO {:tableName} (aggregate_id, aggregate_version, aggregate_type, head, state, taken_at)\n" +
                               "   SELECT :aggregateId, :aggregateVersion, :aggregateType, :head, :state, :takenAt\n" +
                               "   WHERE NOT EXISTS (SELECT 1 FROM {:tableName} WHERE aggregate_id = :aggregateId AND aggregate_version = :aggregateVersion)",
                       arg("tableName", tableName));
        var inserted = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                               .createUpdate(sql)
                                                                               .bind("aggregateId", snapshot.aggregateId())
                                                                               .bind("aggregateVersion", snapshot.aggregateVersion().longValue())
                                                                               .bind("aggregateType", snapshot.aggregateType())
                                                                               .bind("head", snapshot.head().toString())
                                                                               .bind("state", snapshot.state())
                                                                               .bind("takenAt", snapshot.takenAt())
                                                                               .execute());
        log.trace("[{}] Saved snapshot of aggregate '{}' at version {}: {}",
                  tableName,
                  snapshot.aggregateId(),
                  snapshot.aggregateVersion(),
                  inserted == 1 ? "inserted" : "already existed");
    }

    @Override
    public Optional<AggregateSnapshot> loadLatestSnapshot(UUID aggregateId, Class<?> aggregateType, OriginatorVersion atOrBeforeVersion) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(atOrBeforeVersion, "No atOrBeforeVersion provided");
        var sql = bind("SELECT * FROM {:tableName} WHERE\n" +
                               "   aggregate_id = :aggregateId AND\n" +
                               "   aggregate_type = :aggregateType AND\n" +
                               "   aggregate_version <= :atOrBeforeVersion\n" +
                               "   ORDER BY aggregate_version DESC LIMIT 1",
                       arg("tableName", tableName));
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(sql)
                                                                        .bind("aggregateId", aggregateId)
                                                                        .bind("aggregateType", aggregateType.getName())
                                                                        .bind("atOrBeforeVersion", atOrBeforeVersion.longValue())
                                                                        .map((rs, ctx) -> new AggregateSnapshot(rs.getObject("aggregate_id", UUID.class),
                                                                                                                rs.getString("aggregate_type"),
                                                                                                                OriginatorVersion.of(rs.getLong("aggregate_version")),
                                                                                                                EventHash.of(rs.getString("head")),
                                                                                                                rs.getBytes("state"),
                                                                                                                rs.getObject("taken_at", OffsetDateTime.class)
                                                                                                                  .withOffsetSameInstant(ZoneOffset.UTC)))
                                                                        .findOne());
    }

    @Override
    public void deleteSnapshots(UUID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var deleted = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                              .createUpdate(bind("DELETE FROM {:tableName} WHERE aggregate_id = :aggregateId",
                                                                                                 arg("tableName", tableName)))
                                                                              .bind("aggregateId", aggregateId)
                                                                              .execute());
        log.debug("[{}] Deleted {} snapshot(s) of aggregate '{}'", tableName, deleted, aggregateId);
    }
}
