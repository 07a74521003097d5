package dk.eventchain.components.eventstore.persistence.jdbi;

import dk.eventchain.components.common.transaction.*;
import dk.eventchain.components.eventstore.persistence.*;
import dk.eventchain.components.eventstore.types.NotificationId;
import dk.eventchain.components.common.types.LongRange;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.Query;
import org.slf4j.*;

import java.sql.SQLException;
import java.util.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.NamedArgumentBinding.arg;
import static dk.eventchain.components.common.MessageFormatter.*;

/**
 * {@link RecordBackend} that stores all records in a single SQL table using Jdbi.<br>
 * Every operation runs inside the caller's active {@link UnitOfWork} or, if there is none, inside its own {@link UnitOfWork}.<br>
 * The table has a unique constraint on originator id and version and a unique constraint on the notification id.<br>
 * Notification ids are reserved from a single row counter table ({@link RecordTableConfiguration#notificationCounterTableName()}),
 * which is updated first thing in the inserting transaction. The row lock taken by the update serializes concurrent writers until
 * they commit or roll back, so notification ids are assigned in commit order without gaps.
 */
public class JdbiRecordBackend implements RecordBackend {
    private static final Logger log                    = LoggerFactory.getLogger(JdbiRecordBackend.class);
    private static final String UNIQUE_VIOLATION_STATE = "23505";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final RecordTableConfiguration                                      config;
    private final String                                                        insertSql;

    public JdbiRecordBackend(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                             RecordTableConfiguration config) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.config = requireNonNull(config, "No configuration provided");
        this.insertSql = createInsertSql();
        initializeStorage();
    }

    public RecordTableConfiguration getConfiguration() {
        return config;
    }

    private void initializeStorage() {
        log.info("Initializing record storage in table '{}'", config.tableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> createRecordTable(unitOfWork.handle()));
    }

    /**
     * Drop the record table and create it again. All stored records are lost
     */
    public void resetStorage() {
        log.info("Resetting record storage in table '{}'", config.tableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute("DROP TABLE IF EXISTS " + config.tableName);
            unitOfWork.handle().execute("DROP TABLE IF EXISTS " + config.notificationCounterTableName());
            log.debug("Dropped tables '{}' and '{}'", config.tableName, config.notificationCounterTableName());
        });
        initializeStorage();
    }

    private void createRecordTable(Handle handle) {
        var sql = bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                               "    {:originatorIdColumn} uuid NOT NULL,\n" +
                               "    {:originatorVersionColumn} bigint NOT NULL,\n" +
                               "    {:notificationIdColumn} bigint NOT NULL,\n" +
                               "    {:eventTypeColumn} varchar(512) NOT NULL,\n" +
                               "    {:stateColumn} {:stateColumnType} NOT NULL,\n" +
                               "    {:eventHashColumn} varchar(64) NOT NULL,\n" +
                               "    {:previousHashColumn} varchar(64) NOT NULL,\n" +
                               "    {:timestampColumn} TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                               "    CONSTRAINT {:originatorVersionConstraint} UNIQUE ({:originatorIdColumn}, {:originatorVersionColumn}),\n" +
                               "    CONSTRAINT {:notificationIdConstraint} UNIQUE ({:notificationIdColumn})\n" +
                               ")",
                       arg("tableName", config.tableName),
                       arg("originatorIdColumn", config.originatorIdColumn),
                       arg("originatorVersionColumn", config.originatorVersionColumn),
                       arg("notificationIdColumn", config.notificationIdColumn),
                       arg("eventTypeColumn", config.eventTypeColumn),
                       arg("stateColumn", config.stateColumn),
                       arg("stateColumnType", config.stateColumnType),
                       arg("eventHashColumn", config.eventHashColumn),
                       arg("previousHashColumn", config.previousHashColumn),
                       arg("timestampColumn", config.timestampColumn),
                       arg("originatorVersionConstraint", config.originatorVersionConstraintName()),
                       arg("notificationIdConstraint", config.notificationIdConstraintName()));
        handle.execute(sql);
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:counterTableName} (\n" +
                                    "    id smallint NOT NULL PRIMARY KEY,\n" +
                                    "    last_notification_id bigint NOT NULL\n" +
                                    ")",
                            arg("counterTableName", config.notificationCounterTableName())));
        var seeded = handle.execute(bind("INSERT INTO {:counterTableName} (id, last_notification_id)\n" +
                                                 "   SELECT 1, existing.max_notification_id\n" +
                                                 "   FROM (SELECT COALESCE(MAX({:notificationIdColumn}), 0) AS max_notification_id FROM {:tableName}) existing\n" +
                                                 "   WHERE NOT EXISTS (SELECT 1 FROM {:counterTableName} WHERE id = 1)",
                                         arg("counterTableName", config.notificationCounterTableName()),
                                         arg("notificationIdColumn", config.notificationIdColumn),
                                         arg("tableName", config.tableName)));
        log.debug("Ensured record table '{}' and notification counter table '{}' exist (counter seeded: {})",
                  config.tableName,
                  config.notificationCounterTableName(),
                  seeded == 1);
    }

    @Override
    public List<StoredRecord> insert(List<StoredRecord> records) {
        requireNonNull(records, "No records provided");
        if (records.isEmpty()) {
            return List.of();
        }
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            try {
                var nextNotificationId = reserveNotificationIds(handle, records.size());
                var batch              = handle.prepareBatch(insertSql);
                var inserted           = new ArrayList<StoredRecord>(records.size());
                for (var record : records) {
                    var assigned = record.withNotificationId(NotificationId.of(nextNotificationId++));
                    batch.bind("originatorId", assigned.originatorId())
                         .bind("originatorVersion", assigned.originatorVersion().longValue())
                         .bind("notificationId", assigned.notificationId().orElseThrow().longValue())
                         .bind("eventType", assigned.eventType().toString())
                         .bind("state", assigned.state())
                         .bind("eventHash", assigned.eventHash().toString())
                         .bind("previousHash", assigned.previousHash().toString())
                         .bind("timestamp", assigned.timestamp())
                         .add();
                    inserted.add(assigned);
                }
                batch.execute();
                log.trace("[{}] Inserted {} record(s) with notification ids {} to {}",
                          config.tableName,
                          inserted.size(),
                          inserted.get(0).notificationId().orElseThrow(),
                          inserted.get(inserted.size() - 1).notificationId().orElseThrow());
                return inserted;
            } catch (RuntimeException e) {
                var violation = uniqueConstraintViolation(e);
                if (violation.isPresent()) {
                    var details  = violation.get().getMessage() != null ? violation.get().getMessage().toLowerCase() : "";
                    var conflict = details.contains(config.notificationIdConstraintName()) ?
                                   RecordConflictException.Conflict.NOTIFICATION_ID :
                                   RecordConflictException.Conflict.ORIGINATOR_VERSION;
                    throw new RecordConflictException(msg("[{}] Failed to insert {} record(s) for aggregate '{}' due to a {} conflict",
                                                          config.tableName,
                                                          records.size(),
                                                          records.get(0).originatorId(),
                                                          conflict),
                                                      conflict,
                                                      e);
                }
                throw e;
            }
        });
    }

    @Override
    public List<StoredRecord> selectRecords(UUID originatorId, LongRange versionRange) {
        requireNonNull(originatorId, "No originatorId provided");
        requireNonNull(versionRange, "No versionRange provided");
        var sql = "SELECT * FROM {:tableName} WHERE\n" +
                "   {:originatorIdColumn} = :originatorId AND\n";
        if (versionRange.isClosedRange()) {
            sql += "   {:originatorVersionColumn} BETWEEN :versionFrom AND :versionTo";
        } else {
            sql += "   {:originatorVersionColumn} >= :versionFrom";
        }
        sql += "\n   ORDER BY {:originatorVersionColumn} ASC";
        var boundSql = bind(sql,
                            arg("tableName", config.tableName),
                            arg("originatorIdColumn", config.originatorIdColumn),
                            arg("originatorVersionColumn", config.originatorVersionColumn));
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var query = unitOfWork.handle()
                                  .createQuery(boundSql)
                                  .bind("originatorId", originatorId)
                                  .bind("versionFrom", versionRange.fromInclusive);
            if (versionRange.isClosedRange()) {
                query.bind("versionTo", versionRange.toInclusive);
            }
            return mapRecords(query);
        });
    }

    @Override
    public Optional<StoredRecord> selectLastRecord(UUID originatorId) {
        requireNonNull(originatorId, "No originatorId provided");
        var sql = bind("SELECT * FROM {:tableName} WHERE\n" +
                               "   {:originatorIdColumn} = :originatorId\n" +
                               "   ORDER BY {:originatorVersionColumn} DESC LIMIT 1",
                       arg("tableName", config.tableName),
                       arg("originatorIdColumn", config.originatorIdColumn),
                       arg("originatorVersionColumn", config.originatorVersionColumn));
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(sql)
                                                                        .bind("originatorId", originatorId)
                                                                        .setFetchSize(1)
                                                                        .map(new StoredRecordRowMapper(config))
                                                                        .findOne());
    }

    @Override
    public List<StoredRecord> selectNotifications(LongRange notificationIdRange) {
        requireNonNull(notificationIdRange, "No notificationIdRange provided");
        var sql = "SELECT * FROM {:tableName} WHERE\n";
        if (notificationIdRange.isClosedRange()) {
            sql += "   {:notificationIdColumn} BETWEEN :notificationIdFrom AND :notificationIdTo";
        } else {
            sql += "   {:notificationIdColumn} >= :notificationIdFrom";
        }
        sql += "\n   ORDER BY {:notificationIdColumn} ASC";
        var boundSql = bind(sql,
                            arg("tableName", config.tableName),
                            arg("notificationIdColumn", config.notificationIdColumn));
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var query = unitOfWork.handle()
                                  .createQuery(boundSql)
                                  .bind("notificationIdFrom", notificationIdRange.fromInclusive);
            if (notificationIdRange.isClosedRange()) {
                query.bind("notificationIdTo", notificationIdRange.toInclusive);
            }
            return mapRecords(query);
        });
    }

    @Override
    public long maxNotificationId() {
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> selectMaxNotificationId(unitOfWork.handle()));
    }

    /**
     * Reserve <code>count</code> notification ids by advancing the counter row. The row stays locked until the transaction ends
     *
     * @return the first reserved notification id
     */
    private long reserveNotificationIds(Handle handle, int count) {
        var updated = handle.createUpdate(bind("UPDATE {:counterTableName} SET last_notification_id = last_notification_id + :count WHERE id = 1",
                                               arg("counterTableName", config.notificationCounterTableName())))
                            .bind("count", count)
                            .execute();
        if (updated != 1) {
            throw new IllegalStateException(msg("[{}] The notification counter table '{}' doesn't contain the counter row",
                                                config.tableName,
                                                config.notificationCounterTableName()));
        }
        var lastReserved = handle.createQuery(bind("SELECT last_notification_id FROM {:counterTableName} WHERE id = 1",
                                                   arg("counterTableName", config.notificationCounterTableName())))
                                 .mapTo(Long.class)
                                 .one();
        return lastReserved - count + 1;
    }

    private long selectMaxNotificationId(Handle handle) {
        return handle.createQuery(bind("SELECT COALESCE(MAX({:notificationIdColumn}), 0) FROM {:tableName}",
                                       arg("tableName", config.tableName),
                                       arg("notificationIdColumn", config.notificationIdColumn)))
                     .mapTo(Long.class)
                     .one();
    }

    private List<StoredRecord> mapRecords(Query query) {
        return query.setFetchSize(config.queryFetchSize)
                    .map(new StoredRecordRowMapper(config))
                    .list();
    }

    private String createInsertSql() {
        return bind("INSERT INTO {:tableName} (\n" +
                            "        {:originatorIdColumn},\n" +
                            "        {:originatorVersionColumn},\n" +
                            "        {:notificationIdColumn},\n" +
                            "        {:eventTypeColumn},\n" +
                            "        {:stateColumn},\n" +
                            "        {:eventHashColumn},\n" +
                            "        {:previousHashColumn},\n" +
                            "        {:timestampColumn}\n" +
                            "     ) VALUES (\n" +
                            "        :originatorId,\n" +
                            "        :originatorVersion,\n" +
                            "        :notificationId,\n" +
                            "        :eventType,\n" +
                            "        :state,\n" +
                            "        :eventHash,\n" +
                            "        :previousHash,\n" +
                            "        :timestamp\n" +
                            "     )",
                    arg("tableName", config.tableName),
                    arg("originatorIdColumn", config.originatorIdColumn),
                    arg("originatorVersionColumn", config.originatorVersionColumn),
                    arg("notificationIdColumn", config.notificationIdColumn),
                    arg("eventTypeColumn", config.eventTypeColumn),
                    arg("stateColumn", config.stateColumn),
                    arg("eventHashColumn", config.eventHashColumn),
                    arg("previousHashColumn", config.previousHashColumn),
                    arg("timestampColumn", config.timestampColumn));
    }

    private static Optional<SQLException> uniqueConstraintViolation(Throwable e) {
        var current = e;
        while (current != null) {
            if (current instanceof SQLException && UNIQUE_VIOLATION_STATE.equals(((SQLException) current).getSQLState())) {
                return Optional.of((SQLException) current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }
}
