package dk.eventchain.components.eventstore.persistence.jdbi;

import dk.eventchain.components.eventstore.persistence.StoredRecord;
import dk.eventchain.components.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.*;
import java.util.UUID;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

class StoredRecordRowMapper implements RowMapper<StoredRecord> {
    private final RecordTableConfiguration config;

    StoredRecordRowMapper(RecordTableConfiguration config) {
        this.config = requireNonNull(config, "No configuration provided");
    }

    @Override
    public StoredRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventType = rs.getString(config.eventTypeColumn);
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalStateException(msg("[{}] Row: {} - Column '{}' was empty or blank",
                                                config.tableName,
                                                rs.getRow(),
                                                config.eventTypeColumn));
        }
        return new StoredRecord(rs.getObject(config.originatorIdColumn, UUID.class),
                                OriginatorVersion.of(rs.getLong(config.originatorVersionColumn)),
                                EventType.of(eventType),
                                rs.getBytes(config.stateColumn),
                                EventHash.of(rs.getString(config.eventHashColumn)),
                                EventHash.of(rs.getString(config.previousHashColumn)),
                                rs.getObject(config.timestampColumn, OffsetDateTime.class).withOffsetSameInstant(ZoneOffset.UTC),
                                NotificationId.of(rs.getLong(config.notificationIdColumn)));
    }
}
