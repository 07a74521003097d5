package dk.eventchain.components.eventstore.persistence.jdbi;

import java.util.Objects;
import java.util.regex.Pattern;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Configuration of the table that the {@link JdbiRecordBackend} stores records in.<br>
 * <b>Note: The table and column names are converted to <u>lower case</u></b>
 */
public final class RecordTableConfiguration {
    public static final  String  DEFAULT_TABLE_NAME = "stored_events";
    private static final Pattern VALID_NAME         = Pattern.compile("[a-z_][a-z0-9_]{0,39}");

    /**
     * The name of the table where all records are stored
     */
    public final String  tableName;
    public final String  originatorIdColumn;
    public final String  originatorVersionColumn;
    public final String  notificationIdColumn;
    public final String  eventTypeColumn;
    public final String  stateColumn;
    public final String  eventHashColumn;
    public final String  previousHashColumn;
    public final String  timestampColumn;
    /**
     * The SQL type of the {@link #stateColumn}, e.g. <code>bytea</code>
     */
    public final String  stateColumnType;
    public final int     queryFetchSize;

    public RecordTableConfiguration(String tableName,
                                    String originatorIdColumn,
                                    String originatorVersionColumn,
                                    String notificationIdColumn,
                                    String eventTypeColumn,
                                    String stateColumn,
                                    String eventHashColumn,
                                    String previousHashColumn,
                                    String timestampColumn,
                                    String stateColumnType,
                                    int queryFetchSize) {
        this.tableName = validName("tableName", tableName);
        this.originatorIdColumn = validName("originatorIdColumn", originatorIdColumn);
        this.originatorVersionColumn = validName("originatorVersionColumn", originatorVersionColumn);
        this.notificationIdColumn = validName("notificationIdColumn", notificationIdColumn);
        this.eventTypeColumn = validName("eventTypeColumn", eventTypeColumn);
        this.stateColumn = validName("stateColumn", stateColumn);
        this.eventHashColumn = validName("eventHashColumn", eventHashColumn);
        this.previousHashColumn = validName("previousHashColumn", previousHashColumn);
        this.timestampColumn = validName("timestampColumn", timestampColumn);
        this.stateColumnType = requireNonNull(stateColumnType, "No stateColumnType provided");
        this.queryFetchSize = queryFetchSize;
    }

    /**
     * Default configuration using table {@value #DEFAULT_TABLE_NAME}
     */
    public static RecordTableConfiguration standardConfiguration() {
        return standardConfiguration(DEFAULT_TABLE_NAME);
    }

    public static RecordTableConfiguration standardConfiguration(String tableName) {
        return new RecordTableConfiguration(tableName,
                                            "originator_id",
                                            "originator_version",
                                            "notification_id",
                                            "event_type",
                                            "state",
                                            "event_hash",
                                            "previous_hash",
                                            "event_timestamp",
                                            "bytea",
                                            100);
    }

    /**
     * Table and column names are inlined into the SQL statements, so only simple lower case identifiers are accepted
     */
    private static String validName(String description, String name) {
        requireNonNull(name, msg("No {} provided", description));
        var lowerCaseName = name.toLowerCase();
        requireTrue(VALID_NAME.matcher(lowerCaseName).matches(),
                    msg("Invalid {} '{}'. Must match {}", description, name, VALID_NAME.pattern()));
        return lowerCaseName;
    }

    public String originatorVersionConstraintName() {
        return tableName + "_originator_version_key";
    }

    public String notificationIdConstraintName() {
        return tableName + "_notification_id_key";
    }

    /**
     * The single row table that holds the last assigned notification id
     */
    public String notificationCounterTableName() {
        return tableName + "_notification_counter";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordTableConfiguration)) return false;
        RecordTableConfiguration that = (RecordTableConfiguration) o;
        return tableName.equals(that.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName);
    }

    @Override
    public String toString() {
        return "RecordTableConfiguration{" +
                "tableName='" + tableName + '\'' +
                ", queryFetchSize=" + queryFetchSize +
                '}';
    }
}
