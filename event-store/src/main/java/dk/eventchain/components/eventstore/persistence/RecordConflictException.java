package dk.eventchain.components.eventstore.persistence;

import dk.eventchain.components.eventstore.EventStoreException;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Thrown by a {@link RecordBackend} when inserting records would violate the uniqueness of
 * originator id and version or of the notification id
 */
public class RecordConflictException extends EventStoreException {
    /**
     * The unique key that was violated
     */
    public enum Conflict {
        /**
         * Another record for the same aggregate and version exists, i.e. a concurrent writer appended to the same aggregate
         */
        ORIGINATOR_VERSION,
        /**
         * The assigned notification id was already taken. Indicates that notification ids weren't assigned under a lock
         */
        NOTIFICATION_ID
    }

    private final Conflict conflict;

    public RecordConflictException(String message, Conflict conflict) {
        super(message);
        this.conflict = requireNonNull(conflict, "No conflict provided");
    }

    public RecordConflictException(String message, Conflict conflict, Throwable cause) {
        super(message, cause);
        this.conflict = requireNonNull(conflict, "No conflict provided");
    }

    public Conflict conflict() {
        return conflict;
    }
}
