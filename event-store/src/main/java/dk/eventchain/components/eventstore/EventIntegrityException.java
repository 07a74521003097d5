package dk.eventchain.components.eventstore;

import dk.eventchain.components.eventstore.types.OriginatorVersion;

import java.util.*;

/**
 * Thrown when an event's hash doesn't match its content, when an event doesn't link to its predecessor
 * or when an encrypted payload cannot be authenticated.<br>
 * The {@link #originatorId()} and {@link #originatorVersion()} identify the event at which the chain broke, when known.
 */
public class EventIntegrityException extends EventStoreException {
    private final UUID              originatorId;
    private final OriginatorVersion originatorVersion;

    public EventIntegrityException(String message) {
        this(message, null, null, null);
    }

    public EventIntegrityException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public EventIntegrityException(String message, UUID originatorId, OriginatorVersion originatorVersion) {
        this(message, originatorId, originatorVersion, null);
    }

    public EventIntegrityException(String message, UUID originatorId, OriginatorVersion originatorVersion, Throwable cause) {
        super(message, cause);
        this.originatorId = originatorId;
        this.originatorVersion = originatorVersion;
    }

    public Optional<UUID> originatorId() {
        return Optional.ofNullable(originatorId);
    }

    public Optional<OriginatorVersion> originatorVersion() {
        return Optional.ofNullable(originatorVersion);
    }
}
