package dk.eventchain.components.eventstore.persistence;

import dk.eventchain.components.eventstore.cipher.Cipher;
import dk.eventchain.components.eventstore.compressor.Compressor;
import dk.eventchain.components.eventstore.eventstream.*;
import dk.eventchain.components.eventstore.serializer.EventSerializer;

import java.util.Optional;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Maps between {@link DomainEvent}s and {@link StoredRecord}s.<br>
 * Only the payload is transformed: it's serialized using the {@link EventSerializer}, then compressed if a {@link Compressor} is configured
 * and finally encrypted if a {@link Cipher} is configured. Reading reverses the steps.
 * All other fields are stored in clear text
 */
public class StoredRecordMapper {
    private final EventSerializer      eventSerializer;
    private final Optional<Compressor> compressor;
    private final Optional<Cipher>     cipher;

    public StoredRecordMapper(EventSerializer eventSerializer, Optional<Cipher> cipher) {
        this(eventSerializer, Optional.empty(), cipher);
    }

    public StoredRecordMapper(EventSerializer eventSerializer, Optional<Compressor> compressor, Optional<Cipher> cipher) {
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        this.compressor = requireNonNull(compressor, "No compressor option provided");
        this.cipher = requireNonNull(cipher, "No cipher option provided");
    }

    /**
     * Map the event to a record that hasn't been assigned a notification id
     */
    public StoredRecord toRecord(DomainEvent event) {
        requireNonNull(event, "No event provided");
        return toRecord(event, eventSerializer.serialize(event.payload()));
    }

    /**
     * Map the event to a record that hasn't been assigned a notification id, using the already serialized payload
     */
    public StoredRecord toRecord(DomainEvent event, byte[] plainState) {
        requireNonNull(event, "No event provided");
        requireNonNull(plainState, "No plainState provided");
        var compressedState = compressor.map(c -> c.compress(plainState)).orElse(plainState);
        return StoredRecord.unassigned(event.originatorId(),
                                       event.originatorVersion(),
                                       event.eventType(),
                                       cipher.map(c -> c.encrypt(compressedState)).orElse(compressedState),
                                       event.eventHash(),
                                       event.previousHash(),
                                       event.timestamp());
    }

    /**
     * Decrypt (if a {@link Cipher} is configured) and decompress (if a {@link Compressor} is configured) the state of the record
     *
     * @return the serialized payload in plain text
     * @throws dk.eventchain.components.eventstore.EventIntegrityException in case the state can't be decrypted or decompressed
     */
    public byte[] plainState(StoredRecord record) {
        requireNonNull(record, "No record provided");
        var state          = record.state();
        var decryptedState = cipher.map(c -> c.decrypt(state)).orElse(state);
        return compressor.map(c -> c.decompress(decryptedState)).orElse(decryptedState);
    }

    /**
     * Map the record back to a {@link DomainEvent} using already decrypted state
     *
     * @param record     the record
     * @param plainState the result of {@link #plainState(StoredRecord)}
     * @return the event
     */
    public DomainEvent toDomainEvent(StoredRecord record, byte[] plainState) {
        requireNonNull(record, "No record provided");
        requireNonNull(plainState, "No plainState provided");
        return DomainEvent.from(record.originatorId(),
                                record.originatorVersion(),
                                record.eventType(),
                                eventSerializer.deserialize(plainState, record.eventType()),
                                record.timestamp(),
                                record.previousHash(),
                                record.eventHash());
    }

    public DomainEvent toDomainEvent(StoredRecord record) {
        return toDomainEvent(record, plainState(record));
    }

    public PersistedEvent toPersistedEvent(StoredRecord record) {
        return PersistedEvent.from(toDomainEvent(record),
                                   record.notificationId().orElseThrow(() -> new IllegalStateException("The record hasn't been assigned a notification id")));
    }
}
