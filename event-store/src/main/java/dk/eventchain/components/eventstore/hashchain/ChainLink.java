package dk.eventchain.components.eventstore.hashchain;

import dk.eventchain.components.eventstore.eventstream.DomainEvent;
import dk.eventchain.components.eventstore.persistence.StoredRecord;
import dk.eventchain.components.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * The hashed fields of an event, apart from its serialized payload.<br>
 * Implemented by {@link DomainEvent} and by {@link StoredRecord}, so stored records can be verified before their payload is deserialized
 */
public interface ChainLink {
    UUID originatorId();

    OriginatorVersion originatorVersion();

    EventType eventType();

    OffsetDateTime timestamp();

    EventHash previousHash();

    EventHash eventHash();
}
