package dk.eventchain.components.eventstore.hashchain;

import dk.eventchain.components.eventstore.*;
import dk.eventchain.components.eventstore.eventstream.DomainEvent;
import dk.eventchain.components.eventstore.serializer.*;
import dk.eventchain.components.eventstore.types.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.*;
import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Stream;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Binds every {@link DomainEvent} to its predecessor within the same aggregate.<br>
 * The {@link EventHash} of an event is the SHA-256 digest over a length prefixed byte layout of
 * the originator id, the originator version, the event type, the serialized payload, the timestamp and the previous hash.
 * The timestamp is hashed in UTC with microsecond precision (see {@link #normalizeTimestamp(OffsetDateTime)}), which every supported backend stores exactly.<br>
 * The first event of an aggregate uses {@link EventHash#GENESIS} as previous hash.
 */
public class HashChain {
    private static final String    DIGEST_ALGORITHM = "SHA-256";
    private static final HexFormat HEX              = HexFormat.of();
    private static final HashChain DEFAULT          = new HashChain(new JacksonEventSerializer());

    private final EventSerializer eventSerializer;

    public HashChain(EventSerializer eventSerializer) {
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
    }

    /**
     * The {@link HashChain} that uses a {@link JacksonEventSerializer} with the canonical object mapper.<br>
     * Aggregates and event stores that work on the same events must agree on the serializer, otherwise hashes can't be recomputed.
     */
    public static HashChain defaultHashChain() {
        return DEFAULT;
    }

    public EventSerializer eventSerializer() {
        return eventSerializer;
    }

    /**
     * Compute the hash of an event
     *
     * @param originatorId      the aggregate id
     * @param originatorVersion the version of the event
     * @param eventType         the event type
     * @param payloadBytes      the serialized (plain text) payload
     * @param timestamp         when the event occurred
     * @param previousHash      the hash of the preceding event or {@link EventHash#GENESIS}
     * @return the hash of the event
     */
    public EventHash computeHash(UUID originatorId,
                                 OriginatorVersion originatorVersion,
                                 EventType eventType,
                                 byte[] payloadBytes,
                                 OffsetDateTime timestamp,
                                 EventHash previousHash) {
        requireNonNull(originatorId, "No originatorId provided");
        requireNonNull(originatorVersion, "No originatorVersion provided");
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(payloadBytes, "No payloadBytes provided");
        requireNonNull(timestamp, "No timestamp provided");
        requireNonNull(previousHash, "No previousHash provided");

        var instant = normalizeTimestamp(timestamp).toInstant();
        var digest  = newDigest();
        update(digest, originatorId.toString().getBytes(StandardCharsets.UTF_8));
        update(digest, ByteBuffer.allocate(Long.BYTES).putLong(originatorVersion.longValue()).array());
        update(digest, eventType.toString().getBytes(StandardCharsets.UTF_8));
        update(digest, payloadBytes);
        update(digest, ByteBuffer.allocate(Long.BYTES + Integer.BYTES).putLong(instant.getEpochSecond()).putInt(instant.getNano()).array());
        update(digest, previousHash.toString().getBytes(StandardCharsets.UTF_8));
        return EventHash.of(HEX.formatHex(digest.digest()));
    }

    /**
     * Compute the hash of the <code>link</code> using its serialized payload
     */
    public EventHash computeHash(ChainLink link, byte[] payloadBytes) {
        requireNonNull(link, "No link provided");
        return computeHash(link.originatorId(),
                           link.originatorVersion(),
                           link.eventType(),
                           payloadBytes,
                           link.timestamp(),
                           link.previousHash());
    }

    /**
     * The form in which a timestamp is hashed and kept by a {@link DomainEvent}: UTC truncated to microseconds
     */
    public static OffsetDateTime normalizeTimestamp(OffsetDateTime timestamp) {
        requireNonNull(timestamp, "No timestamp provided");
        return timestamp.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Create a new {@link DomainEvent} linked to the <code>previousHash</code>
     *
     * @param originatorId      the aggregate id
     * @param originatorVersion the version of the new event
     * @param payload           the event payload
     * @param timestamp         when the event occurred
     * @param previousHash      the hash of the preceding event or {@link EventHash#GENESIS} for the first event
     * @return the sealed event
     */
    public DomainEvent seal(UUID originatorId,
                            OriginatorVersion originatorVersion,
                            Object payload,
                            OffsetDateTime timestamp,
                            EventHash previousHash) {
        requireNonNull(payload, "No payload provided");
        var eventType           = EventType.of(payload.getClass());
        var normalizedTimestamp = normalizeTimestamp(timestamp);
        var eventHash = computeHash(originatorId,
                                    originatorVersion,
                                    eventType,
                                    eventSerializer.serialize(payload),
                                    normalizedTimestamp,
                                    previousHash);
        return DomainEvent.from(originatorId,
                                originatorVersion,
                                eventType,
                                payload,
                                normalizedTimestamp,
                                previousHash,
                                eventHash);
    }

    /**
     * Verify that the event links to the <code>expectedPreviousHash</code> and that its hash matches its content
     *
     * @param event                the event to verify
     * @param expectedPreviousHash the hash the event must link to
     * @throws EventIntegrityException in case verification fails
     */
    public void verify(DomainEvent event, EventHash expectedPreviousHash) {
        requireNonNull(event, "No event provided");
        verify(event, eventSerializer.serialize(event.payload()), expectedPreviousHash);
    }

    /**
     * Verify that the link points to the <code>expectedPreviousHash</code> and that its hash matches the <code>payloadBytes</code>
     *
     * @param event                the event or stored record to verify
     * @param payloadBytes         the serialized payload of the event, e.g. as it was read from storage
     * @param expectedPreviousHash the hash the event must link to
     * @throws EventIntegrityException in case verification fails
     */
    public void verify(ChainLink event, byte[] payloadBytes, EventHash expectedPreviousHash) {
        requireNonNull(event, "No event provided");
        requireNonNull(expectedPreviousHash, "No expectedPreviousHash provided");
        if (!expectedPreviousHash.equals(event.previousHash())) {
            throw new EventIntegrityException(msg("Broken hash chain for aggregate '{}' at version {}: expected previous hash '{}' but the event links to '{}'",
                                                  event.originatorId(),
                                                  event.originatorVersion(),
                                                  expectedPreviousHash,
                                                  event.previousHash()),
                                              event.originatorId(),
                                              event.originatorVersion());
        }
        verifyHash(event, payloadBytes);
    }

    /**
     * Verify that the hash of the event matches its content without checking its link
     *
     * @param event        the event or stored record to verify
     * @param payloadBytes the serialized payload of the event
     * @throws EventIntegrityException in case the hash doesn't match
     */
    public void verifyHash(ChainLink event, byte[] payloadBytes) {
        requireNonNull(event, "No event provided");
        var recomputedHash = computeHash(event, payloadBytes);
        if (!recomputedHash.equals(event.eventHash())) {
            throw new EventIntegrityException(msg("Hash mismatch for aggregate '{}' at version {}: stored hash '{}' but the content hashes to '{}'",
                                                  event.originatorId(),
                                                  event.originatorVersion(),
                                                  event.eventHash(),
                                                  recomputedHash),
                                              event.originatorId(),
                                              event.originatorVersion());
        }
    }

    /**
     * Verify a complete chain, i.e. the events of one aggregate starting with version 1
     *
     * @param events the events in ascending version order
     * @return the verification result
     * @throws EventIntegrityException naming the aggregate and the version where the chain broke
     */
    public ChainVerificationResult verifyChain(Stream<DomainEvent> events) {
        requireNonNull(events, "No events provided");
        var verifier = verifierFromGenesis();
        events.forEach(verifier::accept);
        return verifier.result();
    }

    /**
     * @see #verifyChain(Stream)
     */
    public ChainVerificationResult verifyChain(Iterable<DomainEvent> events) {
        requireNonNull(events, "No events provided");
        var verifier = verifierFromGenesis();
        events.forEach(verifier::accept);
        return verifier.result();
    }

    /**
     * Create an incremental {@link Verifier} for a chain that must start with the first version of an aggregate
     */
    public Verifier verifierFromGenesis() {
        return new Verifier(true);
    }

    /**
     * Create an incremental {@link Verifier} for a part of a chain. The link of the first event is only checked if it is the first version
     * of the aggregate, all following events must link to their predecessor
     */
    public Verifier verifierForRange() {
        return new Verifier(false);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(msg("{} isn't supported by this JVM", DIGEST_ALGORITHM), e);
        }
    }

    private static void update(MessageDigest digest, byte[] field) {
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(field.length).array());
        digest.update(field);
    }

    /**
     * Verifies events one at a time in ascending version order
     */
    public class Verifier {
        private final boolean           mustStartAtGenesis;
        private       UUID              originatorId;
        private       OriginatorVersion lastVersion;
        private       EventHash         head;
        private       long              count;

        private Verifier(boolean mustStartAtGenesis) {
            this.mustStartAtGenesis = mustStartAtGenesis;
        }

        /**
         * Verify the next event by re-serializing its payload
         */
        public void accept(DomainEvent event) {
            requireNonNull(event, "No event provided");
            accept(event, eventSerializer.serialize(event.payload()));
        }

        /**
         * Verify the next event, or the next stored record before its payload is deserialized, using the serialized payload bytes
         */
        public void accept(ChainLink event, byte[] payloadBytes) {
            requireNonNull(event, "No event provided");
            var isFirstEvent = OriginatorVersion.FIRST_VERSION.equals(event.originatorVersion());
            if (lastVersion == null) {
                originatorId = event.originatorId();
                if (mustStartAtGenesis && !isFirstEvent) {
                    throw new EventIntegrityException(msg("Chain for aggregate '{}' doesn't start at version {} but at version {}",
                                                          event.originatorId(),
                                                          OriginatorVersion.FIRST_VERSION,
                                                          event.originatorVersion()),
                                                      event.originatorId(),
                                                      event.originatorVersion());
                }
                if (isFirstEvent) {
                    verify(event, payloadBytes, EventHash.GENESIS);
                } else {
                    verifyHash(event, payloadBytes);
                }
            } else {
                if (!originatorId.equals(event.originatorId())) {
                    throw new EventIntegrityException(msg("Event with version {} belongs to aggregate '{}' and not to aggregate '{}'",
                                                          event.originatorVersion(),
                                                          event.originatorId(),
                                                          originatorId),
                                                      originatorId,
                                                      event.originatorVersion());
                }
                if (!lastVersion.increment().equals(event.originatorVersion())) {
                    throw new EventIntegrityException(msg("Version gap in chain for aggregate '{}': expected version {} but got version {}",
                                                          originatorId,
                                                          lastVersion.increment(),
                                                          event.originatorVersion()),
                                                      originatorId,
                                                      event.originatorVersion());
                }
                verify(event, payloadBytes, head);
            }
            lastVersion = event.originatorVersion();
            head = event.eventHash();
            count++;
        }

        public ChainVerificationResult result() {
            return new ChainVerificationResult(Optional.ofNullable(originatorId),
                                               count,
                                               head != null ? head : EventHash.GENESIS,
                                               lastVersion != null ? lastVersion : OriginatorVersion.NO_EVENTS_PERSISTED);
        }
    }
}
