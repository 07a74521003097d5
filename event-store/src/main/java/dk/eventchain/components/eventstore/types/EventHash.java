package dk.eventchain.components.eventstore.types;

import dk.eventchain.components.eventstore.hashchain.HashChain;
import dk.eventchain.components.common.types.CharSequenceType;

/**
 * Lower case hex encoded SHA-256 digest of a sealed event (see {@link HashChain}).<br>
 * The first event of an aggregate links back to the {@link #GENESIS} hash.
 */
public class EventHash extends CharSequenceType<EventHash> {
    /**
     * The previous-hash of the FIRST event of any aggregate
     */
    public static final EventHash GENESIS = EventHash.of("0".repeat(64));

    public EventHash(CharSequence value) {
        super(value);
    }

    public static EventHash of(CharSequence value) {
        return new EventHash(value);
    }

    public boolean isGenesis() {
        return GENESIS.equals(this);
    }
}
