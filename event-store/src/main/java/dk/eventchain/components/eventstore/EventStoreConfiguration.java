package dk.eventchain.components.eventstore;

import dk.eventchain.components.eventstore.cipher.Cipher;
import dk.eventchain.components.eventstore.compressor.Compressor;
import dk.eventchain.components.eventstore.hashchain.HashChain;
import dk.eventchain.components.eventstore.serializer.EventSerializer;

import java.util.Optional;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Configuration of a {@link DefaultEventStore}
 */
public final class EventStoreConfiguration {
    /**
     * Chain used to verify events. Its {@link HashChain#eventSerializer()} is also used to serialize payloads for storage
     */
    public final HashChain        hashChain;
    /**
     * Optional compressor applied to the serialized payloads before they're encrypted
     */
    public final Optional<Compressor> compressor;
    /**
     * Optional cipher used to encrypt the stored payloads
     */
    public final Optional<Cipher>     cipher;
    /**
     * Should events be hash verified while they're being read
     */
    public final boolean              verifyOnRead;

    public EventStoreConfiguration(HashChain hashChain, Optional<Compressor> compressor, Optional<Cipher> cipher, boolean verifyOnRead) {
        this.hashChain = requireNonNull(hashChain, "No hashChain provided");
        this.compressor = requireNonNull(compressor, "No compressor option provided");
        this.cipher = requireNonNull(cipher, "No cipher option provided");
        this.verifyOnRead = verifyOnRead;
    }

    /**
     * Default configuration: {@link HashChain#defaultHashChain()}, no compression, no encryption and verification on read
     */
    public static EventStoreConfiguration defaultConfiguration() {
        return new EventStoreConfiguration(HashChain.defaultHashChain(), Optional.empty(), Optional.empty(), true);
    }

    public EventStoreConfiguration withCompressor(Compressor compressor) {
        return new EventStoreConfiguration(hashChain, Optional.of(requireNonNull(compressor, "No compressor provided")), cipher, verifyOnRead);
    }

    public EventStoreConfiguration withCipher(Cipher cipher) {
        return new EventStoreConfiguration(hashChain, compressor, Optional.of(requireNonNull(cipher, "No cipher provided")), verifyOnRead);
    }

    public EventStoreConfiguration withVerifyOnRead(boolean verifyOnRead) {
        return new EventStoreConfiguration(hashChain, compressor, cipher, verifyOnRead);
    }

    public EventSerializer eventSerializer() {
        return hashChain.eventSerializer();
    }

    @Override
    public String toString() {
        return "EventStoreConfiguration{" +
                "compressed=" + compressor.isPresent() +
                ", encrypted=" + cipher.isPresent() +
                ", verifyOnRead=" + verifyOnRead +
                '}';
    }
}
