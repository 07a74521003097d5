package dk.eventchain.components.eventstore.compressor;

/**
 * Compresses the serialized payload of stored events before it's (optionally) encrypted
 */
public interface Compressor {
    byte[] compress(byte[] data);

    /**
     * @param compressedData data produced by {@link #compress(byte[])}
     * @return the original data
     * @throws dk.eventchain.components.eventstore.EventIntegrityException in case the compressed data has been damaged
     */
    byte[] decompress(byte[] compressedData);
}
