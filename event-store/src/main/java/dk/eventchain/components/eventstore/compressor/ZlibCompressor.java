package dk.eventchain.components.eventstore.compressor;

import dk.eventchain.components.eventstore.EventIntegrityException;

import java.io.ByteArrayOutputStream;
import java.util.zip.*;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * {@link Compressor} producing the zlib format (deflate with a zlib header and an Adler-32 checksum)
 */
public class ZlibCompressor implements Compressor {
    private static final int BUFFER_SIZE = 4096;

    private final int level;

    public ZlibCompressor() {
        this(Deflater.DEFAULT_COMPRESSION);
    }

    /**
     * @param level compression level from 0 to 9 or {@link Deflater#DEFAULT_COMPRESSION}
     */
    public ZlibCompressor(int level) {
        requireTrue(level == Deflater.DEFAULT_COMPRESSION || (level >= Deflater.NO_COMPRESSION && level <= Deflater.BEST_COMPRESSION),
                    msg("Compression level must be between {} and {}, but was {}", Deflater.NO_COMPRESSION, Deflater.BEST_COMPRESSION, level));
        this.level = level;
    }

    @Override
    public byte[] compress(byte[] data) {
        requireNonNull(data, "No data provided");
        var deflater = new Deflater(level);
        try {
            deflater.setInput(data);
            deflater.finish();
            var output = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            var buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                var length = deflater.deflate(buffer);
                output.write(buffer, 0, length);
            }
            return output.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @Override
    public byte[] decompress(byte[] compressedData) {
        requireNonNull(compressedData, "No compressedData provided");
        var inflater = new Inflater();
        try {
            inflater.setInput(compressedData);
            var output = new ByteArrayOutputStream(compressedData.length * 2);
            var buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                var length = inflater.inflate(buffer);
                if (length == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new EventIntegrityException(msg("Compressed data is truncated after {} byte(s)", inflater.getTotalIn()));
                }
                output.write(buffer, 0, length);
            }
            return output.toByteArray();
        } catch (DataFormatException e) {
            throw new EventIntegrityException("Failed to decompress the data. It isn't in the zlib format or has been damaged", e);
        } finally {
            inflater.end();
        }
    }
}
