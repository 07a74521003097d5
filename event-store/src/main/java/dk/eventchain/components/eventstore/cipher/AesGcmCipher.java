package dk.eventchain.components.eventstore.cipher;

import dk.eventchain.components.eventstore.EventIntegrityException;

import javax.crypto.*;
import javax.crypto.spec.*;
import java.security.*;
import java.util.Base64;

import static dk.eventchain.components.common.FailFast.*;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * AES-GCM {@link Cipher}. Every encryption uses a new random 96 bit nonce.<br>
 * Cipher text layout: <code>nonce (12 bytes) | cipher text | authentication tag (16 bytes)</code>
 */
public class AesGcmCipher implements Cipher {
    private static final String TRANSFORMATION  = "AES/GCM/NoPadding";
    private static final int    NONCE_LENGTH    = 12;
    private static final int    TAG_LENGTH_BITS = 128;

    private final SecretKey    key;
    private final SecureRandom secureRandom;

    /**
     * @param key AES key of 16, 24 or 32 bytes
     */
    public AesGcmCipher(byte[] key) {
        requireNonNull(key, "No key provided");
        requireTrue(key.length == 16 || key.length == 24 || key.length == 32,
                    msg("AES key must be 16, 24 or 32 bytes long, but was {} bytes", key.length));
        this.key = new SecretKeySpec(key, "AES");
        this.secureRandom = new SecureRandom();
    }

    /**
     * @param base64EncodedKey Base64 encoded AES key of 16, 24 or 32 bytes
     */
    public static AesGcmCipher fromBase64Key(String base64EncodedKey) {
        requireNonNull(base64EncodedKey, "No base64EncodedKey provided");
        return new AesGcmCipher(Base64.getDecoder().decode(base64EncodedKey));
    }

    /**
     * Generate a new random AES key
     *
     * @param keySizeInBits 128, 192 or 256
     * @return the Base64 encoded key
     */
    public static String createKey(int keySizeInBits) {
        requireTrue(keySizeInBits == 128 || keySizeInBits == 192 || keySizeInBits == 256,
                    msg("Key size must be 128, 192 or 256 bits, but was {}", keySizeInBits));
        var keyBytes = new byte[keySizeInBits / 8];
        new SecureRandom().nextBytes(keyBytes);
        return Base64.getEncoder().encodeToString(keyBytes);
    }

    @Override
    public byte[] encrypt(byte[] plainText) {
        requireNonNull(plainText, "No plainText provided");
        var nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);
        try {
            var cipher = javax.crypto.Cipher.getInstance(TRANSFORMATION);
            cipher.init(javax.crypto.Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            var encrypted = cipher.doFinal(plainText);
            var result    = new byte[NONCE_LENGTH + encrypted.length];
            System.arraycopy(nonce, 0, result, 0, NONCE_LENGTH);
            System.arraycopy(encrypted, 0, result, NONCE_LENGTH, encrypted.length);
            return result;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt using " + TRANSFORMATION, e);
        }
    }

    @Override
    public byte[] decrypt(byte[] cipherText) {
        requireNonNull(cipherText, "No cipherText provided");
        if (cipherText.length < NONCE_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new EventIntegrityException(msg("Cipher text is too short ({} bytes) to contain a nonce and an authentication tag", cipherText.length));
        }
        try {
            var cipher = javax.crypto.Cipher.getInstance(TRANSFORMATION);
            cipher.init(javax.crypto.Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, cipherText, 0, NONCE_LENGTH));
            return cipher.doFinal(cipherText, NONCE_LENGTH, cipherText.length - NONCE_LENGTH);
        } catch (AEADBadTagException e) {
            throw new EventIntegrityException("Failed to authenticate the cipher text. It has been damaged or was encrypted with another key", e);
        } catch (GeneralSecurityException e) {
            throw new EventIntegrityException("Failed to decrypt the cipher text", e);
        }
    }
}
