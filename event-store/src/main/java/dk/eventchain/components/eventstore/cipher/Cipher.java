package dk.eventchain.components.eventstore.cipher;

/**
 * Encrypts and decrypts the serialized payload of stored events
 */
public interface Cipher {
    /**
     * @param plainText the plain text bytes
     * @return the cipher text
     */
    byte[] encrypt(byte[] plainText);

    /**
     * @param cipherText the cipher text produced by {@link #encrypt(byte[])}
     * @return the plain text bytes
     * @throws dk.eventchain.components.eventstore.EventIntegrityException in case the cipher text has been damaged or was encrypted using another key
     */
    byte[] decrypt(byte[] cipherText);
}
