package aqualog.core.model.auth;

import javax.crypto.SecretKey;

/**
 * The process-wide AES-256 key protecting stored password hashes.
 *
 * @param secretKey the key material
 * @param keyId     identifier written alongside encrypted data
 * @param source    where the key came from
 */
public record EncryptionKey(SecretKey secretKey, String keyId, KeySource source) {

    /** Size of the key material in bytes. */
    public static final int KEY_LENGTH_BYTES = 32;

    public EncryptionKey {
        if (secretKey == null) {
            throw new IllegalArgumentException("Secret key cannot be null");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        if (keyId.length() > 255) {
            throw new IllegalArgumentException("Key ID cannot exceed 255 characters");
        }
        if (source == null) {
            throw new IllegalArgumentException("Key source cannot be null");
        }
    }

    @Override
    public String toString() {
        return "EncryptionKey[keyId=" + keyId + ", source=" + source + "]";
    }

    /**
     * Origin of the resolved key.
     */
    public enum KeySource {
        /** Supplied through configuration or the environment. */
        CONFIGURED,
        /** Loaded from the key file written by an earlier run. */
        PERSISTED,
        /** Generated by this process and written to the key file. */
        GENERATED
    }
}
