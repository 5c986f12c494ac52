package aqualog.core.service.auth;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import aqualog.core.model.auth.EncryptionKey;

/**
 * At-rest encryption for password hashes.
 *
 * <p>Uses AES-256-GCM with a unique IV per operation, which provides both
 * confidentiality and integrity. The key comes from {@link KeyManager}.
 *
 * <p>Payload layout before Base64 encoding:
 * {@code [keyId length: 1 byte][keyId][IV: 12 bytes][ciphertext + tag]}
 */
@ApplicationScoped
public class PasswordHashCipher {

    private static final Logger LOG = Logger.getLogger(PasswordHashCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final KeyManager keyManager;
    private final SecureRandom secureRandom;

    @Inject
    public PasswordHashCipher(KeyManager keyManager) {
        this.keyManager = keyManager;
        this.secureRandom = new SecureRandom();
    }

    /**
     * Encrypt a serialized password hash for storage.
     *
     * @param passwordHash the serialized hash
     * @return Base64-encoded encrypted payload
     */
    public String encrypt(String passwordHash) {
        final EncryptionKey key = keyManager.resolveKey();
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_LENGTH_BITS, iv));

            final byte[] ciphertext = cipher.doFinal(passwordHash.getBytes(StandardCharsets.UTF_8));
            final byte[] keyIdBytes = key.keyId().getBytes(StandardCharsets.UTF_8);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);

            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new CipherException("Failed to encrypt password hash", e);
        }
    }

    /**
     * Decrypt a stored password hash.
     *
     * @param encryptedData Base64-encoded encrypted payload
     * @return the serialized hash
     * @throws CipherException if the payload is malformed or was encrypted with another key
     */
    public String decrypt(String encryptedData) {
        final EncryptionKey key = keyManager.resolveKey();
        try {
            final ByteBuffer buffer = ByteBuffer.wrap(Base64.getDecoder().decode(encryptedData));

            final int keyIdLength = buffer.get() & 0xFF;
            final byte[] keyIdBytes = new byte[keyIdLength];
            buffer.get(keyIdBytes);
            final String dataKeyId = new String(keyIdBytes, StandardCharsets.UTF_8);

            if (!key.keyId().equals(dataKeyId)) {
                LOG.warnf("Key ID mismatch: expected %s, got %s. Key rotation may be needed.", key.keyId(), dataKeyId);
            }

            final byte[] iv = new byte[IV_LENGTH];
            buffer.get(iv);
            final byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | RuntimeException e) {
            throw new CipherException("Failed to decrypt password hash", e);
        }
    }

    /**
     * Exception thrown when a password hash cannot be encrypted or decrypted.
     */
    public static class CipherException extends RuntimeException {
        public CipherException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
