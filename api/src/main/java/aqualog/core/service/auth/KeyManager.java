package aqualog.core.service.auth;

import java.io.UncheckedIOException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import aqualog.core.config.EncryptionConfig;
import aqualog.core.model.auth.EncryptionKey;
import aqualog.core.model.auth.EncryptionKey.KeySource;
import aqualog.core.port.out.KeyMaterialRepository;

/**
 * Owns the AES-256 key that protects stored password hashes.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>{@code aqualog.auth.encryption.key} if configured. A malformed value is
 *       fatal and never falls back to another source.</li>
 *   <li>The key file, if one has been persisted.</li>
 *   <li>A freshly generated key, written to the key file before it is returned.</li>
 * </ol>
 *
 * <p>Resolution runs once per process under an exclusive lock. The key file is
 * written with create-new semantics, so when several processes race to create
 * it they all end up using the winner's key.
 */
@ApplicationScoped
public class KeyManager {

    private static final Logger LOG = Logger.getLogger(KeyManager.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final String KEY_ALGORITHM = "AES";

    private final EncryptionConfig config;
    private final KeyMaterialRepository keyMaterialRepository;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile EncryptionKey resolvedKey;

    @Inject
    public KeyManager(EncryptionConfig config, KeyMaterialRepository keyMaterialRepository) {
        this.config = config;
        this.keyMaterialRepository = keyMaterialRepository;
    }

    /**
     * Resolve the encryption key. Idempotent: every call in a process returns
     * the same key.
     *
     * @return the process-wide key
     * @throws KeyResolutionException if the key material is malformed or cannot be read or written
     */
    public EncryptionKey resolveKey() {
        final var current = resolvedKey;
        if (current != null) {
            return current;
        }

        lock.lock();
        try {
            if (resolvedKey == null) {
                resolvedKey = resolve();
                LOG.infof("Encryption key resolved: keyId=%s source=%s", resolvedKey.keyId(), resolvedKey.source());
            }
            return resolvedKey;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check whether the key has been resolved in this process.
     *
     * @return true once {@link #resolveKey()} has succeeded
     */
    public boolean isResolved() {
        return resolvedKey != null;
    }

    private EncryptionKey resolve() {
        final Optional<String> configured = config.key().filter(k -> !k.isBlank());
        if (configured.isPresent()) {
            return toKey(decodeConfigured(configured.get().trim()), KeySource.CONFIGURED);
        }

        try {
            final var persisted = keyMaterialRepository.load();
            if (persisted.isPresent()) {
                return toKey(validatePersisted(persisted.get()), KeySource.PERSISTED);
            }

            final byte[] generated = new byte[EncryptionKey.KEY_LENGTH_BYTES];
            SECURE_RANDOM.nextBytes(generated);

            if (keyMaterialRepository.persistIfAbsent(generated)) {
                LOG.warnf(
                        "No encryption key configured. Generated a new key and stored it at %s. "
                                + "Back up this file: password hashes cannot be verified without it.",
                        keyMaterialRepository.location());
                return toKey(generated, KeySource.GENERATED);
            }

            // Another process created the key file first; use its key
            LOG.infof("Key file created concurrently at %s, loading it", keyMaterialRepository.location());
            final byte[] winner = keyMaterialRepository
                    .load()
                    .orElseThrow(() -> new KeyResolutionException(
                            "Key file reported as existing but could not be read: "
                                    + keyMaterialRepository.location()));
            return toKey(validatePersisted(winner), KeySource.PERSISTED);
        } catch (UncheckedIOException e) {
            throw new KeyResolutionException(
                    "Unable to access key material at " + keyMaterialRepository.location() + ": " + e.getMessage(),
                    e);
        }
    }

    private byte[] decodeConfigured(String encoded) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException standard) {
            try {
                keyBytes = Base64.getUrlDecoder().decode(encoded);
            } catch (IllegalArgumentException urlSafe) {
                throw new KeyResolutionException("Configured encryption key is not valid Base64", urlSafe);
            }
        }
        if (keyBytes.length != EncryptionKey.KEY_LENGTH_BYTES) {
            throw new KeyResolutionException("Configured encryption key must be 256 bits (32 bytes). Got: "
                    + keyBytes.length + " bytes");
        }
        return keyBytes;
    }

    private byte[] validatePersisted(byte[] keyBytes) {
        if (keyBytes.length != EncryptionKey.KEY_LENGTH_BYTES) {
            throw new KeyResolutionException("Key file " + keyMaterialRepository.location()
                    + " is corrupt: expected 32 bytes, found " + keyBytes.length);
        }
        return keyBytes;
    }

    private EncryptionKey toKey(byte[] keyBytes, KeySource source) {
        return new EncryptionKey(new SecretKeySpec(keyBytes, KEY_ALGORITHM), config.keyId(), source);
    }

    /**
     * Exception thrown when the encryption key cannot be resolved.
     *
     * <p>Fatal: the engine must not serve authentication requests without a
     * usable key.
     */
    public static class KeyResolutionException extends RuntimeException {
        public KeyResolutionException(String message) {
            super(message);
        }

        public KeyResolutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
