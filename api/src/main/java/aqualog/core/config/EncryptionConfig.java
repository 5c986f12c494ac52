package aqualog.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for at-rest encryption of password hashes.
 *
 * <p>Configuration prefix: {@code aqualog.auth.encryption}
 *
 * <pre>
 * aqualog.auth.encryption.key=${AQUALOG_AUTH_ENCRYPTION_KEY}  # Base64-encoded 256-bit key
 * aqualog.auth.encryption.key-file=.aqualog/encryption.key     # used when no key is configured
 * aqualog.auth.encryption.key-id=v1                            # for future key rotation
 * </pre>
 *
 * @see aqualog.core.service.auth.KeyManager
 */
@ConfigMapping(prefix = "aqualog.auth.encryption")
public interface EncryptionConfig {

    /**
     * Externally supplied key material, Base64 or URL-safe Base64 encoded.
     *
     * <p>When present it must decode to exactly 32 bytes. A malformed value is
     * a fatal error; the key file is not consulted as a fallback.
     *
     * @return the encoded key, or empty to use the key file
     */
    Optional<String> key();

    /**
     * Location of the persisted key blob.
     *
     * @return key file path (default: .aqualog/encryption.key)
     */
    @WithDefault(".aqualog/encryption.key")
    String keyFile();

    /**
     * Identifier stored with every encrypted hash.
     *
     * @return key id (default: v1)
     */
    @WithDefault("v1")
    String keyId();
}
