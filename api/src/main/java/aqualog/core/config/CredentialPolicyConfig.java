package aqualog.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for credential validation and password hashing.
 *
 * <p>Configuration prefix: {@code aqualog.auth.credentials}
 */
@ConfigMapping(prefix = "aqualog.auth.credentials")
public interface CredentialPolicyConfig {

    /**
     * Maximum username length.
     *
     * @return max length (default: 64)
     */
    @WithDefault("64")
    int usernameMaxLength();

    /**
     * Minimum password length.
     *
     * @return min length (default: 8)
     */
    @WithDefault("8")
    int passwordMinLength();

    /**
     * Maximum password length. Bounds the cost of a single hash derivation.
     *
     * @return max length (default: 1024)
     */
    @WithDefault("1024")
    int passwordMaxLength();

    /**
     * PBKDF2 iteration count for newly derived hashes.
     *
     * <p>The count is stored with each hash, so changing it only affects
     * passwords set afterwards.
     *
     * @return iterations (default: 210000)
     */
    @WithDefault("210000")
    int hashIterations();
}
