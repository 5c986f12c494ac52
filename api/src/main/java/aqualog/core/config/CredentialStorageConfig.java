package aqualog.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for credential storage.
 *
 * <p>Configuration prefix: {@code aqualog.auth.users.storage}
 */
@ConfigMapping(prefix = "aqualog.auth.users.storage")
public interface CredentialStorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: redis, memory, or custom SPI name. A configured
     * provider must be available at startup; when unset, the highest priority
     * available provider is used.
     *
     * @return Provider name, or empty to select by priority
     */
    Optional<String> provider();

    /**
     * Redis-specific configuration.
     */
    RedisConfig redis();

    /**
     * Redis storage configuration.
     */
    interface RedisConfig {

        /**
         * Key prefix for user records in Redis.
         *
         * @return Key prefix (default: aqualog:user:)
         */
        @WithDefault("aqualog:user:")
        String keyPrefix();

        /**
         * Timeout for a single Redis round trip.
         *
         * @return timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration timeout();

        /**
         * Retries for an optimistic transaction that lost a race on a watched key.
         *
         * @return max retries (default: 5)
         */
        @WithDefault("5")
        int maxTransactionRetries();
    }
}
