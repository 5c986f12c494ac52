package aqualog.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session management.
 *
 * <p>Configuration prefix: {@code aqualog.session}
 */
@ConfigMapping(prefix = "aqualog.session")
public interface SessionConfig {

    /**
     * Idle timeout - invalidate session after inactivity.
     *
     * <p>Checked when a session is used; there is no background sweep.
     *
     * @return Idle duration (default: 60 minutes)
     */
    @WithDefault("PT60M")
    Duration idleTimeout();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Session ID generation configuration.
     */
    interface IdGenerationConfig {

        /**
         * Maximum retries for session token collision.
         *
         * <p>If a generated token already exists in storage,
         * the system will retry up to this many times before failing.
         *
         * @return Max retry attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }
}
