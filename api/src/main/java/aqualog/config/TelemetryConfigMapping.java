package aqualog.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Example configuration:
 * <pre>{@code
 * aqualog.telemetry.enabled=true
 * aqualog.telemetry.security.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "aqualog.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Security monitoring configuration.
     */
    SecurityConfig security();

    /**
     * Security monitoring configuration.
     */
    interface SecurityConfig {
        /**
         * Enable dispatch of security events (authentication failures,
         * lockouts, access denials, administrative changes) to handlers.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
