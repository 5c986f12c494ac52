package aqualog.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for account lockout (brute force protection).
 *
 * <p>Configuration prefix: {@code aqualog.auth.lockout}
 *
 * <p>Failed attempts are counted on the account itself. Once the counter
 * reaches {@link #maxFailedAttempts()} the account is locked for
 * {@link #duration()}. The counter is only reset by a successful login or an
 * administrative unlock, so a further failure after the lock expires locks the
 * account again immediately.
 *
 * @see aqualog.core.service.auth.CredentialStoreService
 */
@ConfigMapping(prefix = "aqualog.auth.lockout")
public interface LockoutConfig {

    /**
     * Maximum failed authentication attempts before lockout.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxFailedAttempts();

    /**
     * Duration of lockout after max failed attempts.
     *
     * @return lockout duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration duration();
}
