package aqualog.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for first-administrator bootstrap.
 *
 * <p>Bootstrap creates an initial administrator account when the credential
 * store is empty, solving the chicken-and-egg problem of needing an
 * administrator to create the first administrator.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code aqualog.bootstrap.enabled} - Enable bootstrap mode (default: false)</li>
 *   <li>{@code aqualog.bootstrap.username} - Administrator username (default: admin)</li>
 *   <li>{@code aqualog.bootstrap.password} - Required administrator password</li>
 *   <li>{@code aqualog.bootstrap.display-name} - Display name (default: System Administrator)</li>
 * </ul>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code AQUALOG_BOOTSTRAP_ENABLED} - Enable bootstrap mode</li>
 *   <li>{@code AQUALOG_BOOTSTRAP_PASSWORD} - Required administrator password</li>
 * </ul>
 */
@ConfigMapping(prefix = "aqualog.bootstrap")
public interface BootstrapConfig {

    /**
     * Whether bootstrap mode is enabled.
     *
     * @return true if bootstrap mode is enabled
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Username of the bootstrap administrator.
     *
     * @return username (default: admin)
     */
    @WithDefault("admin")
    String username();

    /**
     * The administrator password provided by the operator.
     *
     * <p>Required when bootstrap is enabled. It is hashed and stored; the
     * plaintext is never logged or persisted. Passwords are never
     * auto-generated.
     *
     * @return the password, or empty if not configured
     */
    Optional<String> password();

    /**
     * Display name of the bootstrap administrator.
     *
     * @return display name (default: System Administrator)
     */
    @WithDefault("System Administrator")
    String displayName();
}
