package aqualog.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import aqualog.core.port.out.CredentialRepository;

/**
 * SPI for credential storage implementations.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>Provider selection: the configured provider
 * ({@code aqualog.auth.users.storage.provider}) if set, which must then be
 * available, otherwise the highest priority available provider.
 *
 * <p>Implementations must honour the atomicity contract of
 * {@link CredentialRepository#update}: a record is replaced entirely or not at all.
 */
public interface CredentialStorageProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the credential repository implementation.
     *
     * @return Credential repository instance
     * @throws StorageProviderException if the repository cannot be created
     */
    CredentialRepository createRepository();

    /**
     * Create a health indicator for this storage backend.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
