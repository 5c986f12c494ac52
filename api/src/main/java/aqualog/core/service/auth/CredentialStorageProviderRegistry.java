package aqualog.core.service.auth;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import aqualog.core.config.CredentialStorageConfig;
import aqualog.core.port.out.CredentialRepository;
import aqualog.spi.CredentialStorageProvider;
import aqualog.spi.StorageProviderException;

/**
 * Registry for credential storage providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection:
 * <ul>
 *   <li>If {@code aqualog.auth.users.storage.provider} is set, that provider is
 *   used. If it is unknown or unavailable, startup fails with
 *   {@link StorageProviderException}. There is no fallback.</li>
 *   <li>Otherwise the highest priority available provider is used.</li>
 * </ul>
 */
@ApplicationScoped
public class CredentialStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(CredentialStorageProviderRegistry.class);

    private final Instance<CredentialStorageProvider> providers;
    private final CredentialStorageConfig config;

    private CredentialStorageProvider selectedProvider;
    private CredentialRepository repository;

    @Inject
    public CredentialStorageProviderRegistry(
            Instance<CredentialStorageProvider> providers, CredentialStorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider at startup, on a worker thread, rather than on the
     * first request.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Credential storage provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the credential repository from the selected provider.
     *
     * @return Credential repository instance
     */
    public synchronized CredentialRepository getRepository() {
        if (repository == null) {
            repository = getSelectedProvider().createRepository();
        }
        return repository;
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public synchronized CredentialStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private CredentialStorageProvider selectProvider() {
        final Optional<String> configuredProvider = config.provider().filter(name -> !name.isBlank());
        final List<CredentialStorageProvider> allProviders = providers.stream().toList();

        if (configuredProvider.isPresent()) {
            return requireConfigured(configuredProvider.get(), allProviders);
        }

        final List<CredentialStorageProvider> availableProviders = allProviders.stream()
                .filter(CredentialStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(CredentialStorageProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available credential storage providers: %s",
                availableProviders.stream().map(CredentialStorageProvider::name).toList());

        if (availableProviders.isEmpty()) {
            throw new StorageProviderException("No credential storage providers available");
        }

        final CredentialStorageProvider provider = availableProviders.get(0);
        LOG.infof("Using credential storage provider: %s (priority: %d)", provider.name(), provider.priority());
        return provider;
    }

    private static CredentialStorageProvider requireConfigured(
            String name, List<CredentialStorageProvider> allProviders) {
        final CredentialStorageProvider provider = allProviders.stream()
                .filter(p -> p.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new StorageProviderException("Unknown credential storage provider '" + name
                        + "'. Known providers: "
                        + allProviders.stream().map(CredentialStorageProvider::name).toList()));

        if (!provider.isAvailable()) {
            throw new StorageProviderException("Configured credential storage provider '" + name
                    + "' is not available. Refusing to start with a different credential store.");
        }

        LOG.infof("Using configured credential storage provider: %s", name);
        return provider;
    }
}
