package aqualog.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import aqualog.core.port.out.CredentialRepository;
import aqualog.core.service.auth.CredentialStorageProviderRegistry;

/**
 * CDI producer for the credential repository.
 *
 * <p>Delegates to the {@link CredentialStorageProviderRegistry} which discovers and
 * selects the appropriate storage provider based on configuration and availability.
 *
 * @see aqualog.spi.CredentialStorageProvider
 */
@ApplicationScoped
public class CredentialRepositoryProducer {

    private final CredentialStorageProviderRegistry registry;

    @Inject
    public CredentialRepositoryProducer(CredentialStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public CredentialRepository credentialRepository() {
        return registry.getRepository();
    }
}
