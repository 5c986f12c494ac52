package aqualog.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import aqualog.core.service.auth.CredentialStorageProviderRegistry;
import aqualog.core.service.auth.KeyManager;

/**
 * Readiness check for the credential engine.
 *
 * <p>Reports DOWN until the encryption key has been resolved, and otherwise
 * reflects the selected storage provider's own health check.
 */
@Readiness
@ApplicationScoped
public class CredentialStoreHealthCheck implements HealthCheck {

    private final CredentialStorageProviderRegistry registry;
    private final KeyManager keyManager;

    @Inject
    public CredentialStoreHealthCheck(CredentialStorageProviderRegistry registry, KeyManager keyManager) {
        this.registry = registry;
        this.keyManager = keyManager;
    }

    @Override
    public HealthCheckResponse call() {
        final HealthCheckResponseBuilder builder =
                HealthCheckResponse.builder().name("credential-store");
        final var provider = registry.getSelectedProvider();
        builder.withData("provider", provider.name());
        builder.withData("encryptionKeyResolved", keyManager.isResolved());

        final boolean storageUp = provider.healthCheck()
                .map(response -> response.getStatus() == HealthCheckResponse.Status.UP)
                .orElse(true);

        return builder.status(storageUp && keyManager.isResolved()).build();
    }
}
