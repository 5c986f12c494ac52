package aqualog.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import aqualog.core.port.out.CredentialRepository;
import aqualog.spi.CredentialStorageProvider;

/**
 * In-memory credential storage provider.
 *
 * <p>This provider is always available. It is used when configured, or when
 * no provider is configured and no higher priority provider is available.
 *
 * <p><strong>Warning:</strong> Users are lost on restart. Not for production.
 */
@ApplicationScoped
public class InMemoryCredentialStorageProvider implements CredentialStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryCredentialRepository repository;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized CredentialRepository createRepository() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Credential storage is in-memory only!");
            LOG.warn("  All user accounts are lost when the process exits.");
            LOG.warn("  Configure Redis (aqualog.auth.users.storage.provider=redis) for production.");
            LOG.warn("========================================================================");
        }

        if (repository == null) {
            repository = new InMemoryCredentialRepository();
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("credential-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("users", repository != null ? repository.getUserCount() : 0)
                .build());
    }
}
