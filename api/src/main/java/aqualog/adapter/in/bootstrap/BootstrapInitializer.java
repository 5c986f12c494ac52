package aqualog.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import aqualog.config.BootstrapConfig;
import aqualog.core.model.auth.UserSummary;
import aqualog.core.port.in.BootstrapManagement;
import aqualog.core.port.in.BootstrapManagement.BootstrapException;
import aqualog.core.service.auth.KeyManager;
import aqualog.core.service.auth.KeyManager.KeyResolutionException;

/**
 * Prepares the credential engine on application startup.
 *
 * <p>Resolves the encryption key, then creates the bootstrap administrator if
 * bootstrap is enabled and the credential store is empty.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If the encryption key is malformed or unreadable: startup FAILS</li>
 *   <li>If bootstrap is enabled but no password is provided: startup FAILS</li>
 *   <li>If storage is unavailable during bootstrap: startup FAILS</li>
 * </ul>
 *
 * <p>The bootstrap password is never logged.
 */
@ApplicationScoped
public class BootstrapInitializer {

    private static final Logger LOG = Logger.getLogger(BootstrapInitializer.class);
    private static final Logger AUDIT = Logger.getLogger("aqualog.audit.bootstrap");

    private final KeyManager keyManager;
    private final BootstrapManagement bootstrapService;
    private final BootstrapConfig config;

    @Inject
    public BootstrapInitializer(KeyManager keyManager, BootstrapManagement bootstrapService, BootstrapConfig config) {
        this.keyManager = keyManager;
        this.bootstrapService = bootstrapService;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        resolveEncryptionKey();

        if (!config.enabled()) {
            LOG.debug("Bootstrap mode is disabled");
            return;
        }

        LOG.info("Bootstrap mode is enabled");

        if (config.password().isEmpty() || config.password().get().isBlank()) {
            LOG.error("========================================");
            LOG.error("BOOTSTRAP FAILED: No password provided");
            LOG.error("Set AQUALOG_BOOTSTRAP_PASSWORD environment variable");
            LOG.error("========================================");
            throw new BootstrapException(
                    "Bootstrap is enabled but no password provided. Set AQUALOG_BOOTSTRAP_PASSWORD.");
        }

        try {
            if (!bootstrapService.shouldBootstrap().await().indefinitely()) {
                LOG.info("Bootstrap skipped: credential store already has users");
                AUDIT.info("BOOTSTRAP_SKIPPED reason=users_exist");
                return;
            }

            LOG.info("Creating bootstrap administrator...");
            final UserSummary created = bootstrapService.bootstrap().await().indefinitely();
            AUDIT.infof("BOOTSTRAP_ADMIN_CREATED username=%s", created.username());
            LOG.info("========================================");
            LOG.infof("BOOTSTRAP ADMINISTRATOR CREATED: %s", created.username());
            LOG.info("Log in and change the bootstrap password, then disable bootstrap mode.");
            LOG.info("========================================");
        } catch (BootstrapException e) {
            LOG.error("========================================");
            LOG.errorf("BOOTSTRAP FAILED: %s", e.getMessage());
            LOG.error("========================================");
            throw e;
        } catch (RuntimeException e) {
            LOG.error("========================================");
            LOG.errorf(e, "BOOTSTRAP FAILED: Unexpected error: %s", e.getMessage());
            LOG.error("========================================");
            throw new BootstrapException("Bootstrap failed unexpectedly", e);
        }
    }

    private void resolveEncryptionKey() {
        try {
            keyManager.resolveKey();
        } catch (KeyResolutionException e) {
            LOG.error("========================================");
            LOG.errorf("ENCRYPTION KEY UNAVAILABLE: %s", e.getMessage());
            LOG.error("Refusing to start: stored password hashes cannot be protected or verified.");
            LOG.error("========================================");
            throw e;
        }
    }
}
