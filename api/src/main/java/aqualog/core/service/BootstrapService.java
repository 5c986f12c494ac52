package aqualog.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.config.BootstrapConfig;
import aqualog.core.model.auth.Role;
import aqualog.core.model.auth.UserSummary;
import aqualog.core.port.in.BootstrapManagement;
import aqualog.core.port.in.UserManagement.DuplicateUsernameException;
import aqualog.core.port.in.UserManagement.InvalidInputException;
import aqualog.core.service.auth.CredentialStoreService;

/**
 * Service for creating the first administrator account.
 *
 * <p>The password must be provided by the operator via the
 * {@code AQUALOG_BOOTSTRAP_PASSWORD} environment variable. Passwords are never
 * auto-generated so the operator always controls the initial credential.
 */
@ApplicationScoped
public class BootstrapService implements BootstrapManagement {

    private static final Logger LOG = Logger.getLogger(BootstrapService.class);

    private final CredentialStoreService credentialStore;
    private final BootstrapConfig config;

    @Inject
    public BootstrapService(CredentialStoreService credentialStore, BootstrapConfig config) {
        this.credentialStore = credentialStore;
        this.config = config;
    }

    @Override
    public Uni<UserSummary> bootstrap() {
        final var password = config.password().filter(p -> !p.isBlank());
        if (password.isEmpty()) {
            return Uni.createFrom()
                    .failure(new BootstrapException("Bootstrap password is required when bootstrap is enabled. "
                            + "Set AQUALOG_BOOTSTRAP_PASSWORD environment variable."));
        }

        return credentialStore
                .create(config.username(), password.get(), Role.ADMIN, config.displayName(), null)
                .map(UserSummary::from)
                .invoke(created -> LOG.infof("Bootstrap administrator created: %s", created.username()))
                .onFailure(DuplicateUsernameException.class)
                .transform(e -> new BootstrapException("Bootstrap user already exists: " + config.username(), e))
                .onFailure(InvalidInputException.class)
                .transform(e -> new BootstrapException("Invalid bootstrap configuration: " + e.getMessage(), e));
    }

    @Override
    public Uni<Boolean> shouldBootstrap() {
        if (!config.enabled()) {
            return Uni.createFrom().item(false);
        }
        return credentialStore.count().map(count -> count == 0);
    }
}
