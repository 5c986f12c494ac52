package aqualog.core.service.auth;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.core.model.auth.Capability;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.Role;
import aqualog.core.model.auth.UserRecord;
import aqualog.core.model.auth.UserSummary;
import aqualog.core.port.in.AccessControl;
import aqualog.core.port.in.SessionManagement;
import aqualog.core.port.in.UserManagement;
import aqualog.core.port.out.SecurityMonitoring;

/**
 * Administrative user management.
 *
 * <p>Every operation first passes the caller through {@link AccessControl#require}
 * and only then reaches the {@link CredentialStoreService}.
 */
@ApplicationScoped
public class UserManagementService implements UserManagement {

    private static final Logger LOG = Logger.getLogger(UserManagementService.class);
    private static final Logger AUDIT = Logger.getLogger("aqualog.audit.users");

    private final AccessControl accessControl;
    private final CredentialStoreService credentialStore;
    private final SessionManagement sessionManagement;
    private final SecurityMonitoring securityMonitoring;

    @Inject
    public UserManagementService(
            AccessControl accessControl,
            CredentialStoreService credentialStore,
            SessionManagement sessionManagement,
            SecurityMonitoring securityMonitoring) {
        this.accessControl = accessControl;
        this.credentialStore = credentialStore;
        this.sessionManagement = sessionManagement;
        this.securityMonitoring = securityMonitoring;
    }

    @Override
    public Uni<UserSummary> createUser(
            Identity caller, String username, String password, Role role, String displayName, String email) {
        return authorize(caller, "create_user")
                .flatMap(v -> credentialStore.create(username, password, role, displayName, email))
                .invoke(created -> audit(caller, "create_user", created.username()))
                .map(UserSummary::from);
    }

    @Override
    public Uni<Void> changePassword(Identity caller, String username, String newPassword) {
        return authorize(caller, "change_password")
                .flatMap(v -> credentialStore.setPassword(username, newPassword))
                .invoke(updated -> audit(caller, "change_password", username))
                .replaceWithVoid();
    }

    @Override
    public Uni<UserSummary> changeRole(Identity caller, String username, Role role) {
        return authorize(caller, "change_role")
                .invoke(() -> {
                    if (role == null) {
                        throw new InvalidInputException("Role is required");
                    }
                })
                .flatMap(v -> requireUser(username))
                .flatMap(existing -> {
                    if (existing.role() == role) {
                        return Uni.createFrom().item(existing);
                    }
                    final Uni<UserRecord> change = existing.role() != Role.ADMIN
                            ? credentialStore.updateRole(username, role)
                            : guardAdminRemoval(caller, existing, "demote")
                                    .flatMap(g -> retainingAnAdmin(
                                            existing,
                                            "demote",
                                            credentialStore.updateRole(username, role),
                                            () -> credentialStore.updateRole(username, Role.ADMIN)));
                    return change.call(
                                    updated -> sessionManagement.invalidateAllUserSessions(username, "role_changed"))
                            .invoke(updated -> audit(caller, "change_role:" + role.value(), username));
                })
                .map(UserSummary::from);
    }

    @Override
    public Uni<UserSummary> activate(Identity caller, String username) {
        return authorize(caller, "activate_user")
                .flatMap(v -> credentialStore.setActive(username, true))
                .invoke(updated -> audit(caller, "activate_user", username))
                .map(UserSummary::from);
    }

    @Override
    public Uni<UserSummary> deactivate(Identity caller, String username) {
        return authorize(caller, "deactivate_user")
                .flatMap(v -> requireUser(username))
                .flatMap(existing -> guardAdminRemoval(caller, existing, "deactivate")
                        .flatMap(v -> retainingAnAdmin(
                                existing,
                                "deactivate",
                                credentialStore.setActive(username, false),
                                () -> credentialStore.setActive(username, true))))
                .call(updated -> sessionManagement.invalidateAllUserSessions(username, "deactivated"))
                .invoke(updated -> audit(caller, "deactivate_user", username))
                .map(UserSummary::from);
    }

    @Override
    public Uni<UserSummary> unlock(Identity caller, String username) {
        return authorize(caller, "unlock_user")
                .flatMap(v -> credentialStore.unlock(username))
                .invoke(updated -> audit(caller, "unlock_user", username))
                .map(UserSummary::from);
    }

    @Override
    public Uni<List<UserSummary>> listUsers(Identity caller) {
        return authorize(caller, "list_users")
                .flatMap(v -> credentialStore.listAll())
                .map(records -> records.stream().map(UserSummary::from).toList());
    }

    @Override
    public Uni<Optional<UserSummary>> getUser(Identity caller, String username) {
        return authorize(caller, "get_user")
                .flatMap(v -> credentialStore.find(username))
                .map(record -> record.map(UserSummary::from));
    }

    @Override
    public Uni<Void> deleteUser(Identity caller, String username) {
        return authorize(caller, "delete_user")
                .flatMap(v -> requireUser(username))
                .flatMap(existing -> guardAdminRemoval(caller, existing, "delete")
                        .flatMap(v -> isActiveAdmin(existing)
                                ? retainingAnAdmin(
                                        existing,
                                        "delete",
                                        credentialStore.setActive(username, false),
                                        () -> credentialStore.setActive(username, true))
                                : Uni.createFrom().item(existing)))
                .flatMap(v -> credentialStore.delete(username))
                .call(v -> sessionManagement.invalidateAllUserSessions(username, "deleted"))
                .invoke(v -> audit(caller, "delete_user", username));
    }

    private Uni<Void> authorize(Identity caller, String operation) {
        return Uni.createFrom().voidItem().invoke(() -> accessControl.require(caller, Capability.ADMIN, operation));
    }

    private Uni<UserRecord> requireUser(String username) {
        return credentialStore
                .find(username)
                .map(record -> record.orElseThrow(() -> new UserNotFoundException(username)));
    }

    /**
     * Refuse to delete, deactivate or demote the caller's own account or the
     * last active administrator.
     */
    private Uni<Void> guardAdminRemoval(Identity caller, UserRecord target, String action) {
        if (caller.username().equals(target.username())) {
            return Uni.createFrom()
                    .failure(new InvalidInputException("Administrators cannot " + action + " their own account"));
        }
        if (!isActiveAdmin(target)) {
            return Uni.createFrom().voidItem();
        }

        return countActiveAdmins()
                .invoke(activeAdmins -> {
                    if (activeAdmins <= 1) {
                        throw lastAdmin(action);
                    }
                })
                .replaceWithVoid();
    }

    /**
     * Apply a change that takes an active administrator away, then count again.
     *
     * <p>The count in {@link #guardAdminRemoval} and the write are not atomic, so
     * two administrators removing each other can both pass it. The change that
     * finds no active administrator left afterwards restores its target and
     * fails. At least one of two racing removals always fails this way, and
     * during the race there may briefly be no active administrator.
     */
    private Uni<UserRecord> retainingAnAdmin(
            UserRecord target, String action, Uni<UserRecord> change, Supplier<Uni<UserRecord>> restore) {
        if (!isActiveAdmin(target)) {
            return change;
        }
        return change.flatMap(changed -> countActiveAdmins().flatMap(remaining -> {
            if (remaining > 0) {
                return Uni.createFrom().item(changed);
            }
            LOG.warnf("Concurrent change left no active administrator; restoring %s", target.username());
            return restore.get().flatMap(restored -> Uni.createFrom().<UserRecord>failure(lastAdmin(action)));
        }));
    }

    private Uni<Long> countActiveAdmins() {
        return credentialStore.listAll().map(records -> records.stream()
                .filter(UserManagementService::isActiveAdmin)
                .count());
    }

    private static boolean isActiveAdmin(UserRecord record) {
        return record.role() == Role.ADMIN && record.active();
    }

    private static InvalidInputException lastAdmin(String action) {
        return new InvalidInputException("Cannot " + action + " the last active administrator");
    }

    private void audit(Identity caller, String action, String target) {
        LOG.debugf("User administration: %s %s by %s", action, target, caller.username());
        AUDIT.infof("USER_ADMIN action=%s target=%s actor=%s", action, target, caller.username());
        securityMonitoring.recordAdministrativeAction(caller.username(), action, target);
    }
}
