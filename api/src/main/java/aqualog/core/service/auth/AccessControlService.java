package aqualog.core.service.auth;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import aqualog.core.model.auth.Capability;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.Role;
import aqualog.core.port.in.AccessControl;
import aqualog.core.port.in.UserManagement.AccessDeniedException;
import aqualog.core.port.out.SecurityMonitoring;

/**
 * Maps roles to capabilities and gates operations on them.
 *
 * <ul>
 *   <li>{@link Role#USER}: READ</li>
 *   <li>{@link Role#ADMIN}: READ, WRITE, ADMIN</li>
 * </ul>
 */
@ApplicationScoped
public class AccessControlService implements AccessControl {

    private static final Logger LOG = Logger.getLogger(AccessControlService.class);

    private static final Map<Role, Set<Capability>> ROLE_CAPABILITIES;

    static {
        final Map<Role, Set<Capability>> capabilities = new EnumMap<>(Role.class);
        capabilities.put(Role.USER, Collections.unmodifiableSet(EnumSet.of(Capability.READ)));
        capabilities.put(Role.ADMIN, Collections.unmodifiableSet(EnumSet.allOf(Capability.class)));
        ROLE_CAPABILITIES = Collections.unmodifiableMap(capabilities);
    }

    private final SecurityMonitoring securityMonitoring;

    @Inject
    public AccessControlService(SecurityMonitoring securityMonitoring) {
        this.securityMonitoring = securityMonitoring;
    }

    @Override
    public Set<Capability> capabilities(Role role) {
        if (role == null) {
            return Set.of();
        }
        return ROLE_CAPABILITIES.getOrDefault(role, Set.of());
    }

    @Override
    public boolean isAdmin(Identity identity) {
        return has(identity, Capability.ADMIN);
    }

    @Override
    public boolean canWrite(Identity identity) {
        return has(identity, Capability.WRITE);
    }

    @Override
    public boolean canRead(Identity identity) {
        return has(identity, Capability.READ);
    }

    @Override
    public void require(Identity identity, Capability capability, String operation) {
        if (has(identity, capability)) {
            return;
        }

        final String username = identity != null ? identity.username() : null;
        LOG.debugf("Access denied: user=%s operation=%s requires=%s", username, operation, capability);
        securityMonitoring.recordAccessDenied(username, capability.name(), operation);
        throw new AccessDeniedException(capability, operation);
    }

    private boolean has(Identity identity, Capability capability) {
        return identity != null && capabilities(identity.role()).contains(capability);
    }
}
