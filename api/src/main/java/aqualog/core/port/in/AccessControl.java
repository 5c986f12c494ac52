package aqualog.core.port.in;

import java.util.Set;

import aqualog.core.model.auth.Capability;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.Role;

/**
 * Inbound port for capability queries.
 *
 * <p>Policy is role to capability only. There are no per-operation allow-lists:
 * every mutating entry point calls {@link #require} with the capability it needs.
 */
public interface AccessControl {

    /**
     * Capabilities granted to a role.
     *
     * @param role the role (null grants nothing)
     * @return immutable capability set
     */
    Set<Capability> capabilities(Role role);

    boolean isAdmin(Identity identity);

    boolean canWrite(Identity identity);

    boolean canRead(Identity identity);

    /**
     * Gate an operation on a capability.
     *
     * @param identity   the caller (null is treated as unauthenticated)
     * @param capability the capability the operation needs
     * @param operation  operation name for auditing
     * @throws UserManagement.AccessDeniedException if the caller lacks the capability
     */
    void require(Identity identity, Capability capability, String operation);
}
