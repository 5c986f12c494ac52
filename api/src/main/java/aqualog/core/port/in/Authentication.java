package aqualog.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import aqualog.core.model.auth.AuthenticationResult;
import aqualog.core.model.auth.Identity;

/**
 * Inbound port for logging in and out.
 */
public interface Authentication {

    /**
     * Verify a username and password and open a session on success.
     *
     * <p>Credential rejections are returned as {@link AuthenticationResult.Failure};
     * the returned {@code Uni} only fails when the store or the encryption key
     * is unavailable.
     *
     * @param username submitted username
     * @param password submitted password
     * @return the login outcome
     */
    Uni<AuthenticationResult> login(String username, String password);

    /**
     * End a session. Unknown or expired tokens are ignored.
     *
     * @param sessionToken token returned by a successful login
     * @return Uni completing when the session is gone
     */
    Uni<Void> logout(String sessionToken);

    /**
     * Resolve the identity behind a session token.
     *
     * <p>An idle-expired session is treated exactly like a missing one.
     *
     * @param sessionToken session token
     * @return the identity, or empty if not authenticated
     */
    Uni<Optional<Identity>> currentIdentity(String sessionToken);
}
