package aqualog.core.service.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.core.model.auth.AuthError;
import aqualog.core.model.auth.AuthenticationResult;
import aqualog.core.model.auth.AuthenticationResult.Failure;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.UserRecord;
import aqualog.core.model.session.Session;
import aqualog.core.port.in.Authentication;
import aqualog.core.port.in.SessionManagement;
import aqualog.core.port.in.UserManagement.UserNotFoundException;
import aqualog.core.port.out.SecurityMonitoring;
import aqualog.core.service.auth.CredentialStoreService.LoginRefusedException;

/**
 * Verifies usernames and passwords and opens sessions.
 *
 * <p>Each login runs one pass of:
 * <ol>
 *   <li>unknown user: {@link AuthError#INVALID_CREDENTIALS}</li>
 *   <li>deactivated: {@link AuthError#ACCOUNT_DISABLED}</li>
 *   <li>locked: {@link AuthError#ACCOUNT_LOCKED} with the remaining lockout</li>
 *   <li>wrong password: failure counted, {@link AuthError#INVALID_CREDENTIALS}</li>
 *   <li>correct password: counter reset, session opened</li>
 * </ol>
 *
 * <p>Account state is checked again when the successful login is written and
 * once more after the session is stored, so a concurrent lockout or
 * deactivation never leaves a live session behind.
 *
 * <p>Every path derives one password hash, real or dummy, so response time
 * does not reveal which branch was taken.
 */
@ApplicationScoped
public class AuthenticationService implements Authentication {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);
    private static final Logger AUDIT = Logger.getLogger("aqualog.audit.auth");

    private final CredentialStoreService credentialStore;
    private final SessionManagement sessionManagement;
    private final SecurityMonitoring securityMonitoring;
    private final Clock clock;

    @Inject
    public AuthenticationService(
            CredentialStoreService credentialStore,
            SessionManagement sessionManagement,
            SecurityMonitoring securityMonitoring,
            Clock clock) {
        this.credentialStore = credentialStore;
        this.sessionManagement = sessionManagement;
        this.securityMonitoring = securityMonitoring;
        this.clock = clock;
    }

    @Override
    public Uni<AuthenticationResult> login(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            LOG.debug("Login rejected: missing username or password");
            return Uni.createFrom().item(Failure.invalidCredentials());
        }

        return credentialStore.find(username).flatMap(userOpt -> {
            if (userOpt.isEmpty()) {
                credentialStore.dummyVerify(password);
                return Uni.createFrom().item(reject(username, Failure.invalidCredentials(), 0));
            }

            final UserRecord user = userOpt.get();
            final Instant now = clock.instant();

            if (!user.active()) {
                credentialStore.dummyVerify(password);
                return Uni.createFrom().item(reject(username, Failure.disabled(), user.failedAttempts()));
            }

            if (user.isLocked(now)) {
                credentialStore.dummyVerify(password);
                return Uni.createFrom()
                        .item(reject(username, Failure.locked(user.remainingLockout(now)), user.failedAttempts()));
            }

            if (!credentialStore.verifyPassword(user, password)) {
                return credentialStore
                        .recordFailedAttempt(username)
                        .onFailure(UserNotFoundException.class)
                        .recoverWithItem(0)
                        .map(count -> reject(username, Failure.invalidCredentials(), count));
            }

            return acceptLogin(user);
        });
    }

    private Uni<AuthenticationResult> acceptLogin(UserRecord user) {
        final Identity identity = user.toIdentity();
        return credentialStore
                .recordSuccess(user.username())
                .flatMap(v -> sessionManagement.createSession(identity))
                .flatMap(this::confirmStillActive)
                .onFailure(LoginRefusedException.class)
                .recoverWithItem(e -> {
                    final var refused = (LoginRefusedException) e;
                    return reject(user.username(), refused.failure(), refused.failedAttempts());
                })
                .onFailure(UserNotFoundException.class)
                .recoverWithItem(() -> reject(user.username(), Failure.invalidCredentials(), 0));
    }

    /**
     * Re-read the account after the session is stored. Either this read sees a
     * concurrent deactivation, or that deactivation's session sweep sees the
     * new session.
     */
    private Uni<AuthenticationResult> confirmStillActive(Session session) {
        return credentialStore.find(session.username()).flatMap(current -> {
            if (current.isPresent() && current.get().active()) {
                LOG.infof("Login succeeded: %s", session.username());
                AUDIT.infof("LOGIN_SUCCESS user=%s role=%s", session.username(), session.role().value());
                return Uni.createFrom()
                        .item((AuthenticationResult) new AuthenticationResult.Success(session.toIdentity(), session));
            }
            LOG.infof("Login for %s withdrawn: account removed or deactivated during login", session.username());
            final int failures = current.map(UserRecord::failedAttempts).orElse(0);
            final Failure failure = current.isPresent() ? Failure.disabled() : Failure.invalidCredentials();
            return sessionManagement
                    .invalidateSession(session.token())
                    .map(v -> reject(session.username(), failure, failures));
        });
    }

    private AuthenticationResult reject(String username, Failure failure, int failureCount) {
        LOG.debugf("Login rejected: user=%s reason=%s", username, failure.error().code());
        AUDIT.infof("LOGIN_FAILURE user=%s reason=%s failures=%d", username, failure.error().code(), failureCount);
        securityMonitoring.recordAuthFailure(username, failure.error().code(), failureCount);
        return failure;
    }

    @Override
    public Uni<Void> logout(String sessionToken) {
        return sessionManagement.invalidateSession(sessionToken);
    }

    @Override
    public Uni<Optional<Identity>> currentIdentity(String sessionToken) {
        return sessionManagement.touch(sessionToken).map(session -> session.map(Session::toIdentity));
    }
}
