package aqualog.core.model.session;

import java.time.Duration;
import java.time.Instant;

import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.Role;

/**
 * Represents an authenticated session.
 *
 * <p>Sessions are created on successful login and held server-side. The caller
 * presents the token on every request; nothing about the session is persisted
 * to the credential store.
 *
 * @param token          server-issued session token (cryptographically secure)
 * @param username       authenticated user
 * @param role           role at login time
 * @param displayName    display name at login time
 * @param createdAt      session creation timestamp
 * @param lastActivityAt last activity timestamp (for idle timeout)
 */
public record Session(
        String token, String username, Role role, String displayName, Instant createdAt, Instant lastActivityAt) {

    public Session {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Session token cannot be null or blank");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created timestamp cannot be null");
        }
        if (lastActivityAt == null) {
            lastActivityAt = createdAt;
        }
    }

    /**
     * Open a session for an identity.
     */
    public static Session open(String token, Identity identity, Instant now) {
        return new Session(token, identity.username(), identity.role(), identity.displayName(), now, now);
    }

    /**
     * Creates a new session with updated lastActivityAt timestamp.
     */
    public Session withLastActivityAt(Instant lastActivityAt) {
        return new Session(token, username, role, displayName, createdAt, lastActivityAt);
    }

    /**
     * Checks if the session has exceeded the idle timeout.
     *
     * @param now         current time
     * @param idleTimeout maximum duration of inactivity
     * @return true when more than {@code idleTimeout} has passed since the last activity
     */
    public boolean isIdle(Instant now, Duration idleTimeout) {
        return Duration.between(lastActivityAt, now).compareTo(idleTimeout) > 0;
    }

    public Identity toIdentity() {
        return new Identity(username, role, displayName);
    }

    @Override
    public String toString() {
        return "Session[username=" + username + ", role=" + role + ", createdAt=" + createdAt + ", lastActivityAt="
                + lastActivityAt + "]";
    }
}
