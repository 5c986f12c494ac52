package aqualog.core.port.in;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import aqualog.core.model.auth.Identity;
import aqualog.core.model.session.Session;

/**
 * Inbound port for session management operations.
 *
 * <p>Sessions are created after a successful login and identified by a
 * server-issued token that the caller presents on every request.
 */
public interface SessionManagement {

    /**
     * Creates a new session for an authenticated identity.
     *
     * <p>This method generates a unique token with collision detection
     * and retry logic.
     *
     * @param identity the authenticated principal
     * @return The created session
     * @throws SessionCreationException if session creation fails after max retries
     */
    Uni<Session> createSession(Identity identity);

    /**
     * Retrieves a live session and records activity on it.
     *
     * <p>Returns empty if the session doesn't exist or has exceeded the idle
     * timeout. Expired sessions are deleted, not refreshed.
     *
     * @param token Session token
     * @return The touched session, or empty if not found or expired
     */
    Uni<Optional<Session>> touch(String token);

    /**
     * Checks whether a session has exceeded the idle timeout.
     *
     * @param session the session
     * @param now     the current time
     * @return true if the session is expired
     */
    boolean isExpired(Session session, Instant now);

    /**
     * Invalidates a single session.
     *
     * @param token Session token
     * @return Uni completing when the session is invalidated
     */
    Uni<Void> invalidateSession(String token);

    /**
     * Invalidates all sessions for a user.
     *
     * @param username User name
     * @param reason   reason recorded in the security event
     * @return Uni completing when all sessions are invalidated
     */
    Uni<Void> invalidateAllUserSessions(String username, String reason);

    /**
     * Exception thrown when session creation fails.
     */
    class SessionCreationException extends RuntimeException {
        public SessionCreationException(String message) {
            super(message);
        }

        public SessionCreationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
