package aqualog.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import aqualog.core.model.session.Session;

/**
 * Outbound port for session storage operations.
 *
 * <p>Expiry is evaluated by the service layer; repositories only store data.
 */
public interface SessionRepository {

    /**
     * Store a new session only if the token does not already exist.
     *
     * @param session Session to store
     * @return true if saved successfully, false if the token already exists
     */
    Uni<Boolean> saveIfAbsent(Session session);

    /**
     * Retrieve a session by token.
     *
     * @param token Session token
     * @return The session, or empty if not found
     */
    Uni<Optional<Session>> findByToken(String token);

    /**
     * Update an existing session (e.g., refresh lastActivityAt).
     *
     * <p>Does nothing if the session has been deleted in the meantime.
     *
     * @param session Session to update
     * @return The updated session, or empty if it no longer exists
     */
    Uni<Optional<Session>> update(Session session);

    /**
     * Delete a session.
     *
     * @param token Session token
     * @return the deleted session, or empty if none existed
     */
    Uni<Optional<Session>> delete(String token);

    /**
     * Delete all sessions for a user.
     *
     * @param username User name
     * @return number of sessions deleted
     */
    Uni<Integer> deleteByUsername(String username);
}
