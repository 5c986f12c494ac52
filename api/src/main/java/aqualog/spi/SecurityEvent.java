package aqualog.spi;

import java.time.Instant;

/**
 * Sealed interface representing security events raised by the credential engine.
 *
 * <p>Security events are dispatched to registered {@link aqualog.spi.SecurityEventHandler}
 * implementations for alerting, logging, and metrics recording. Events never
 * carry passwords, hashes, salts or key material.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link AuthenticationFailure} - Failed login attempt</li>
 *   <li>{@link AuthenticationLockout} - Account locked after repeated failures</li>
 *   <li>{@link AccessDenied} - Operation refused by the capability gate</li>
 *   <li>{@link SessionInvalidated} - Session ended by logout, expiry or account change</li>
 *   <li>{@link UserAdministration} - Administrative change to an account</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    /**
     * Return the timestamp when this event occurred.
     *
     * @return event timestamp
     */
    Instant timestamp();

    /**
     * Return the username the event concerns.
     *
     * @return username (as submitted for failed logins)
     */
    String subject();

    /**
     * Return the severity level of this event.
     *
     * @return severity level
     */
    Severity severity();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Informational events (e.g., logout). */
        INFO,
        /** Warning events requiring attention (e.g., repeated auth failures). */
        WARNING,
        /** Critical events requiring immediate action. */
        CRITICAL
    }

    /**
     * Authentication failure event.
     *
     * @param timestamp    when the failure occurred
     * @param subject      submitted username
     * @param reason       failure reason code (e.g., "invalid_credentials")
     * @param failureCount the account's failure counter after this attempt (0 for unknown users)
     */
    record AuthenticationFailure(Instant timestamp, String subject, String reason, int failureCount)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return failureCount >= 5 ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Account lockout event.
     *
     * @param timestamp      when the lockout was applied
     * @param subject        locked username
     * @param failedAttempts failure counter that triggered the lockout
     * @param lockedUntil    when the lockout expires
     */
    record AuthenticationLockout(Instant timestamp, String subject, int failedAttempts, Instant lockedUntil)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Access denied event.
     *
     * @param timestamp  when access was denied
     * @param subject    calling username, or "anonymous"
     * @param capability the capability that was required
     * @param operation  the refused operation
     */
    record AccessDenied(Instant timestamp, String subject, String capability, String operation)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Session invalidated event.
     *
     * @param timestamp when the session was invalidated
     * @param subject   session owner
     * @param reason    invalidation reason (e.g., "logout", "idle_timeout", "deactivated")
     */
    record SessionInvalidated(Instant timestamp, String subject, String reason) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Administrative change to an account.
     *
     * @param timestamp when the change was made
     * @param subject   acting administrator
     * @param action    action name (e.g., "create_user", "unlock")
     * @param target    affected username
     */
    record UserAdministration(Instant timestamp, String subject, String action, String target)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }
}
