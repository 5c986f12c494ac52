package aqualog.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import aqualog.spi.SecurityEvent;
import aqualog.spi.SecurityEventHandler;

/**
 * Security event handler that logs events using JBoss Logging.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
@ApplicationScoped
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("aqualog.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs security events using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        final var message = formatEvent(event);

        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    String formatEvent(SecurityEvent event) {
        if (event instanceof SecurityEvent.AuthenticationFailure e) {
            return String.format(
                    "AUTH_FAILURE: user=%s reason=%s failures=%d", e.subject(), e.reason(), e.failureCount());
        }
        if (event instanceof SecurityEvent.AuthenticationLockout e) {
            return String.format(
                    "AUTH_LOCKOUT: user=%s failures=%d until=%s", e.subject(), e.failedAttempts(), e.lockedUntil());
        }
        if (event instanceof SecurityEvent.AccessDenied e) {
            return String.format(
                    "ACCESS_DENIED: user=%s capability=%s operation=%s", e.subject(), e.capability(), e.operation());
        }
        if (event instanceof SecurityEvent.SessionInvalidated e) {
            return String.format("SESSION_INVALIDATED: user=%s reason=%s", e.subject(), e.reason());
        }
        if (event instanceof SecurityEvent.UserAdministration e) {
            return String.format("USER_ADMIN: actor=%s action=%s target=%s", e.subject(), e.action(), e.target());
        }
        return "SECURITY_EVENT: " + event.getClass().getSimpleName() + " user=" + event.subject();
    }
}
