package aqualog.adapter.out.telemetry;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import aqualog.core.port.out.SecurityMonitoring;
import aqualog.spi.SecurityEvent;

/**
 * Turns credential engine outcomes into {@link SecurityEvent}s.
 *
 * <p>Each {@code record*} call builds one event and hands it to the
 * {@link SecurityEventDispatcher}. Nothing is recorded while security
 * monitoring is disabled.
 */
@ApplicationScoped
public class SecurityMonitor implements SecurityMonitoring {

    static final String ANONYMOUS = "anonymous";

    private final SecurityEventDispatcher dispatcher;
    private final Clock clock;
    private final boolean enabled;

    @Inject
    public SecurityMonitor(SecurityEventDispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.enabled = dispatcher.isEnabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthFailure(String username, String reason, int failureCount) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(new SecurityEvent.AuthenticationFailure(now(), subject(username), reason, failureCount));
    }

    @Override
    public void recordLockout(String username, int failedAttempts, Instant lockedUntil) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(
                new SecurityEvent.AuthenticationLockout(now(), subject(username), failedAttempts, lockedUntil));
    }

    @Override
    public void recordAccessDenied(String username, String capability, String operation) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(new SecurityEvent.AccessDenied(now(), subject(username), capability, operation));
    }

    @Override
    public void recordSessionInvalidation(String username, String reason) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(new SecurityEvent.SessionInvalidated(now(), subject(username), reason));
    }

    @Override
    public void recordAdministrativeAction(String actor, String action, String target) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(new SecurityEvent.UserAdministration(now(), subject(actor), action, target));
    }

    private Instant now() {
        return clock.instant();
    }

    private static String subject(String username) {
        return username == null || username.isBlank() ? ANONYMOUS : username;
    }
}
