package aqualog.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import aqualog.spi.SecurityEvent;
import aqualog.spi.SecurityEventHandler;

/**
 * Security event handler that records events as Micrometer metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code aqualog.security.events.total} - Total events by type and severity</li>
 *   <li>{@code aqualog.security.auth.failures} - Login failures by reason</li>
 *   <li>{@code aqualog.security.auth.lockouts} - Account lockouts</li>
 *   <li>{@code aqualog.security.access.denied} - Capability denials by operation</li>
 *   <li>{@code aqualog.security.session.invalidated} - Session invalidations by reason</li>
 *   <li>{@code aqualog.security.user.admin} - Administrative actions by action</li>
 * </ul>
 *
 * <p>Usernames are never used as tags.
 */
@ApplicationScoped
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private final MeterRegistry registry;

    @Inject
    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records security events as Micrometer metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void handle(SecurityEvent event) {
        Counter.builder("aqualog.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.AuthenticationFailure e) {
            increment("aqualog.security.auth.failures", "Login failures", "reason", e.reason());
        } else if (event instanceof SecurityEvent.AuthenticationLockout) {
            Counter.builder("aqualog.security.auth.lockouts")
                    .description("Account lockouts after repeated failures")
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.AccessDenied e) {
            increment("aqualog.security.access.denied", "Capability denials", "operation", e.operation());
        } else if (event instanceof SecurityEvent.SessionInvalidated e) {
            increment("aqualog.security.session.invalidated", "Session invalidations", "reason", e.reason());
        } else if (event instanceof SecurityEvent.UserAdministration e) {
            increment("aqualog.security.user.admin", "Administrative account changes", "action", e.action());
        }
    }

    private void increment(String name, String description, String tagKey, String tagValue) {
        Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue != null ? tagValue : "unknown")
                .register(registry)
                .increment();
    }
}
