package aqualog.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import aqualog.mock.MutableClock;
import aqualog.spi.SecurityEvent;

@DisplayName("SecurityMonitor")
@ExtendWith(MockitoExtension.class)
class SecurityMonitorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T09:00:00Z");

    @Mock
    private SecurityEventDispatcher dispatcher;

    private final MutableClock clock = new MutableClock(NOW);

    @Nested
    @DisplayName("when enabled")
    class EnabledTests {

        private SecurityMonitor monitor() {
            when(dispatcher.isEnabled()).thenReturn(true);
            return new SecurityMonitor(dispatcher, clock);
        }

        @Test
        @DisplayName("should dispatch an authentication failure stamped with the clock")
        void shouldDispatchAuthFailure() {
            final var monitor = monitor();

            monitor.recordAuthFailure("mario", "invalid_credentials", 3);

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(dispatcher).dispatch(captor.capture());
            final var event = assertInstanceOf(SecurityEvent.AuthenticationFailure.class, captor.getValue());
            assertEquals(NOW, event.timestamp());
            assertEquals("mario", event.subject());
            assertEquals("invalid_credentials", event.reason());
            assertEquals(3, event.failureCount());
        }

        @Test
        @DisplayName("should attribute denials without a caller to anonymous")
        void shouldUseAnonymousSubject() {
            final var monitor = monitor();

            monitor.recordAccessDenied(null, "ADMIN", "list_users");

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(dispatcher).dispatch(captor.capture());
            assertEquals(SecurityMonitor.ANONYMOUS, captor.getValue().subject());
        }

        @Test
        @DisplayName("should dispatch lockout, session and administrative events")
        void shouldDispatchOtherEvents() {
            final var monitor = monitor();

            monitor.recordLockout("mario", 5, NOW.plusSeconds(900));
            monitor.recordSessionInvalidation("mario", "logout");
            monitor.recordAdministrativeAction("admin", "unlock_user", "mario");

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(dispatcher, times(3)).dispatch(captor.capture());
            final var events = captor.getAllValues();
            assertInstanceOf(SecurityEvent.AuthenticationLockout.class, events.get(0));
            assertInstanceOf(SecurityEvent.SessionInvalidated.class, events.get(1));
            assertInstanceOf(SecurityEvent.UserAdministration.class, events.get(2));
            assertTrue(monitor.isEnabled());
        }
    }

    @Nested
    @DisplayName("when disabled")
    class DisabledTests {

        @Test
        @DisplayName("should not dispatch anything")
        void shouldNotDispatch() {
            when(dispatcher.isEnabled()).thenReturn(false);
            final var monitor = new SecurityMonitor(dispatcher, clock);

            monitor.recordAuthFailure("mario", "invalid_credentials", 1);
            monitor.recordAdministrativeAction("admin", "create_user", "mario");

            assertFalse(monitor.isEnabled());
            verify(dispatcher, never()).dispatch(any());
        }
    }
}
