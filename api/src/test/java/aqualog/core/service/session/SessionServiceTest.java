package aqualog.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import aqualog.adapter.out.storage.memory.InMemorySessionRepository;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.Role;
import aqualog.core.port.in.SessionManagement.SessionCreationException;
import aqualog.mock.MutableClock;
import aqualog.mock.RecordingSecurityMonitoring;
import aqualog.mock.TestConfigs.TestSessionConfig;

@DisplayName("SessionService")
class SessionServiceTest {

    private static final Identity MARIO = new Identity("mario", Role.USER, "Mario");

    private MutableClock clock;
    private RecordingSecurityMonitoring monitoring;
    private InMemorySessionRepository repository;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T09:00:00Z");
        monitoring = new RecordingSecurityMonitoring();
        repository = new InMemorySessionRepository();
        sessionService = new SessionService(
                repository,
                new SessionIdGenerator(),
                new TestSessionConfig(Duration.ofMinutes(60), 3),
                monitoring,
                clock);
    }

    @Nested
    @DisplayName("createSession")
    class CreateSessionTests {

        @Test
        @DisplayName("should create a session carrying the identity")
        void shouldCreateSession() {
            final var session = sessionService.createSession(MARIO).await().indefinitely();

            assertEquals("mario", session.username());
            assertEquals(Role.USER, session.role());
            assertEquals("Mario", session.displayName());
            assertEquals(clock.instant(), session.createdAt());
            assertEquals(clock.instant(), session.lastActivityAt());
            assertEquals(43, session.token().length());
            assertEquals(1, repository.getSessionCount());
        }

        @Test
        @DisplayName("should generate unique tokens")
        void shouldGenerateUniqueTokens() {
            final var first = sessionService.createSession(MARIO).await().indefinitely();
            final var second = sessionService.createSession(MARIO).await().indefinitely();

            assertNotEquals(first.token(), second.token());
        }

        @Test
        @DisplayName("should retry on token collision and give up after the configured attempts")
        void shouldRetryOnCollision() {
            final Deque<String> tokens = new ArrayDeque<>(List.of("taken", "taken", "fresh"));
            final SessionIdGenerator scripted = new SessionIdGenerator() {
                @Override
                public String generate() {
                    return tokens.isEmpty() ? "taken" : tokens.poll();
                }
            };
            final var service = new SessionService(
                    repository, scripted, new TestSessionConfig(Duration.ofMinutes(60), 3), monitoring, clock);

            final var first = service.createSession(MARIO).await().indefinitely();
            assertEquals("taken", first.token());

            final var second = service.createSession(MARIO).await().indefinitely();
            assertEquals("fresh", second.token());

            assertThrows(SessionCreationException.class, () -> service.createSession(MARIO)
                    .await()
                    .indefinitely());
        }
    }

    @Nested
    @DisplayName("touch")
    class TouchTests {

        @Test
        @DisplayName("should refresh lastActivityAt while the session is live")
        void shouldRefreshLiveSession() {
            final var session = sessionService.createSession(MARIO).await().indefinitely();
            clock.advance(Duration.ofMinutes(59));

            final var touched = sessionService.touch(session.token()).await().indefinitely();

            assertTrue(touched.isPresent());
            assertEquals(clock.instant(), touched.get().lastActivityAt());

            clock.advance(Duration.ofMinutes(59));
            assertTrue(sessionService.touch(session.token()).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should delete an idle session without refreshing it")
        void shouldExpireIdleSession() {
            final var session = sessionService.createSession(MARIO).await().indefinitely();
            clock.advance(Duration.ofMinutes(61));

            assertTrue(sessionService.touch(session.token()).await().indefinitely().isEmpty());
            assertEquals(0, repository.getSessionCount());
            assertTrue(monitoring.contains("session_invalidated:mario:idle_timeout"));

            clock.set(session.createdAt());
            assertTrue(sessionService.touch(session.token()).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should treat exactly the idle timeout as still live")
        void shouldKeepSessionAtBoundary() {
            final var session = sessionService.createSession(MARIO).await().indefinitely();
            clock.advance(Duration.ofMinutes(60));

            assertFalse(sessionService.isExpired(session, clock.instant()));
            clock.advance(Duration.ofSeconds(1));
            assertTrue(sessionService.isExpired(session, clock.instant()));
        }

        @Test
        @DisplayName("should return empty for unknown or blank tokens")
        void shouldIgnoreUnknownTokens() {
            assertTrue(sessionService.touch("nope").await().indefinitely().isEmpty());
            assertTrue(sessionService.touch("").await().indefinitely().isEmpty());
            assertTrue(sessionService.touch(null).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("invalidation")
    class InvalidationTests {

        @Test
        @DisplayName("invalidateSession should remove only that session")
        void shouldInvalidateOne() {
            final var first = sessionService.createSession(MARIO).await().indefinitely();
            final var second = sessionService.createSession(MARIO).await().indefinitely();

            sessionService.invalidateSession(first.token()).await().indefinitely();

            assertTrue(sessionService.touch(first.token()).await().indefinitely().isEmpty());
            assertTrue(sessionService.touch(second.token()).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("invalidateAllUserSessions should remove every session of that user only")
        void shouldInvalidateAllForUser() {
            final var luigi = new Identity("luigi", Role.USER, null);
            sessionService.createSession(MARIO).await().indefinitely();
            sessionService.createSession(MARIO).await().indefinitely();
            final var other = sessionService.createSession(luigi).await().indefinitely();

            sessionService.invalidateAllUserSessions("mario", "deactivated").await().indefinitely();

            assertEquals(1, repository.getSessionCount());
            assertTrue(sessionService.touch(other.token()).await().indefinitely().isPresent());
            assertTrue(monitoring.contains("session_invalidated:mario:deactivated"));
        }

        @Test
        @DisplayName("invalidating an unknown token should be a no-op")
        void shouldIgnoreUnknownInvalidation() {
            sessionService.invalidateSession("nope").await().indefinitely();
            sessionService.invalidateAllUserSessions("ghost", "deleted").await().indefinitely();

            assertTrue(monitoring.events().isEmpty());
        }
    }
}
