package aqualog.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.core.config.SessionConfig;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.session.Session;
import aqualog.core.port.in.SessionManagement;
import aqualog.core.port.out.SecurityMonitoring;
import aqualog.core.port.out.SessionRepository;

/**
 * Implementation of session management operations.
 *
 * <p>Handles session lifecycle including creation with collision retry,
 * lazy idle-timeout checks, and invalidation. An idle session is deleted the
 * first time it is presented after the timeout and is never refreshed.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final SessionRepository repository;
    private final SessionIdGenerator idGenerator;
    private final SessionConfig config;
    private final SecurityMonitoring securityMonitoring;
    private final Clock clock;

    @Inject
    public SessionService(
            SessionRepository repository,
            SessionIdGenerator idGenerator,
            SessionConfig config,
            SecurityMonitoring securityMonitoring,
            Clock clock) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.config = config;
        this.securityMonitoring = securityMonitoring;
        this.clock = clock;
    }

    @Override
    public Uni<Session> createSession(Identity identity) {
        return createSessionWithRetry(identity, clock.instant(), 0);
    }

    private Uni<Session> createSessionWithRetry(Identity identity, Instant createdAt, int attempt) {
        final int maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session token after " + maxRetries + " attempts"));
        }

        final Session session = Session.open(idGenerator.generate(), identity, createdAt);

        return repository.saveIfAbsent(session).flatMap(saved -> {
            if (saved) {
                LOG.infof("Session created for user %s", identity.username());
                return Uni.createFrom().item(session);
            }

            // Collision detected, retry with new token
            LOG.warnf("Session token collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return createSessionWithRetry(identity, createdAt, attempt + 1);
        });
    }

    @Override
    public Uni<Optional<Session>> touch(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }

        return repository.findByToken(token).flatMap(sessionOpt -> {
            if (sessionOpt.isEmpty()) {
                return Uni.createFrom().item(Optional.<Session>empty());
            }

            final Session session = sessionOpt.get();
            final Instant now = clock.instant();

            if (isExpired(session, now)) {
                LOG.debugf("Session for user %s expired after idle timeout", session.username());
                return repository.delete(token).map(deleted -> {
                    deleted.ifPresent(s -> securityMonitoring.recordSessionInvalidation(s.username(), "idle_timeout"));
                    return Optional.<Session>empty();
                });
            }

            return repository.update(session.withLastActivityAt(now));
        });
    }

    @Override
    public boolean isExpired(Session session, Instant now) {
        return session.isIdle(now, config.idleTimeout());
    }

    @Override
    public Uni<Void> invalidateSession(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().voidItem();
        }

        return repository
                .delete(token)
                .invoke(deleted -> deleted.ifPresent(session -> {
                    LOG.infof("Session invalidated for user %s", session.username());
                    securityMonitoring.recordSessionInvalidation(session.username(), "logout");
                }))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> invalidateAllUserSessions(String username, String reason) {
        return repository
                .deleteByUsername(username)
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Invalidated %d session(s) for user %s: %s", count, username, reason);
                        securityMonitoring.recordSessionInvalidation(username, reason);
                    }
                })
                .replaceWithVoid();
    }
}
