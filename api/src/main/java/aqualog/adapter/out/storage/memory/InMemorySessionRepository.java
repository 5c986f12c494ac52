package aqualog.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.core.model.session.Session;
import aqualog.core.port.out.SessionRepository;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>Sessions are process-local and are lost on restart. Idle sessions are
 * removed by the service layer the next time they are presented.
 */
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> saveIfAbsent(Session session) {
        return Uni.createFrom().item(() -> {
            final Session existing = sessions.putIfAbsent(session.token(), session);
            if (existing == null) {
                LOG.debugf("Session stored for user %s", session.username());
                return true;
            }
            LOG.debug("Session token collision detected");
            return false;
        });
    }

    @Override
    public Uni<Optional<Session>> findByToken(String token) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(token)));
    }

    @Override
    public Uni<Optional<Session>> update(Session session) {
        // computeIfPresent so a concurrent logout is not undone by a late touch
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(sessions.computeIfPresent(session.token(), (k, v) -> session)));
    }

    @Override
    public Uni<Optional<Session>> delete(String token) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.remove(token)));
    }

    @Override
    public Uni<Integer> deleteByUsername(String username) {
        return Uni.createFrom().item(() -> {
            final AtomicInteger removed = new AtomicInteger();
            sessions.entrySet().removeIf(entry -> {
                if (entry.getValue().username().equals(username)) {
                    removed.incrementAndGet();
                    return true;
                }
                return false;
            });
            LOG.debugf("Deleted %d session(s) for user %s", removed.get(), username);
            return removed.get();
        });
    }

    /**
     * Return the current session count (for testing).
     */
    public int getSessionCount() {
        return sessions.size();
    }
}
