package aqualog.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import aqualog.adapter.out.storage.memory.InMemorySessionRepository;
import aqualog.core.port.out.SessionRepository;

/**
 * CDI producer for the session repository.
 *
 * <p>Sessions are never persisted, so the in-memory store is the only one.
 */
@ApplicationScoped
public class SessionRepositoryProducer {

    @Produces
    @ApplicationScoped
    public SessionRepository sessionRepository() {
        return new InMemorySessionRepository();
    }
}
