package aqualog.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import aqualog.core.model.auth.UserRecord;
import aqualog.core.port.out.CredentialRepository;

/**
 * In-memory implementation of CredentialRepository.
 *
 * <p>Records are keyed by the case-folded username so that names differing
 * only in case collide on insert. Lookups still require the exact name.
 * Per-key atomicity comes from {@link ConcurrentMap#computeIfPresent}.
 */
public class InMemoryCredentialRepository implements CredentialRepository {

    private final ConcurrentMap<String, UserRecord> records = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> insertIfAbsent(UserRecord record) {
        return Uni.createFrom().item(() -> records.putIfAbsent(fold(record.username()), record) == null);
    }

    @Override
    public Uni<Optional<UserRecord>> findByUsername(String username) {
        return Uni.createFrom().item(() -> Optional.ofNullable(exact(records.get(fold(username)), username)));
    }

    @Override
    public Uni<Optional<UserRecord>> update(String username, UnaryOperator<UserRecord> mutation) {
        return Uni.createFrom().item(() -> {
            final AtomicReference<UserRecord> result = new AtomicReference<>();
            records.computeIfPresent(fold(username), (key, current) -> {
                if (!current.username().equals(username)) {
                    return current;
                }
                final UserRecord updated = mutation.apply(current);
                if (!updated.username().equals(current.username())) {
                    throw new IllegalArgumentException("Username of a stored record cannot change");
                }
                result.set(updated);
                return updated;
            });
            return Optional.ofNullable(result.get());
        });
    }

    @Override
    public Uni<Boolean> delete(String username) {
        return Uni.createFrom().item(() -> {
            final AtomicBoolean deleted = new AtomicBoolean(false);
            records.computeIfPresent(fold(username), (key, current) -> {
                if (!current.username().equals(username)) {
                    return current;
                }
                deleted.set(true);
                return null;
            });
            return deleted.get();
        });
    }

    @Override
    public Uni<List<UserRecord>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(new ArrayList<>(records.values())));
    }

    @Override
    public Uni<Long> count() {
        return Uni.createFrom().item(() -> (long) records.size());
    }

    /**
     * Return the current user count (for health reporting).
     */
    public int getUserCount() {
        return records.size();
    }

    private static String fold(String username) {
        return username.toLowerCase(Locale.ROOT);
    }

    private static UserRecord exact(UserRecord record, String username) {
        return record != null && record.username().equals(username) ? record : null;
    }
}
