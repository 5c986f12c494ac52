package aqualog.core.port.out;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import aqualog.core.model.auth.UserRecord;

/**
 * Outbound port for user record persistence.
 *
 * <p>Implementations may store records in Redis, in memory, or custom backends
 * via the {@link aqualog.spi.CredentialStorageProvider} SPI. Storage failures
 * surface as {@link aqualog.spi.StoreUnavailableException}.
 */
public interface CredentialRepository {

    /**
     * Store a new record only if no record with the same username exists.
     *
     * <p>Uniqueness is checked case-insensitively so that two accounts cannot
     * differ only in letter case. Lookups remain exact.
     *
     * <p>Implementation notes:
     * <ul>
     *   <li>Redis: claim a case-folded key with SETNX semantics inside a transaction</li>
     *   <li>In-Memory: use ConcurrentHashMap.putIfAbsent() on the folded name</li>
     * </ul>
     *
     * @param record record to store
     * @return true if stored, false if the username is taken
     */
    Uni<Boolean> insertIfAbsent(UserRecord record);

    /**
     * Retrieve a record by exact, case-sensitive username.
     *
     * @param username username
     * @return the record, or empty if not found
     */
    Uni<Optional<UserRecord>> findByUsername(String username);

    /**
     * Atomically replace a record with the result of {@code mutation}.
     *
     * <p>Either the whole new record is stored or nothing changes. Concurrent
     * updates to the same record are serialized, so no update is lost. The
     * mutation may be invoked more than once when an optimistic write has to be
     * retried, so it must be free of side effects. If it throws, nothing is
     * written and the exception fails the returned {@code Uni}.
     *
     * @param username exact username of the record to update
     * @param mutation function from the current record to its replacement
     * @return the stored record, or empty if no record exists
     */
    Uni<Optional<UserRecord>> update(String username, UnaryOperator<UserRecord> mutation);

    /**
     * Delete a record.
     *
     * @param username exact username
     * @return true if a record was deleted
     */
    Uni<Boolean> delete(String username);

    /**
     * Retrieve all records in no particular order.
     *
     * @return all records
     */
    Uni<List<UserRecord>> findAll();

    /**
     * Count stored records.
     *
     * @return record count
     */
    Uni<Long> count();
}
