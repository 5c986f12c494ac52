package aqualog.adapter.out.storage.redis;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.transactions.OptimisticLockingTransactionResult;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.core.config.CredentialStorageConfig;
import aqualog.core.model.auth.UserRecord;
import aqualog.core.port.out.CredentialRepository;
import aqualog.spi.StoreUnavailableException;

/**
 * Redis implementation of CredentialRepository.
 *
 * <p>Key layout:
 * <ul>
 *   <li>{@code <prefix>:<username>}: the record as JSON, keyed by the exact username. A
 *   configured prefix that already ends in {@code ':'} is used as is.</li>
 *   <li>{@code <prefix-base>-claim:<lowercase username>}: the exact username owning a case-folded name</li>
 * </ul>
 *
 * <p>Writes run as WATCH/MULTI/EXEC transactions. A transaction discarded
 * because a watched key changed is retried up to
 * {@code aqualog.auth.users.storage.redis.max-transaction-retries} times.
 */
public class RedisCredentialRepository implements CredentialRepository {

    private static final Logger LOG = Logger.getLogger(RedisCredentialRepository.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final String claimPrefix;
    private final int maxTransactionRetries;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisCredentialRepository(
            ReactiveRedisDataSource redisDataSource,
            CredentialStorageConfig.RedisConfig config,
            RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = recordPrefixFor(config.keyPrefix());
        this.claimPrefix = claimPrefixFor(config.keyPrefix());
        this.maxTransactionRetries = config.maxTransactionRetries();
        this.timeoutHelper = timeoutHelper;
    }

    /**
     * Record keys always sit below a {@code ':'} separator. Without it a scan
     * for {@code tenant:users*} would also match {@code tenant:users-claim:*}.
     */
    static String recordPrefixFor(String keyPrefix) {
        return keyPrefix.endsWith(":") ? keyPrefix : keyPrefix + ":";
    }

    static String claimPrefixFor(String keyPrefix) {
        final String base = keyPrefix.endsWith(":") ? keyPrefix.substring(0, keyPrefix.length() - 1) : keyPrefix;
        return base + "-claim:";
    }

    @Override
    public Uni<Boolean> insertIfAbsent(UserRecord record) {
        final String claimKey = claimKeyFor(record.username());
        final String recordKey = recordKeyFor(record.username());
        final String json = serialize(record);

        final Supplier<Uni<OptimisticLockingTransactionResult<String>>> attempt = () -> redisDataSource.withTransaction(
                ds -> ds.value(String.class, String.class).get(claimKey),
                (existingOwner, tx) -> {
                    if (existingOwner != null) {
                        return Uni.createFrom().voidItem();
                    }
                    return tx.value(String.class, String.class)
                            .set(claimKey, record.username())
                            .chain(() -> tx.value(String.class, String.class).set(recordKey, json));
                },
                claimKey);

        final var operation = retryDiscarded(attempt, "insertIfAbsent", 0).map(result -> {
            if (result.getPreTransactionResult() != null) {
                LOG.debugf("Username already claimed: %s", record.username());
                return false;
            }
            LOG.debugf("User record created in Redis: %s", record.username());
            return true;
        });
        return timeoutHelper.withTimeout(operation, "insertIfAbsent");
    }

    @Override
    public Uni<Optional<UserRecord>> findByUsername(String username) {
        final var operation = valueCommands
                .get(recordKeyFor(username))
                .map(json -> json == null ? Optional.<UserRecord>empty() : Optional.of(deserialize(json)));
        return timeoutHelper.withTimeout(operation, "findByUsername");
    }

    @Override
    public Uni<Optional<UserRecord>> update(String username, UnaryOperator<UserRecord> mutation) {
        final String recordKey = recordKeyFor(username);

        final Supplier<Uni<OptimisticLockingTransactionResult<UserRecord>>> attempt =
                () -> redisDataSource.withTransaction(
                        ds -> ds.value(String.class, String.class)
                                .get(recordKey)
                                .map(json -> json == null
                                        ? null
                                        : applyMutation(username, deserialize(json), mutation)),
                        (updated, tx) -> {
                            if (updated == null) {
                                return Uni.createFrom().voidItem();
                            }
                            return tx.value(String.class, String.class).set(recordKey, serialize(updated));
                        },
                        recordKey);

        final var operation = retryDiscarded(attempt, "update", 0)
                .map(result -> Optional.ofNullable(result.getPreTransactionResult()));
        return timeoutHelper
                .withTimeout(operation, "update", MutationRejectedException.class)
                .onFailure(MutationRejectedException.class)
                .transform(Throwable::getCause);
    }

    @Override
    public Uni<Boolean> delete(String username) {
        final String claimKey = claimKeyFor(username);
        final String recordKey = recordKeyFor(username);

        final Supplier<Uni<OptimisticLockingTransactionResult<String>>> attempt = () -> redisDataSource.withTransaction(
                ds -> ds.value(String.class, String.class).get(claimKey),
                (owner, tx) -> {
                    if (!username.equals(owner)) {
                        return Uni.createFrom().voidItem();
                    }
                    return tx.key(String.class).del(recordKey, claimKey);
                },
                claimKey,
                recordKey);

        final var operation = retryDiscarded(attempt, "delete", 0)
                .map(result -> username.equals(result.getPreTransactionResult()))
                .invoke(deleted -> {
                    if (deleted) {
                        LOG.debugf("User record deleted from Redis: %s", username);
                    }
                });
        return timeoutHelper.withTimeout(operation, "delete");
    }

    @Override
    public Uni<List<UserRecord>> findAll() {
        final var operation = scanRecordKeys().flatMap(keys -> {
            if (keys.isEmpty()) {
                return Uni.createFrom().item(List.<UserRecord>of());
            }
            return valueCommands.mget(keys.toArray(new String[0])).map(values -> values.values().stream()
                    .filter(Objects::nonNull)
                    .map(this::deserialize)
                    .toList());
        });
        return timeoutHelper.withTimeout(operation, "findAll");
    }

    @Override
    public Uni<Long> count() {
        final var operation = scanRecordKeys().map(keys -> (long) keys.size());
        return timeoutHelper.withTimeout(operation, "count");
    }

    private Uni<List<String>> scanRecordKeys() {
        final var args = new KeyScanArgs().match(keyPrefix + "*").count(1000);
        return keyCommands.scan(args).toMulti().collect().asList();
    }

    private <T> Uni<OptimisticLockingTransactionResult<T>> retryDiscarded(
            Supplier<Uni<OptimisticLockingTransactionResult<T>>> attempt, String operationName, int retries) {
        return attempt.get().flatMap(result -> {
            if (!result.discarded()) {
                return Uni.createFrom().item(result);
            }
            if (retries >= maxTransactionRetries) {
                return Uni.createFrom()
                        .failure(new StoreUnavailableException(
                                operationName,
                                "Redis transaction kept conflicting after " + maxTransactionRetries + " retries"));
            }
            LOG.debugf(
                    "Redis transaction %s discarded, retrying (%d/%d)",
                    operationName, retries + 1, maxTransactionRetries);
            return retryDiscarded(attempt, operationName, retries + 1);
        });
    }

    private static UserRecord applyMutation(String username, UserRecord current, UnaryOperator<UserRecord> mutation) {
        final UserRecord updated;
        try {
            updated = mutation.apply(current);
        } catch (RuntimeException e) {
            throw new MutationRejectedException(e);
        }
        if (!updated.username().equals(username)) {
            throw new MutationRejectedException(
                    new IllegalArgumentException("Username of a stored record cannot change"));
        }
        return updated;
    }

    private String recordKeyFor(String username) {
        return keyPrefix + username;
    }

    private String claimKeyFor(String username) {
        return claimPrefix + username.toLowerCase(Locale.ROOT);
    }

    private String serialize(UserRecord record) {
        try {
            return OBJECT_MAPPER.writeValueAsString(RedisUserDocument.from(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize user record", e);
        }
    }

    private UserRecord deserialize(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, RedisUserDocument.class).toRecord();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize user record", e);
        }
    }

    /**
     * Carries an exception thrown by an update mutation past the Redis failure
     * mapping so the caller receives it unchanged.
     */
    private static final class MutationRejectedException extends RuntimeException {
        MutationRejectedException(RuntimeException cause) {
            super(cause.getMessage(), cause);
        }
    }
}
