package aqualog.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Consumer;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.spi.StoreUnavailableException;

/**
 * Helper for applying timeouts and failure mapping to Redis operations.
 *
 * <p>Credential storage is fail-fast: a timeout or a Redis failure surfaces as
 * {@link StoreUnavailableException} and is never retried or degraded here.
 * Exceptions of the types passed as {@code passThrough} are left unchanged so
 * that domain failures raised inside a repository keep their type.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final String repositoryName;
    private final Consumer<Boolean> reachability;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param repositoryName the repository name for log messages
     */
    public RedisTimeoutHelper(Duration timeout, String repositoryName) {
        this(timeout, repositoryName, reachable -> {});
    }

    /**
     * Create a timeout helper that reports whether Redis answered each operation.
     *
     * @param timeout the timeout duration for Redis operations
     * @param repositoryName the repository name for log messages
     * @param reachability receives true when an operation completes and false on
     *                     a timeout or Redis failure
     */
    public RedisTimeoutHelper(Duration timeout, String repositoryName, Consumer<Boolean> reachability) {
        this.timeout = timeout;
        this.repositoryName = repositoryName;
        this.reachability = reachability;
    }

    /**
     * Apply the timeout to an operation and map failures to {@link StoreUnavailableException}.
     *
     * @param operation the Redis operation
     * @param operationName name for logging
     * @param passThrough failure types to propagate unchanged
     * @param <T> the result type
     * @return a Uni that fails with StoreUnavailableException on timeout or Redis failure
     */
    @SafeVarargs
    public final <T> Uni<T> withTimeout(
            Uni<T> operation, String operationName, Class<? extends Throwable>... passThrough) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    reachability.accept(false);
                    return new StoreUnavailableException(
                            operationName, "Redis operation timed out: " + operationName + " in " + repositoryName);
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException) && !isPassThrough(error, passThrough))
                .transform(error -> {
                    LOG.warnv(
                            "Redis operation failure: {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    reachability.accept(false);
                    return new StoreUnavailableException(
                            operationName, "Redis operation failed: " + operationName + " in " + repositoryName, error);
                })
                .invoke(() -> reachability.accept(true));
    }

    private static boolean isPassThrough(Throwable error, Class<? extends Throwable>[] passThrough) {
        for (Class<? extends Throwable> type : passThrough) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /** Returns the configured timeout. */
    public Duration getTimeout() {
        return timeout;
    }
}
