package aqualog.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import aqualog.core.config.CredentialStorageConfig;
import aqualog.core.port.out.CredentialRepository;
import aqualog.spi.CredentialStorageProvider;

/**
 * Redis-based credential storage provider.
 *
 * <p>This is the recommended provider for production deployments. User
 * records survive restarts and are shared by every instance.
 *
 * <p>Availability is checked at startup and then follows every repository
 * operation: a timeout or Redis failure marks the store down, a completed
 * operation or a successful connection check marks it up again.
 */
@ApplicationScoped
public class RedisCredentialStorageProvider implements CredentialStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisCredentialStorageProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration CONNECTION_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final ReactiveRedisDataSource redisDataSource;
    private final CredentialStorageConfig config;

    private RedisCredentialRepository repository;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final AtomicBoolean checkInFlight = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisCredentialStorageProvider(ReactiveRedisDataSource redisDataSource, CredentialStorageConfig config) {
        this.redisDataSource = redisDataSource;
        this.config = config;
    }

    @PostConstruct
    void checkAvailability() {
        checkConnection();
    }

    /**
     * Ask Redis for a key, unless a check is already running. The outcome
     * updates {@link #available}.
     */
    void checkConnection() {
        if (!checkInFlight.compareAndSet(false, true)) {
            return;
        }
        redisDataSource
                .key(String.class)
                .exists("aqualog:connection-check")
                .ifNoItem()
                .after(CONNECTION_CHECK_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            checkInFlight.set(false);
                            onReachability(true);
                            checkLatch.countDown();
                        },
                        error -> {
                            checkInFlight.set(false);
                            onReachability(false);
                            checkLatch.countDown();
                            LOG.debugf("Redis connection check failed: %s", error.getMessage());
                        });
    }

    private void onReachability(boolean reachable) {
        final boolean previous = available.getAndSet(reachable);
        if (reachable == previous && checkLatch.getCount() == 0) {
            return;
        }
        if (reachable) {
            LOG.info("Redis credential storage is available");
        } else {
            LOG.warn("Redis credential storage is not available");
        }
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(6, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized CredentialRepository createRepository() {
        if (repository == null) {
            final var redis = config.redis();
            final var timeoutHelper = new RedisTimeoutHelper(redis.timeout(), "credentials", this::onReachability);
            repository = new RedisCredentialRepository(redisDataSource, redis, timeoutHelper);
            LOG.infof("Created Redis credential repository with prefix: %s", redis.keyPrefix());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        // Never blocks on Redis: reports the last known state and re-checks in the background while down
        if (!available.get()) {
            checkConnection();
        }
        if (available.get()) {
            return Optional.of(HealthCheckResponse.named("credential-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", config.redis().keyPrefix())
                    .build());
        }
        return Optional.of(HealthCheckResponse.named("credential-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", "Redis did not answer the last operation or connection check")
                .build());
    }
}
