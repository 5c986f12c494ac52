package aqualog.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.quarkus.redis.runtime.datasource.ReactiveRedisDataSourceImpl;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.redis.client.RedisOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import aqualog.core.config.CredentialStorageConfig;
import aqualog.core.model.auth.Role;
import aqualog.core.model.auth.UserRecord;

/**
 * Runs the Redis credential repository against a real Redis instance via
 * testcontainers, covering the WATCH/MULTI/EXEC paths and the key layout.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Redis Credential Repository Integration")
class RedisCredentialRepositoryIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-01-01T09:00:00Z");

    @Container
    static GenericContainer<?> redis =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static Vertx vertx;
    private static Redis redisClient;
    private static ReactiveRedisDataSourceImpl dataSource;

    private RedisCredentialRepository repository;

    @BeforeAll
    static void setUpClass() {
        vertx = Vertx.vertx();
        var redisOptions =
                new RedisOptions().setConnectionString("redis://" + redis.getHost() + ":" + redis.getMappedPort(6379));
        redisClient = Redis.createClient(vertx, redisOptions);
        dataSource = new ReactiveRedisDataSourceImpl(vertx, redisClient, RedisAPI.api(redisClient));
    }

    @AfterAll
    static void tearDownClass() {
        if (redisClient != null) {
            redisClient.close();
        }
        if (vertx != null) {
            vertx.closeAndAwait();
        }
    }

    @BeforeEach
    void setUp() {
        RedisAPI.api(redisClient).flushall(List.of()).await().atMost(Duration.ofSeconds(5));
        repository = repositoryWithPrefix("tenant:users");
    }

    private static RedisCredentialRepository repositoryWithPrefix(String prefix) {
        return new RedisCredentialRepository(
                dataSource, new TestRedisConfig(prefix), new RedisTimeoutHelper(Duration.ofSeconds(5), "credentials"));
    }

    private static UserRecord record(String username) {
        return UserRecord.builder(username)
                .passwordHash("ciphertext")
                .salt("00ff")
                .role(Role.USER)
                .createdAt(NOW)
                .build();
    }

    private static <T> T await(Uni<T> uni) {
        return uni.await().atMost(Duration.ofSeconds(10));
    }

    @Nested
    @DisplayName("insertIfAbsent")
    class InsertTests {

        @Test
        @DisplayName("should store a record that can be read back exactly")
        void shouldInsertAndFind() {
            assertTrue(await(repository.insertIfAbsent(record("mario"))));

            final var found = await(repository.findByUsername("mario")).orElseThrow();
            assertEquals("mario", found.username());
            assertEquals(Role.USER, found.role());
            assertTrue(await(repository.findByUsername("Mario")).isEmpty());
        }

        @Test
        @DisplayName("should reject a username that differs only in case")
        void shouldRejectCaseVariant() {
            await(repository.insertIfAbsent(record("mario")));

            assertFalse(await(repository.insertIfAbsent(record("Mario"))));
            assertFalse(await(repository.insertIfAbsent(record("mario"))));
            assertEquals(1L, await(repository.count()));
        }
    }

    @Nested
    @DisplayName("findAll and count")
    class ListingTests {

        @Test
        @DisplayName("should list records only, not case claims, for a prefix without a trailing colon")
        void shouldIgnoreClaimKeys() {
            await(repository.insertIfAbsent(record("mario")));
            await(repository.insertIfAbsent(record("luigi")));

            assertEquals(2L, await(repository.count()));
            final var usernames = await(repository.findAll()).stream()
                    .map(UserRecord::username)
                    .sorted()
                    .toList();
            assertEquals(List.of("luigi", "mario"), usernames);
        }

        @Test
        @DisplayName("should list records for the default prefix")
        void shouldListWithDefaultPrefix() {
            final var defaultRepository = repositoryWithPrefix("aqualog:user:");
            await(defaultRepository.insertIfAbsent(record("peach")));

            assertEquals(1L, await(defaultRepository.count()));
            assertEquals("peach", await(defaultRepository.findAll()).get(0).username());
        }
    }

    @Nested
    @DisplayName("update")
    class UpdateTests {

        @Test
        @DisplayName("should store the mutated record")
        void shouldApplyMutation() {
            await(repository.insertIfAbsent(record("mario")));

            final var updated = await(repository.update("mario", r -> r.withFailedAttempts(3, null, NOW)));

            assertEquals(3, updated.orElseThrow().failedAttempts());
            assertEquals(3, await(repository.findByUsername("mario")).orElseThrow().failedAttempts());
        }

        @Test
        @DisplayName("should return empty for a missing record")
        void shouldReturnEmptyWhenMissing() {
            assertTrue(await(repository.update("ghost", r -> r.withActive(false, NOW))).isEmpty());
        }

        @Test
        @DisplayName("should propagate a mutation failure unchanged and write nothing")
        void shouldPassThroughMutationFailure() {
            await(repository.insertIfAbsent(record("mario")));
            final var refusal = new IllegalStateException("refused");

            final var thrown = assertThrows(IllegalStateException.class, () -> await(repository.update("mario", r -> {
                throw refusal;
            })));

            assertSame(refusal, thrown);
            assertTrue(await(repository.findByUsername("mario")).orElseThrow().active());
        }

        @Test
        @DisplayName("should not lose increments from concurrent writers")
        void shouldSerializeConcurrentUpdates() throws Exception {
            await(repository.insertIfAbsent(record("mario")));
            final int writers = 8;
            final var start = new CountDownLatch(1);
            final ExecutorService executor = Executors.newFixedThreadPool(writers);
            try {
                final List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return await(repository.update(
                                "mario", r -> r.withFailedAttempts(r.failedAttempts() + 1, null, NOW)));
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(writers, await(repository.findByUsername("mario")).orElseThrow().failedAttempts());
        }
    }

    @Nested
    @DisplayName("delete")
    class DeleteTests {

        @Test
        @DisplayName("should remove the record and release the case-folded name")
        void shouldReleaseClaim() {
            await(repository.insertIfAbsent(record("mario")));

            assertTrue(await(repository.delete("mario")));

            assertTrue(await(repository.findByUsername("mario")).isEmpty());
            assertTrue(await(repository.insertIfAbsent(record("Mario"))));
        }

        @Test
        @DisplayName("should not delete through a case variant")
        void shouldRequireExactName() {
            await(repository.insertIfAbsent(record("mario")));

            assertFalse(await(repository.delete("MARIO")));
            assertEquals(1L, await(repository.count()));
        }
    }

    private record TestRedisConfig(String keyPrefix) implements CredentialStorageConfig.RedisConfig {

        @Override
        public Duration timeout() {
            return Duration.ofSeconds(5);
        }

        @Override
        public int maxTransactionRetries() {
            return 50;
        }
    }
}
