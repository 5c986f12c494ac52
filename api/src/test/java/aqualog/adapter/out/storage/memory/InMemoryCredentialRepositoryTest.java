package aqualog.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import aqualog.core.model.auth.Role;
import aqualog.core.model.auth.UserRecord;

@DisplayName("InMemoryCredentialRepository")
class InMemoryCredentialRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T09:00:00Z");

    private InMemoryCredentialRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCredentialRepository();
    }

    private UserRecord record(String username) {
        return UserRecord.builder(username)
                .passwordHash("ciphertext")
                .salt("00ff")
                .role(Role.USER)
                .createdAt(NOW)
                .build();
    }

    @Nested
    @DisplayName("insertIfAbsent")
    class InsertTests {

        @Test
        @DisplayName("should insert a new record")
        void shouldInsert() {
            assertTrue(repository.insertIfAbsent(record("mario")).await().indefinitely());
            assertEquals(1L, repository.count().await().indefinitely());
        }

        @Test
        @DisplayName("should reject a username that differs only in case")
        void shouldRejectCaseVariant() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();

            assertFalse(repository.insertIfAbsent(record("Mario")).await().indefinitely());
            assertFalse(repository.insertIfAbsent(record("mario")).await().indefinitely());
            assertEquals(1, repository.getUserCount());
        }
    }

    @Nested
    @DisplayName("findByUsername")
    class FindTests {

        @Test
        @DisplayName("should require the exact username")
        void shouldMatchExactly() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();

            assertTrue(repository.findByUsername("mario").await().indefinitely().isPresent());
            assertTrue(repository.findByUsername("MARIO").await().indefinitely().isEmpty());
            assertTrue(repository.findByUsername("luigi").await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("update")
    class UpdateTests {

        @Test
        @DisplayName("should store the mutated record")
        void shouldApplyMutation() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();

            final var updated = repository.update("mario", r -> r.withRole(Role.ADMIN, NOW.plusSeconds(1)))
                    .await()
                    .indefinitely();

            assertEquals(Role.ADMIN, updated.orElseThrow().role());
            assertEquals(Role.ADMIN, repository.findByUsername("mario").await().indefinitely().get().role());
        }

        @Test
        @DisplayName("should return empty for a missing or case-mismatched username")
        void shouldReturnEmptyForMissing() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();

            assertTrue(repository.update("luigi", r -> r).await().indefinitely().isEmpty());
            assertTrue(repository.update("Mario", r -> r).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should leave the record unchanged when the mutation throws")
        void shouldNotWriteOnFailure() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();

            assertThrows(IllegalStateException.class, () -> repository.update("mario", r -> {
                        throw new IllegalStateException("rejected");
                    })
                    .await()
                    .indefinitely());

            assertEquals(Role.USER, repository.findByUsername("mario").await().indefinitely().get().role());
        }

        @Test
        @DisplayName("should refuse to change the username")
        void shouldRejectRename() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();

            assertThrows(IllegalArgumentException.class, () -> repository.update("mario", r -> record("luigi"))
                    .await()
                    .indefinitely());
        }

        @Test
        @DisplayName("should not lose concurrent increments")
        void shouldSerializeConcurrentUpdates() throws Exception {
            repository.insertIfAbsent(record("mario")).await().indefinitely();
            final int threads = 8;
            final int perThread = 50;
            final ExecutorService executor = Executors.newFixedThreadPool(threads);
            final CountDownLatch start = new CountDownLatch(1);
            final List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            repository.update("mario", r -> r.withFailedAttempts(r.failedAttempts() + 1, null, NOW))
                                    .await()
                                    .indefinitely();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            final var stored = repository.findByUsername("mario").await().indefinitely().orElseThrow();
            assertEquals(threads * perThread, stored.failedAttempts());
        }
    }

    @Nested
    @DisplayName("delete")
    class DeleteTests {

        @Test
        @DisplayName("should delete only on exact match and free the name")
        void shouldDeleteExactMatch() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();

            assertFalse(repository.delete("Mario").await().indefinitely());
            assertTrue(repository.delete("mario").await().indefinitely());
            assertFalse(repository.delete("mario").await().indefinitely());
            assertTrue(repository.insertIfAbsent(record("Mario")).await().indefinitely());
        }

        @Test
        @DisplayName("findAll should list every record")
        void shouldListAll() {
            repository.insertIfAbsent(record("mario")).await().indefinitely();
            repository.insertIfAbsent(record("luigi")).await().indefinitely();

            assertEquals(2, repository.findAll().await().indefinitely().size());
        }
    }
}
