package aqualog.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.inject.Instance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import aqualog.adapter.out.storage.memory.InMemoryCredentialRepository;
import aqualog.adapter.out.storage.memory.InMemoryCredentialStorageProvider;
import aqualog.core.config.CredentialStorageConfig;
import aqualog.spi.CredentialStorageProvider;
import aqualog.spi.StorageProviderException;

@DisplayName("CredentialStorageProviderRegistry")
@ExtendWith(MockitoExtension.class)
class CredentialStorageProviderRegistryTest {

    @Mock
    private Instance<CredentialStorageProvider> providers;

    @Mock
    private CredentialStorageProvider redisProvider;

    private CredentialStorageProviderRegistry registry(String configured, CredentialStorageProvider... available) {
        final List<CredentialStorageProvider> all = List.of(available);
        when(providers.stream()).thenAnswer(invocation -> all.stream());
        return new CredentialStorageProviderRegistry(providers, new StorageConfig(configured));
    }

    @Nested
    @DisplayName("with a configured provider")
    class ConfiguredProviderTests {

        @Test
        @DisplayName("should fail instead of falling back when the configured provider is down")
        void shouldFailWhenConfiguredProviderUnavailable() {
            when(redisProvider.name()).thenReturn("redis");
            when(redisProvider.isAvailable()).thenReturn(false);
            final var registry = registry("redis", redisProvider, new InMemoryCredentialStorageProvider());

            final var error = assertThrows(StorageProviderException.class, registry::getRepository);

            assertTrue(error.getMessage().contains("redis"));
            verify(redisProvider, never()).createRepository();
        }

        @Test
        @DisplayName("should fail when the configured provider is unknown")
        void shouldFailWhenConfiguredProviderUnknown() {
            final var registry = registry("cassandra", new InMemoryCredentialStorageProvider());

            final var error = assertThrows(StorageProviderException.class, registry::getSelectedProvider);

            assertTrue(error.getMessage().contains("cassandra"));
        }

        @Test
        @DisplayName("should use the configured provider even when a higher priority one is available")
        void shouldUseConfiguredProvider() {
            when(redisProvider.name()).thenReturn("redis");
            final var registry = registry("memory", redisProvider, new InMemoryCredentialStorageProvider());

            assertEquals("memory", registry.getSelectedProvider().name());
            assertInstanceOf(InMemoryCredentialRepository.class, registry.getRepository());
        }
    }

    @Nested
    @DisplayName("without a configured provider")
    class PrioritySelectionTests {

        @Test
        @DisplayName("should pick the highest priority available provider")
        void shouldPickHighestPriority() {
            when(redisProvider.isAvailable()).thenReturn(true);
            when(redisProvider.priority()).thenReturn(100);
            final var registry = registry(null, new InMemoryCredentialStorageProvider(), redisProvider);

            assertSame(redisProvider, registry.getSelectedProvider());
        }

        @Test
        @DisplayName("should skip unavailable providers")
        void shouldSkipUnavailableProviders() {
            when(redisProvider.isAvailable()).thenReturn(false);
            final var registry = registry(null, redisProvider, new InMemoryCredentialStorageProvider());

            assertEquals("memory", registry.getSelectedProvider().name());
        }

        @Test
        @DisplayName("should fail when nothing is available")
        void shouldFailWhenNothingAvailable() {
            when(redisProvider.isAvailable()).thenReturn(false);
            final var registry = registry(null, redisProvider);

            assertThrows(StorageProviderException.class, registry::getSelectedProvider);
        }
    }

    private record StorageConfig(String configured) implements CredentialStorageConfig {

        @Override
        public Optional<String> provider() {
            return Optional.ofNullable(configured);
        }

        @Override
        public RedisConfig redis() {
            return new RedisConfig() {
                @Override
                public String keyPrefix() {
                    return "aqualog:user:";
                }

                @Override
                public Duration timeout() {
                    return Duration.ofSeconds(2);
                }

                @Override
                public int maxTransactionRetries() {
                    return 5;
                }
            };
        }
    }
}
