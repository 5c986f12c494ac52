package aqualog.adapter.out.storage;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import aqualog.adapter.out.storage.file.FileKeyMaterialRepository;
import aqualog.core.config.EncryptionConfig;
import aqualog.core.port.out.KeyMaterialRepository;

/**
 * CDI producer for the key material repository backed by
 * {@code aqualog.auth.encryption.key-file}.
 */
@ApplicationScoped
public class KeyMaterialRepositoryProducer {

    private final EncryptionConfig config;

    @Inject
    public KeyMaterialRepositoryProducer(EncryptionConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public KeyMaterialRepository keyMaterialRepository() {
        return new FileKeyMaterialRepository(Path.of(config.keyFile()));
    }
}
