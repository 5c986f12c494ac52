package aqualog.mock;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import aqualog.core.port.out.KeyMaterialRepository;

/**
 * Key material held in memory, for tests that do not need a key file.
 */
public class InMemoryKeyMaterialRepository implements KeyMaterialRepository {

    private final AtomicReference<byte[]> material = new AtomicReference<>();
    private int persistCalls;

    public InMemoryKeyMaterialRepository() {}

    public InMemoryKeyMaterialRepository(byte[] existing) {
        material.set(existing.clone());
    }

    @Override
    public Optional<byte[]> load() {
        final byte[] current = material.get();
        return current == null ? Optional.empty() : Optional.of(current.clone());
    }

    @Override
    public synchronized boolean persistIfAbsent(byte[] keyMaterial) {
        persistCalls++;
        return material.compareAndSet(null, keyMaterial.clone());
    }

    @Override
    public String location() {
        return "memory";
    }

    public synchronized int persistCalls() {
        return persistCalls;
    }
}
