package aqualog.core.port.out;

import java.util.Optional;

/**
 * Outbound port for the persisted encryption key blob.
 *
 * <p>I/O failures are reported as {@link java.io.UncheckedIOException}.
 */
public interface KeyMaterialRepository {

    /**
     * Read the persisted key material.
     *
     * @return raw key bytes, or empty if nothing has been persisted
     */
    Optional<byte[]> load();

    /**
     * Persist key material unless some already exists.
     *
     * <p>The write must be create-new: if another process persisted a key
     * first, that key is kept and this method returns false. Stored material
     * must be readable by the owning user only.
     *
     * @param keyMaterial raw key bytes
     * @return true if written, false if key material already existed
     */
    boolean persistIfAbsent(byte[] keyMaterial);

    /**
     * Describe where the key material lives, for log messages.
     *
     * @return location description
     */
    String location();
}
