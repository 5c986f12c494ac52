package aqualog.adapter.out.storage.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;

import aqualog.core.port.out.KeyMaterialRepository;

/**
 * Key material stored as raw bytes in a single file.
 *
 * <p>New key material is written to an owner-only (rw-------) temp file in the
 * same directory and then hard-linked to the final name, so the key file
 * appears complete or not at all. Two processes racing to generate a key
 * cannot overwrite each other.
 */
public class FileKeyMaterialRepository implements KeyMaterialRepository {

    private static final Logger LOG = Logger.getLogger(FileKeyMaterialRepository.class);
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path path;

    public FileKeyMaterialRepository(Path path) {
        this.path = path;
    }

    @Override
    public Optional<byte[]> load() {
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read key file " + path, e);
        }
    }

    @Override
    public boolean persistIfAbsent(byte[] keyMaterial) {
        final Path parent = path.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(parent);
            temp = createOwnerOnlyTempFile(parent);
            Files.write(temp, keyMaterial, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            publish(temp);
            return true;
        } catch (FileAlreadyExistsException e) {
            LOG.debugf("Key file %s already exists, keeping existing key", path);
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write key file " + path, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public String location() {
        return path.toString();
    }

    private Path createOwnerOnlyTempFile(Path directory) throws IOException {
        if (directory.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile(
                    directory, ".encryption-", ".tmp", PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        }
        LOG.warnf("File system does not support POSIX permissions; restrict access to %s manually", path);
        return Files.createTempFile(directory, ".encryption-", ".tmp");
    }

    /**
     * Expose the fully written temp file under the final name. A hard link
     * fails with {@link FileAlreadyExistsException} when the name is taken, so
     * the first writer wins and the file is never seen partially written.
     */
    private void publish(Path temp) throws IOException {
        try {
            Files.createLink(path, temp);
        } catch (UnsupportedOperationException e) {
            LOG.debugf("Hard links not supported for %s, publishing by move", path);
            Files.move(temp, path);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to delete temporary key file %s", temp);
        }
    }
}
