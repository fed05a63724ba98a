package fr.lapetina.ocr.pipeline.infrastructure.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem-backed object store.
 *
 * <p>Keys map to relative paths under the root directory. Writes go to a
 * temporary sibling and are moved into place atomically. Conditional writes
 * hold a per-key {@link ReentrantLock} shared by every store in this JVM and an
 * exclusive {@link FileLock} on a lock file under {@code .locks/}, which serialises
 * them against other processes sharing the same directory.
 */
public final class LocalObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(LocalObjectStore.class);

    private static final String LOCK_DIR = ".locks";
    private static final String TEMP_PREFIX = ".tmp-";

    // Keyed by lock file: a JVM may hold only one FileLock per file, whichever store instance asks
    private static final ConcurrentHashMap<Path, KeyLock> KEY_LOCKS = new ConcurrentHashMap<>();

    private final Path root;

    public LocalObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root.resolve(LOCK_DIR));
        } catch (IOException e) {
            throw new ObjectStoreException("Cannot create store root: " + this.root, e);
        }
        log.info("LocalObjectStore initialized: root={}", this.root);
    }

    @Override
    public Optional<StoredObject> get(String key) {
        Path path = resolve(key);
        try {
            return Optional.of(StoredObject.of(key, Files.readAllBytes(path)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to read " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] data) {
        writeAtomically(resolve(key), data);
        log.debug("Object written: key={}, bytes={}", key, data.length);
    }

    @Override
    public boolean putIfAbsent(String key, byte[] data) {
        Path path = resolve(key);
        return withKeyLock(key, () -> {
            if (Files.exists(path)) {
                return false;
            }
            writeAtomically(path, data);
            return true;
        });
    }

    @Override
    public boolean compareAndSet(String key, String expectedVersion, byte[] data) {
        return withKeyLock(key, () -> {
            Optional<StoredObject> current = get(key);
            if (current.isEmpty() || !current.get().version().equals(expectedVersion)) {
                return false;
            }
            writeAtomically(resolve(key), data);
            return true;
        });
    }

    @Override
    public List<String> list(String prefix) {
        int slash = prefix.lastIndexOf('/');
        Path base = slash >= 0 ? root.resolve(prefix.substring(0, slash)).normalize() : root;
        if (!base.startsWith(root) || !Files.isDirectory(base)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(base)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .filter(k -> !k.startsWith(LOCK_DIR + "/"))
                    .filter(k -> !fileName(k).startsWith(TEMP_PREFIX))
                    .filter(k -> k.startsWith(prefix))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to list prefix " + prefix, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to delete " + key, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private <T> T withKeyLock(String key, Supplier<T> action) {
        Path lockFile = root.resolve(LOCK_DIR).resolve(StoredObject.versionOf(key.getBytes(StandardCharsets.UTF_8)));
        KeyLock keyLock = KEY_LOCKS.compute(lockFile, (path, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock();
            held.users++;
            return held;
        });
        keyLock.lock.lock();
        try (FileChannel channel = FileChannel.open(lockFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            return action.get();
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to lock " + key, e);
        } finally {
            keyLock.lock.unlock();
            KEY_LOCKS.computeIfPresent(lockFile, (path, held) -> --held.users == 0 ? null : held);
        }
    }

    private void writeAtomically(Path target, byte[] data) {
        try {
            Files.createDirectories(target.getParent());
            Path temp = target.resolveSibling(TEMP_PREFIX + UUID.randomUUID());
            Files.write(temp, data);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to write " + root.relativize(target), e);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key must not be blank");
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Key escapes store root: " + key);
        }
        return path;
    }

    private static String fileName(String key) {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    @Override
    public String toString() {
        return "LocalObjectStore{root=" + root + '}';
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by KEY_LOCKS.compute
        private int users;
    }
}
