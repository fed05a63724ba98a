package fr.lapetina.ocr.pipeline.infrastructure.storage;

import java.util.List;
import java.util.Optional;

/**
 * Durable key/value blob store.
 *
 * <p>Besides plain get/put/list/delete, implementations provide the two
 * conditional writes the work queue relies on for lease ownership. Both must be
 * atomic with respect to every other writer of the same store, including
 * writers in other processes.
 */
public interface ObjectStore {

    /**
     * Reads an object.
     *
     * @return the object with its current version, or empty if absent
     */
    Optional<StoredObject> get(String key);

    /**
     * Unconditionally writes an object, replacing any previous content.
     */
    void put(String key, byte[] data);

    /**
     * Writes an object only if the key does not exist yet.
     *
     * @return true if this call created the object
     */
    boolean putIfAbsent(String key, byte[] data);

    /**
     * Replaces an object only if its current version equals {@code expectedVersion}.
     *
     * @return true if the object was replaced
     */
    boolean compareAndSet(String key, String expectedVersion, byte[] data);

    /**
     * Lists keys starting with {@code prefix}, in lexicographic order.
     */
    List<String> list(String prefix);

    /**
     * Deletes an object. Deleting a missing key is a no-op.
     */
    void delete(String key);

    default boolean exists(String key) {
        return get(key).isPresent();
    }
}
