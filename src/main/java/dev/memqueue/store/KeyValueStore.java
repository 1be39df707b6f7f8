package dev.memqueue.store;

/**
 * The primitive operations a shared cache must offer for queues to be layered on top of it.
 *
 * Each operation is atomic for the single key it touches; nothing spans keys.
 * Implementations:
 * - {@link InMemoryKeyValueStore}: process-local, used for tests and single-JVM setups
 * - {@link RocksKeyValueStore}: embedded, durable
 * - {@link RedisKeyValueStore}: networked, shared between processes
 *
 * Failing to reach the backend is reported as {@link KeyValueStoreException}.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * @return the stored value, or null when the key is absent
     */
    byte[] get(String key);

    /**
     * Unconditionally writes {@code value} under {@code key}.
     */
    void set(String key, byte[] value);

    /**
     * Creates {@code key} only if it does not exist yet.
     *
     * @return false if the key already existed
     */
    boolean add(String key, byte[] value);

    /**
     * Appends {@code suffix} to the existing value of {@code key}.
     *
     * @return false if the key does not exist; nothing is written in that case
     */
    boolean append(String key, byte[] suffix);

    /**
     * @return true if a key was removed
     */
    boolean delete(String key);

    @Override
    default void close() { /* no-op by default */ }
}
