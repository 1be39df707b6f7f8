package dev.memqueue.config;

/**
 * Backend used to hold queue data.
 */
public enum StoreType {
    /** Process-local map; nothing is shared between JVMs. */
    IN_MEMORY,
    /** Embedded RocksDB database under {@link QueueConfig#getBasePath()}. */
    ROCKSDB,
    /** Shared Redis cache reached through {@link QueueConfig#getPrimaryEndpoints()}. */
    REDIS
}
