package dev.memqueue.store;

import dev.memqueue.config.QueueConfig;

import java.util.Objects;

/**
 * Builds the {@link KeyValueStore} selected by {@link QueueConfig#getStoreType()}.
 */
public final class KeyValueStores {

    private KeyValueStores() {
    }

    public static KeyValueStore open(QueueConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        switch (config.getStoreType()) {
            case ROCKSDB:
                return new RocksKeyValueStore(config);
            case REDIS:
                return new RedisKeyValueStore(config.getPrimaryEndpoints());
            case IN_MEMORY:
            default:
                return new InMemoryKeyValueStore();
        }
    }
}
