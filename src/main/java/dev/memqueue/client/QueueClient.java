package dev.memqueue.client;

import dev.memqueue.api.MessageQueue;
import dev.memqueue.config.QueueConfig;
import dev.memqueue.core.MemQueue;
import dev.memqueue.ser.Serializer;
import dev.memqueue.store.KeyValueStore;
import dev.memqueue.store.KeyValueStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * QueueClient owns the connection to the backing store and hands out typed queue handles
 * sharing it, using a Register + Get pattern keyed by payload type.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * try (QueueClient client = new QueueClient(new QueueConfig().setStoreType(StoreType.REDIS)
 *         .setPrimaryEndpoints(List.of("cache-1:6379", "cache-2:6379")))) {
 *     client.registerPayload(String.class, new Utf8StringSerializer());
 *     MessageQueue<String> mq = client.getQueue(String.class);
 *     mq.put("orders", "created:42");
 * }
 * }</pre>
 *
 * <p>Every handle sees the same queues; handles differ only in how payloads are decoded.
 */
public class QueueClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(QueueClient.class);

    private final QueueConfig config;
    private final KeyValueStore store;
    private final Clock clock;
    private final Map<Class<?>, PayloadRegistration<?>> registrations = new ConcurrentHashMap<>();
    private final Map<Class<?>, MemQueue<?>> activeQueues = new ConcurrentHashMap<>();

    /**
     * Internal registration tracking payload metadata for type-safe recreation.
     */
    private static class PayloadRegistration<T> {
        final Class<T> type;
        final Serializer<T> serializer;

        PayloadRegistration(Class<T> type, Serializer<T> serializer) {
            this.type = Objects.requireNonNull(type, "type");
            this.serializer = Objects.requireNonNull(serializer, "serializer");
        }
    }

    /**
     * Opens the store selected by {@link QueueConfig#getStoreType()}.
     *
     * @throws UnsupportedOperationException if backup endpoints are configured
     */
    public QueueClient(QueueConfig config) {
        this(config, null, null);
    }

    /**
     * @param store an already opened store to use instead of opening one from the config; it is closed with the client
     * @param clock time source, null for system UTC
     * @throws UnsupportedOperationException if backup endpoints are configured
     */
    public QueueClient(QueueConfig config, KeyValueStore store, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.getBackupEndpoints() != null && !config.getBackupEndpoints().isEmpty()) {
            throw new UnsupportedOperationException(
                    "Mirroring to backup endpoints is not supported: " + config.getBackupEndpoints());
        }
        this.store = (store != null) ? store : KeyValueStores.open(config);
        this.clock = clock;
        logger.info("QueueClient started with {} store (autoDelete: {}, clientLag: {}s)",
                config.getStoreType(), config.isAutoDelete(), config.getClientLagSeconds());
    }

    /**
     * Registers how payloads of {@code type} are serialized.
     * This must be called before {@link #getQueue(Class)}.
     *
     * @throws IllegalStateException if the type is already registered with a different serializer
     */
    public <T> void registerPayload(Class<T> type, Serializer<T> serializer) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(serializer, "serializer cannot be null");

        PayloadRegistration<?> existing = registrations.putIfAbsent(type, new PayloadRegistration<>(type, serializer));
        if (existing != null && !existing.serializer.equals(serializer)) {
            throw new IllegalStateException(
                    String.format("Payload type '%s' already registered with serializer %s, requested %s",
                            type.getName(), existing.serializer.getClass().getName(),
                            serializer.getClass().getName()));
        }
    }

    /**
     * Gets the queue handle for a registered payload type.
     * A handle closed by its user is replaced by a new one.
     *
     * @throws IllegalStateException if the type is not registered
     */
    @SuppressWarnings("unchecked")
    public <T> MessageQueue<T> getQueue(Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");

        PayloadRegistration<T> registration = (PayloadRegistration<T>) registrations.get(type);
        if (registration == null) {
            throw new IllegalStateException(
                    String.format("Payload type '%s' not registered. Call registerPayload() first.", type.getName()));
        }

        return (MessageQueue<T>) activeQueues.compute(type, (t, existing) -> {
            if (existing != null && !existing.isClosed()) {
                return existing;
            }
            return new MemQueue<>(store, registration.type, registration.serializer, config, clock);
        });
    }

    /**
     * Shortcut for {@link #registerPayload} followed by {@link #getQueue(Class)}.
     */
    public <T> MessageQueue<T> getQueue(Class<T> type, Serializer<T> serializer) {
        registerPayload(type, serializer);
        return getQueue(type);
    }

    public boolean isRegistered(Class<?> type) {
        return registrations.containsKey(type);
    }

    public KeyValueStore getStore() {
        return store;
    }

    @Override
    public void close() {
        activeQueues.values().forEach(MemQueue::close);
        activeQueues.clear();
        registrations.clear();
        try {
            store.close();
        } catch (Exception e) {
            logger.warn("Failed to close store: {}", e.getMessage(), e);
        }
        logger.info("QueueClient closed");
    }
}
