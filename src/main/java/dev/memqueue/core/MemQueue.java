package dev.memqueue.core;

import dev.memqueue.api.MessageQueue;
import dev.memqueue.config.QueueConfig;
import dev.memqueue.ser.Serializer;
import dev.memqueue.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link MessageQueue} over a {@link KeyValueStore}, composing the bucket index, writer, reader,
 * client cursor and sequential consumer.
 *
 * <p>The handle holds no queue state of its own; everything lives in the store, so any number of
 * handles in any number of processes can work on the same queues concurrently. The store is not
 * owned: closing the handle only stops further use of it.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * KeyValueStore store = new InMemoryKeyValueStore();
 * try (MemQueue<String> mq = new MemQueue<>(store, String.class, new Utf8StringSerializer(), new QueueConfig())) {
 *     String client = mq.createClientId();
 *     mq.put("events", "hello");
 *     String next = mq.nextMessage("events", client); // "hello"
 *     mq.nextMessage("events", client);               // null, caught up
 * }
 * }</pre>
 *
 * @param <T> payload type
 */
public class MemQueue<T> implements MessageQueue<T> {
    private static final Logger logger = LoggerFactory.getLogger(MemQueue.class);

    private final KeyValueStore store;
    private final Class<T> type;
    private final Serializer<T> serializer;
    private final QueueConfig config;

    private final TimeBucketIndex index;
    private final QueueWriter writer;
    private final QueueReader reader;
    private final SequentialConsumer consumer;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MemQueue(KeyValueStore store, Class<T> type, Serializer<T> serializer, QueueConfig config) {
        this(store, type, serializer, config, null);
    }

    /**
     * @param clock time source for message keys, buckets and cursors; null for system UTC
     * @throws UnsupportedOperationException if backup endpoints are configured
     */
    public MemQueue(KeyValueStore store, Class<T> type, Serializer<T> serializer, QueueConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");

        if (config.getBackupEndpoints() != null && !config.getBackupEndpoints().isEmpty()) {
            throw new UnsupportedOperationException(
                    "Mirroring to backup endpoints is not supported: " + config.getBackupEndpoints());
        }
        if (config.getClientLagSeconds() < 0) {
            throw new IllegalArgumentException("clientLagSeconds must be >= 0, got " + config.getClientLagSeconds());
        }

        Clock c = (clock != null) ? clock : Clock.systemUTC();
        ClientCursor cursor = new ClientCursor(store, c);
        this.index = new TimeBucketIndex(store, c);
        this.writer = new QueueWriter(store, index, c);
        this.reader = new QueueReader(store, index, writer, cursor, config.isAutoDelete());
        this.consumer = new SequentialConsumer(reader, writer, cursor, c);

        logger.debug("Created MemQueue for type '{}' (autoDelete: {}, clientLag: {}s)",
                type.getSimpleName(), config.isAutoDelete(), config.getClientLagSeconds());
    }

    @Override
    public String put(String queue, T payload, String clientId) {
        ensureOpen();
        Objects.requireNonNull(payload, "payload cannot be null");
        return writer.put(requireName(queue), serializer.serialize(payload), requireClient(clientId));
    }

    @Override
    public T get(String queue, String messageKey, String clientId) {
        ensureOpen();
        Objects.requireNonNull(messageKey, "messageKey cannot be null");
        return decode(reader.fetch(requireName(queue), messageKey, requireClient(clientId)));
    }

    @Override
    public T last(String queue, String clientId) {
        ensureOpen();
        return decode(reader.last(requireName(queue), requireClient(clientId)));
    }

    @Override
    public T nextMessage(String queue, String clientId) {
        return nextMessage(queue, clientId, config.getClientLagSeconds());
    }

    /**
     * {@link #nextMessage(String, String)} with an explicit lag threshold for this call.
     */
    public T nextMessage(String queue, String clientId, int clientLagSeconds) {
        ensureOpen();
        return decode(consumer.next(requireName(queue), requireClient(clientId), clientLagSeconds));
    }

    @Override
    public List<String> listMessages(String queue, int windowMinutes, String clientId) {
        ensureOpen();
        requireClient(clientId);
        return reader.listMessageKeys(requireName(queue), windowMinutes);
    }

    @Override
    public List<String> listMessages(String queue) {
        return listMessages(queue, config.getListWindowMinutes(), DEFAULT_CLIENT_ID);
    }

    @Override
    public boolean delete(String queue, String messageKey) {
        ensureOpen();
        requireName(queue);
        Objects.requireNonNull(messageKey, "messageKey cannot be null");
        return store.delete(messageKey);
    }

    @Override
    public int purgeQueue(String queue, int windowMinutes, String clientId) {
        int removed = 0;
        for (String key : listMessages(queue, windowMinutes, clientId)) {
            if (store.delete(key)) {
                removed++;
            }
        }
        logger.info("Purged {} messages from queue '{}' over {} minutes", removed, queue, windowMinutes);
        return removed;
    }

    @Override
    public int purgeQueue(String queue) {
        return purgeQueue(queue, config.getPurgeWindowMinutes(), DEFAULT_CLIENT_ID);
    }

    @Override
    public long checkQueue(String queue) {
        ensureOpen();
        Long touched = QueueKeys.millis(store.get(QueueKeys.existenceMarker(requireName(queue))));
        return touched == null ? 0L : touched;
    }

    @Override
    public String createClientId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Closed MemQueue for type '{}'", type.getSimpleName());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private T decode(byte[] payload) {
        return payload == null ? null : serializer.deserialize(payload, type);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("MemQueue is closed");
        }
    }

    private static String requireName(String queue) {
        Objects.requireNonNull(queue, "queue cannot be null");
        if (queue.trim().isEmpty()) {
            throw new IllegalArgumentException("queue cannot be empty or whitespace");
        }
        if (queue.indexOf(QueueKeys.DELIMITER) >= 0) {
            throw new IllegalArgumentException("queue cannot contain '" + QueueKeys.DELIMITER + "': " + queue);
        }
        return queue;
    }

    private static String requireClient(String clientId) {
        Objects.requireNonNull(clientId, "clientId cannot be null");
        if (clientId.trim().isEmpty()) {
            throw new IllegalArgumentException("clientId cannot be empty or whitespace");
        }
        if (clientId.indexOf(QueueKeys.DELIMITER) >= 0) {
            throw new IllegalArgumentException("clientId cannot contain '" + QueueKeys.DELIMITER + "': " + clientId);
        }
        return clientId;
    }
}
