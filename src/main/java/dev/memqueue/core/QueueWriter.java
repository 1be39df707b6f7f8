package dev.memqueue.core;

import dev.memqueue.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Stores new messages and maintains the queue-global last-message pointer.
 */
public class QueueWriter {
    private static final Logger logger = LoggerFactory.getLogger(QueueWriter.class);

    private final KeyValueStore store;
    private final TimeBucketIndex index;
    private final Clock clock;

    public QueueWriter(KeyValueStore store, TimeBucketIndex index, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.index = Objects.requireNonNull(index, "index cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Writes {@code payload} under a fresh key, registers the key in the current minute's bucket
     * and points the queue's last-message pointer at it.
     *
     * @return the message key
     * @throws dev.memqueue.store.KeyValueStoreException if the store rejects a write; nothing is retried
     */
    public String put(String queue, byte[] payload, String clientId) {
        Objects.requireNonNull(payload, "payload cannot be null");

        String key = QueueKeys.message(queue, clientId, clock.millis());
        store.set(key, payload);
        index.registerMessage(queue, key);
        store.set(QueueKeys.lastMessage(queue), QueueKeys.utf8(key));

        logger.trace("Stored message '{}' ({} bytes) on queue '{}'", key, payload.length, queue);
        return key;
    }

    /**
     * @return key of the most recently written message, or null if the queue was never written
     */
    public String lastMessageKey(String queue) {
        return QueueKeys.text(store.get(QueueKeys.lastMessage(queue)));
    }
}
