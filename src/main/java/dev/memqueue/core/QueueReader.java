package dev.memqueue.core;

import dev.memqueue.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the merged, time-ordered view of a queue and fetches payloads.
 */
public class QueueReader {
    private static final Logger logger = LoggerFactory.getLogger(QueueReader.class);

    private final KeyValueStore store;
    private final TimeBucketIndex index;
    private final QueueWriter writer;
    private final ClientCursor cursor;
    private final boolean autoDelete;

    public QueueReader(KeyValueStore store, TimeBucketIndex index, QueueWriter writer,
                       ClientCursor cursor, boolean autoDelete) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.index = Objects.requireNonNull(index, "index cannot be null");
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
        this.cursor = Objects.requireNonNull(cursor, "cursor cannot be null");
        this.autoDelete = autoDelete;
    }

    /**
     * Message keys registered during the last {@code windowMinutes} minutes plus the current one.
     * Oldest bucket first; within a bucket, the order the store applied the appends.
     *
     * @throws CorruptBucketException if a bucket is not a comma-terminated key list
     */
    public List<String> listMessageKeys(String queue, int windowMinutes) {
        List<String> keys = new ArrayList<>();
        for (String bucket : index.bucketKeys(queue, windowMinutes)) {
            String contents = QueueKeys.text(store.get(bucket));
            if (contents == null || contents.isEmpty()) {
                continue;
            }
            keys.addAll(split(bucket, contents));
        }
        logger.trace("Listed {} message keys on queue '{}' over {} minutes", keys.size(), queue, windowMinutes);
        return keys;
    }

    static List<String> split(String bucket, String contents) {
        if (contents.charAt(contents.length() - 1) != QueueKeys.DELIMITER) {
            throw new CorruptBucketException(bucket, "missing trailing delimiter");
        }
        // drop the empty token after the final delimiter
        String[] tokens = contents.substring(0, contents.length() - 1).split(String.valueOf(QueueKeys.DELIMITER), -1);
        List<String> out = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            if (token.isEmpty()) {
                throw new CorruptBucketException(bucket, "empty message key");
            }
            out.add(token);
        }
        return out;
    }

    /**
     * Reads a message with this reader's auto-delete setting.
     *
     * @see #fetch(String, String, String, boolean)
     */
    public byte[] fetch(String queue, String messageKey, String clientId) {
        return fetch(queue, messageKey, clientId, autoDelete);
    }

    /**
     * Reads the payload of {@code messageKey} and records it as delivered to {@code clientId},
     * whether or not the payload was still there.
     *
     * @return the payload, or null if it is absent or was already consumed
     */
    public byte[] fetch(String queue, String messageKey, String clientId, boolean autoDelete) {
        Objects.requireNonNull(messageKey, "messageKey cannot be null");
        byte[] payload = store.get(messageKey);
        if (autoDelete) {
            store.delete(messageKey);
        }
        cursor.set(queue, clientId, messageKey);
        if (payload == null) {
            logger.debug("Message '{}' on queue '{}' is absent", messageKey, queue);
        }
        return payload;
    }

    /**
     * Fetches the queue's most recent message.
     *
     * @return the payload, or null if the queue was never written
     */
    public byte[] last(String queue, String clientId) {
        String key = writer.lastMessageKey(queue);
        if (key == null) {
            return null;
        }
        return fetch(queue, key, clientId);
    }
}
