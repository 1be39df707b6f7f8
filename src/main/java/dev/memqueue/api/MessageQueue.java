package dev.memqueue.api;

import java.util.List;

/**
 * Best-effort message queue semantics over a shared key-value cache:
 * - Queues are named and created implicitly by the first {@link #put}.
 * - Messages are indexed in one bucket per wall-clock minute; listings merge buckets over a
 *   trailing window of minutes, so anything older than the window (or evicted by the cache) is not seen.
 * - Every read through {@link #get}, {@link #last} or {@link #nextMessage} records the message as
 *   the last one delivered to the calling client.
 * - Absence is never an error: unknown queues, missing messages and caught-up clients yield null,
 *   an empty list or 0.
 *
 * @param <T> payload type
 */
public interface MessageQueue<T> extends AutoCloseable {

    String DEFAULT_CLIENT_ID = "UnknownClient";

    /**
     * Puts a message on the queue.
     *
     * @param payload should serialize to less than the cache's per-value limit (about 1 MB for memcached-style caches)
     * @return the key the message was stored under
     */
    String put(String queue, T payload, String clientId);

    default String put(String queue, T payload) {
        return put(queue, payload, DEFAULT_CLIENT_ID);
    }

    /**
     * Reads the message stored under {@code messageKey}; deletes it afterwards when auto-delete is on.
     *
     * @return the payload, or null if absent
     */
    T get(String queue, String messageKey, String clientId);

    default T get(String queue, String messageKey) {
        return get(queue, messageKey, DEFAULT_CLIENT_ID);
    }

    /**
     * @return the most recently written message, or null if the queue was never written
     */
    T last(String queue, String clientId);

    default T last(String queue) {
        return last(queue, DEFAULT_CLIENT_ID);
    }

    /**
     * Returns the next message this client has not seen, or null when it is caught up.
     * A client silent for longer than the configured lag is moved straight to the newest message.
     */
    T nextMessage(String queue, String clientId);

    default T nextMessage(String queue) {
        return nextMessage(queue, DEFAULT_CLIENT_ID);
    }

    /**
     * @param windowMinutes how many minutes before the current one to include, at least 0
     * @return message keys in write order, oldest first
     */
    List<String> listMessages(String queue, int windowMinutes, String clientId);

    List<String> listMessages(String queue);

    boolean delete(String queue, String messageKey);

    /**
     * Deletes every message listed in the window.
     *
     * @return number of messages actually removed
     */
    int purgeQueue(String queue, int windowMinutes, String clientId);

    int purgeQueue(String queue);

    /**
     * @return epoch millis of the last write to the queue, or 0 if it was never written
     */
    long checkQueue(String queue);

    /**
     * @return an identifier no other call returns
     */
    String createClientId();

    @Override
    void close();
}
