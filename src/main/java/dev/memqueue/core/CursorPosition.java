package dev.memqueue.core;

/**
 * Where a client stands on a queue.
 *
 * @param lastMessageKey     key of the last message delivered to the client, null if none
 * @param lastDeliveredMillis epoch millis of that delivery, null if none
 */
public record CursorPosition(String lastMessageKey, Long lastDeliveredMillis) {

    public static final CursorPosition NEVER_CONSUMED = new CursorPosition(null, null);

    public boolean hasConsumed() {
        return lastMessageKey != null || lastDeliveredMillis != null;
    }
}
