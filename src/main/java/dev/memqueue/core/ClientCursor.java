package dev.memqueue.core;

import dev.memqueue.store.KeyValueStore;

import java.time.Clock;
import java.util.Objects;

/**
 * Per (queue, client) record of the last delivered message.
 *
 * Both entries are overwritten unconditionally; a single logical client is expected to drive
 * its own cursor sequentially, so the last write wins.
 */
public class ClientCursor {
    private final KeyValueStore store;
    private final Clock clock;

    public ClientCursor(KeyValueStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public CursorPosition get(String queue, String clientId) {
        String lastKey = QueueKeys.text(store.get(QueueKeys.clientLastMessage(queue, clientId)));
        Long lastTime = QueueKeys.millis(store.get(QueueKeys.clientLastTime(queue, clientId)));
        if (lastKey == null && lastTime == null) {
            return CursorPosition.NEVER_CONSUMED;
        }
        return new CursorPosition(lastKey, lastTime);
    }

    public void set(String queue, String clientId, String messageKey) {
        Objects.requireNonNull(messageKey, "messageKey cannot be null");
        store.set(QueueKeys.clientLastMessage(queue, clientId), QueueKeys.utf8(messageKey));
        store.set(QueueKeys.clientLastTime(queue, clientId), QueueKeys.utf8(Long.toString(clock.millis())));
    }
}
