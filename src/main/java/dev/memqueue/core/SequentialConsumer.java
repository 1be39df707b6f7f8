package dev.memqueue.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Resolves the next message a client has not seen yet.
 *
 * <p>A client is caught up when its cursor names the queue's last message. A client that has not
 * consumed for longer than the lag threshold is fast-forwarded to the newest message, skipping the
 * backlog in between; this bounds catch-up cost regardless of how many messages piled up. Any other
 * client gets the message after its cursor within a window of {@code lag} minutes, one minute per second
 * of allowed lag, or the oldest message in the window when its cursor has scrolled out of it or was
 * never set. The window reaches back far beyond the lag so a client consuming a backlog steadily keeps
 * finding its cursor message.
 */
public class SequentialConsumer {
    private static final Logger logger = LoggerFactory.getLogger(SequentialConsumer.class);

    private final QueueReader reader;
    private final QueueWriter writer;
    private final ClientCursor cursor;
    private final Clock clock;

    public SequentialConsumer(QueueReader reader, QueueWriter writer, ClientCursor cursor, Clock clock) {
        this.reader = Objects.requireNonNull(reader, "reader cannot be null");
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
        this.cursor = Objects.requireNonNull(cursor, "cursor cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * @param clientLagSeconds silence after which the client is fast-forwarded
     * @return the next payload for the client, or null if it is caught up
     */
    public byte[] next(String queue, String clientId, int clientLagSeconds) {
        if (clientLagSeconds < 0) {
            throw new IllegalArgumentException("clientLagSeconds must be >= 0, got " + clientLagSeconds);
        }

        MDC.put("queue", queue);
        MDC.put("clientId", clientId);
        try {
            CursorPosition position = cursor.get(queue, clientId);
            String lastGlobal = writer.lastMessageKey(queue);

            if (Objects.equals(position.lastMessageKey(), lastGlobal)) {
                logger.trace("Client '{}' is caught up on queue '{}'", clientId, queue);
                return null;
            }

            Long lastTime = position.lastDeliveredMillis();
            if (lastTime != null && clock.millis() - lastTime > clientLagSeconds * 1000L) {
                logger.warn("Client '{}' silent for {} ms on queue '{}', fast-forwarding to the newest message",
                        clientId, clock.millis() - lastTime, queue);
                return reader.last(queue, clientId);
            }

            List<String> keys = reader.listMessageKeys(queue, windowMinutes(clientLagSeconds));
            int next = keys.indexOf(position.lastMessageKey()) + 1;   // -1 + 1 = oldest in window
            if (next == 0 && position.hasConsumed()) {
                logger.debug("Last message of client '{}' is outside the {} minute window on queue '{}'",
                        clientId, windowMinutes(clientLagSeconds), queue);
            }

            if (next >= keys.size()) {
                logger.trace("Client '{}' is at the end of the window on queue '{}'", clientId, queue);
                return null;
            }

            logger.debug("Delivering position {} of {} on queue '{}' to client '{}'", next, keys.size(), queue, clientId);
            return reader.fetch(queue, keys.get(next), clientId);
        } finally {
            MDC.remove("queue");
            MDC.remove("clientId");
        }
    }

    static int windowMinutes(int clientLagSeconds) {
        return clientLagSeconds;
    }
}
