package dev.memqueue.core;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Naming scheme for every key a queue owns in the store.
 *
 * <pre>
 * {queue}                          existence marker, epoch millis of the last write
 * {queue}_{client}_{millis}_{uuid} message payload
 * {queue}_LIST_{yyyyMMddHHmm}      comma-terminated message keys written in that minute
 * {queue}_LASTMSG                  key of the most recent message
 * {queue}_LASTMSG_{client}         key last delivered to the client
 * {queue}_LASTTIME_{client}        epoch millis of that delivery
 * </pre>
 */
public final class QueueKeys {

    static final String LIST = "LIST";
    static final String LAST_MESSAGE = "LASTMSG";
    static final String LAST_TIME = "LASTTIME";
    static final char DELIMITER = ',';

    private static final DateTimeFormatter MINUTE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);

    private QueueKeys() {
    }

    public static String existenceMarker(String queue) {
        return queue;
    }

    public static String message(String queue, String clientId, long writeMillis) {
        return queue + "_" + clientId + "_" + writeMillis + "_" + UUID.randomUUID();
    }

    public static String bucket(String queue, Instant minute) {
        return queue + "_" + LIST + "_" + MINUTE_FORMAT.format(minute.truncatedTo(ChronoUnit.MINUTES));
    }

    public static String lastMessage(String queue) {
        return queue + "_" + LAST_MESSAGE;
    }

    public static String clientLastMessage(String queue, String clientId) {
        return queue + "_" + LAST_MESSAGE + "_" + clientId;
    }

    public static String clientLastTime(String queue, String clientId) {
        return queue + "_" + LAST_TIME + "_" + clientId;
    }

    static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    static String text(byte[] value) {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    /**
     * Parses a stored epoch-millis value; null when absent.
     *
     * @throws IllegalStateException if the stored value is not a number
     */
    static Long millis(byte[] value) {
        String s = text(value);
        if (s == null) {
            return null;
        }
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Stored timestamp is not epoch millis: '" + s + "'", e);
        }
    }
}
