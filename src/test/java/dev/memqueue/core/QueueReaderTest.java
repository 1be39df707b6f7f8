package dev.memqueue.core;

import dev.memqueue.store.InMemoryKeyValueStore;
import dev.memqueue.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueueReaderTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private TimeBucketIndex index;
    private QueueWriter writer;
    private ClientCursor cursor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-10-19T12:00:10Z");
        store = new InMemoryKeyValueStore();
        index = new TimeBucketIndex(store, clock);
        writer = new QueueWriter(store, index, clock);
        cursor = new ClientCursor(store, clock);
    }

    private QueueReader reader(boolean autoDelete) {
        return new QueueReader(store, index, writer, cursor, autoDelete);
    }

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void mergesBucketsOldestFirst_withoutEmptyTokens() {
        String a = writer.put("q", b("a"), "c");
        clock.advanceSeconds(60);
        String bKey = writer.put("q", b("b"), "c");
        clock.advanceSeconds(120);
        String c = writer.put("q", b("c"), "c");

        List<String> keys = reader(false).listMessageKeys("q", 10);
        assertEquals(List.of(a, bKey, c), keys);
        assertFalse(keys.contains(""));
    }

    @Test
    void windowExcludesOlderBuckets() {
        writer.put("q", b("old"), "c");
        clock.advanceSeconds(5 * 60);
        String recent = writer.put("q", b("new"), "c");

        assertEquals(List.of(recent), reader(false).listMessageKeys("q", 2));
    }

    @Test
    void emptyQueue_listsNothing() {
        assertTrue(reader(false).listMessageKeys("never", 10).isEmpty());
    }

    @Test
    void malformedBucket_isReported() {
        store.set("q_LIST_202610191200", b("k1,k2"));
        CorruptBucketException e = assertThrows(CorruptBucketException.class,
                () -> reader(false).listMessageKeys("q", 0));
        assertEquals("q_LIST_202610191200", e.getBucketKey());

        store.set("q_LIST_202610191200", b("k1,,k2,"));
        assertThrows(CorruptBucketException.class, () -> reader(false).listMessageKeys("q", 0));
    }

    @Test
    void fetch_recordsDelivery_evenForMissingMessages() {
        QueueReader reader = reader(false);
        assertNull(reader.fetch("q", "q_gone", "c1"));

        CursorPosition position = cursor.get("q", "c1");
        assertEquals("q_gone", position.lastMessageKey());
        assertEquals(Long.valueOf(clock.millis()), position.lastDeliveredMillis());
    }

    @Test
    void fetch_withAutoDelete_consumesTheMessage() {
        String key = writer.put("q", b("once"), "c");
        QueueReader reader = reader(true);

        assertEquals("once", new String(reader.fetch("q", key, "c1"), StandardCharsets.UTF_8));
        assertNull(reader.fetch("q", key, "c1"));
        assertNull(store.get(key));
    }

    @Test
    void last_onNeverWrittenQueue_isNull_andLeavesCursorAlone() {
        assertNull(reader(false).last("q", "c1"));
        assertFalse(cursor.get("q", "c1").hasConsumed());
    }

    @Test
    void last_returnsNewest() {
        writer.put("q", b("1"), "c");
        writer.put("q", b("2"), "c");
        assertEquals("2", new String(reader(false).last("q", "c1"), StandardCharsets.UTF_8));
    }
}
