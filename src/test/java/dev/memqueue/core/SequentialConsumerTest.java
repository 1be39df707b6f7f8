package dev.memqueue.core;

import dev.memqueue.config.QueueConfig;
import dev.memqueue.ser.JsonSerializer;
import dev.memqueue.store.InMemoryKeyValueStore;
import dev.memqueue.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequentialConsumerTest {

    private MutableClock clock;
    private MemQueue<Integer> mq;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-10-19T08:30:00Z");
        mq = new MemQueue<>(new InMemoryKeyValueStore(), Integer.class, new JsonSerializer<>(),
                new QueueConfig().setClientLagSeconds(120), clock);
    }

    private List<String> putRange(String queue, int from, int to) {
        List<String> keys = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            keys.add(mq.put(queue, i));
            clock.advanceMillis(10);
        }
        return keys;
    }

    @Test
    void emptyQueue_neverConsumed_isCaughtUp() {
        assertNull(mq.nextMessage("q", "c"));
    }

    @Test
    void walksForwardOneMessageAtATime() {
        putRange("q", 1, 5);
        for (int i = 1; i <= 5; i++) {
            assertEquals(i, mq.nextMessage("q", "c"));
        }
        assertNull(mq.nextMessage("q", "c"));
    }

    @Test
    void lateJoiner_startsAtOldestInWindow() {
        putRange("q", 1, 3);
        assertEquals(1, mq.nextMessage("q", "late"));
    }

    @Test
    void lagAtThreshold_isNotFastForwarded() {
        List<String> keys = putRange("q", 1, 5);
        mq.get("q", keys.get(0), "c");
        clock.advanceSeconds(120);
        assertEquals(2, mq.nextMessage("q", "c"));
    }

    @Test
    void lagBeyondThreshold_fastForwardsToNewest() {
        List<String> keys = putRange("q", 1, 5);
        mq.get("q", keys.get(0), "c");
        clock.advanceSeconds(121);
        putRange("q", 6, 9);

        assertEquals(9, mq.nextMessage("q", "c"));
        assertNull(mq.nextMessage("q", "c"));
    }

    @Test
    void perCallLagOverride() {
        List<String> keys = putRange("q", 1, 5);
        mq.get("q", keys.get(0), "c");
        clock.advanceSeconds(30);
        assertEquals(5, mq.nextMessage("q", "c", 10));
    }

    @Test
    void cursorScrolledOutOfWindow_restartsAtOldestInWindow() {
        List<String> early = putRange("q", 1, 1);
        clock.advanceSeconds(121 * 60);
        putRange("q", 2, 3);

        // recent delivery of a message whose bucket is already outside the 120 minute window
        mq.get("q", early.get(0), "c");
        assertEquals(2, mq.nextMessage("q", "c"));
    }

    @Test
    void steadyConsumer_keepsItsPlaceInABacklogOlderThanTheLag() {
        putRange("q", 1, 5);
        assertEquals(1, mq.nextMessage("q", "c"));
        for (int i = 2; i <= 5; i++) {
            clock.advanceSeconds(100);
            assertEquals(i, mq.nextMessage("q", "c"), "message " + i + " after " + (i - 1) * 100 + "s");
        }
        assertNull(mq.nextMessage("q", "c"));
    }

    @Test
    void cursorAtEndOfWindowButPointerMovedOn_isCaughtUp() {
        List<String> keys = putRange("q", 1, 2);
        mq.get("q", keys.get(1), "c");
        // pointer names a message in a bucket the scan window does not reach
        clock.advanceSeconds(10 * 60);
        mq.put("q", 3);
        clock.advanceSeconds(-10 * 60);

        assertNull(mq.nextMessage("q", "c"));
    }

    @Test
    void windowIsOneMinutePerSecondOfLag() {
        assertEquals(120, SequentialConsumer.windowMinutes(120));
        assertEquals(0, SequentialConsumer.windowMinutes(0));
    }

    @Test
    void rejectsNegativeLag() {
        assertThrows(IllegalArgumentException.class, () -> mq.nextMessage("q", "c", -1));
    }
}
