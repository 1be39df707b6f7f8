package dev.memqueue.store;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cache contract every {@link KeyValueStore} backend must satisfy. Subclasses provide {@link #store}.
 */
abstract class AbstractKeyValueStoreContract {

    protected KeyValueStore store;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String s(byte[] b) {
        return b == null ? null : new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void getOfMissingKey_isNull() {
        assertNull(store.get("nope"));
    }

    @Test
    void set_overwritesUnconditionally() {
        store.set("k", b("one"));
        store.set("k", b("two"));
        assertEquals("two", s(store.get("k")));
    }

    @Test
    void add_createsOnlyWhenAbsent() {
        assertTrue(store.add("k", b("first")));
        assertFalse(store.add("k", b("second")));
        assertEquals("first", s(store.get("k")));
    }

    @Test
    void append_requiresExistingKey() {
        assertFalse(store.append("k", b("x,")));
        assertNull(store.get("k"), "failed append must not create the key");

        store.add("k", b("a,"));
        assertTrue(store.append("k", b("b,")));
        assertEquals("a,b,", s(store.get("k")));
    }

    @Test
    void delete_reportsWhetherSomethingWasRemoved() {
        store.set("k", b("v"));
        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
        assertNull(store.get("k"));
    }

    @Test
    void concurrentAppends_areAllKept() throws Exception {
        store.add("list", b(""));
        int threads = 4;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger failed = new AtomicInteger();
        for (int t = 0; t < threads; t++) {
            final int id = t;
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        if (!store.append("list", b(id + "-" + i + ","))) failed.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(15, TimeUnit.SECONDS));
        assertEquals(0, failed.get());

        String[] tokens = s(store.get("list")).split(",");
        ConcurrentSkipListSet<String> unique = new ConcurrentSkipListSet<>(java.util.Arrays.asList(tokens));
        assertEquals(threads * perThread, tokens.length);
        assertEquals(threads * perThread, unique.size());
    }

    @Test
    void concurrentAdds_haveExactlyOneWinner() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        for (int t = 0; t < threads; t++) {
            final int id = t;
            pool.submit(() -> {
                start.await();
                if (store.add("race", b("w" + id))) winners.incrementAndGet();
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1, winners.get());
    }
}
