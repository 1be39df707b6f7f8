package dev.memqueue.store;

import dev.memqueue.config.QueueConfig;
import dev.memqueue.core.MemQueue;
import dev.memqueue.ser.JsonSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against a live Redis. Two endpoints on separate databases of the same
 * server make keys land on different shards. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisKeyValueStoreContainerTest extends AbstractKeyValueStoreContract {

    @Container
    static final GenericContainer<?> redis =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static List<String> endpoints() {
        String base = "redis://" + redis.getHost() + ":" + redis.getMappedPort(6379);
        return List.of(base + "/0", base + "/1");
    }

    @BeforeEach
    void setUp() {
        this.store = new RedisKeyValueStore(endpoints());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (store != null) store.close();
        redis.execInContainer("redis-cli", "FLUSHALL");
    }

    @Test
    void appendScript_neverCreatesKeys_onAnyShard() {
        for (int i = 0; i < 20; i++) {
            String key = "bucket-" + i;
            assertFalse(store.append(key, "x,".getBytes(StandardCharsets.UTF_8)));
            assertNull(store.get(key));
            assertTrue(store.add(key, "a,".getBytes(StandardCharsets.UTF_8)));
            assertTrue(store.append(key, "b,".getBytes(StandardCharsets.UTF_8)));
            assertEquals("a,b,", new String(store.get(key), StandardCharsets.UTF_8));
        }
    }

    @Test
    void queueOverRedis_deliversInOrder() {
        MemQueue<Integer> mq = new MemQueue<>(store, Integer.class, new JsonSerializer<>(), new QueueConfig());
        for (int i = 1; i <= 10; i++) mq.put("redisQ", i);

        assertNotEquals(0L, mq.checkQueue("redisQ"));
        assertEquals(10, mq.listMessages("redisQ").size());
        for (int i = 1; i <= 10; i++) assertEquals(i, mq.nextMessage("redisQ", "c"));
        assertNull(mq.nextMessage("redisQ", "c"));
        assertEquals(10, mq.last("redisQ"));
    }

    @Test
    void closedStoreBehavior() {
        store.close();
        assertThrows(IllegalStateException.class, () -> store.get("k"));
    }
}
