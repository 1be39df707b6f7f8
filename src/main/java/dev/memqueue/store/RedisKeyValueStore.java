package dev.memqueue.store;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A shared {@link KeyValueStore} over one or more Redis servers.
 *
 * <p>Keys are spread over the endpoints by hash, the way memcached clients shard; each key lives
 * on exactly one server so the per-key atomicity of {@code SETNX} and the append script holds.
 * Commands are synchronous. A connection failure propagates as {@link KeyValueStoreException}.
 */
public class RedisKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    /** APPEND creates missing keys, so the existence check has to run server-side in the same step. */
    static final String APPEND_IF_PRESENT =
            "if redis.call('EXISTS', KEYS[1]) == 1 then "
                    + "redis.call('APPEND', KEYS[1], ARGV[1]) return 1 "
                    + "else return 0 end";

    private final List<String> endpoints;
    private final List<RedisClient> clients = new ArrayList<>();
    private final List<StatefulRedisConnection<String, byte[]>> connections = new ArrayList<>();
    private final List<RedisCommands<String, byte[]>> commands = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Connects to every endpoint.
     *
     * @param endpoints {@code host:port} or {@code redis://} URIs, at least one
     * @throws IllegalArgumentException if no endpoint is given or one is malformed
     * @throws KeyValueStoreException   if a server cannot be reached
     */
    public RedisKeyValueStore(List<String> endpoints) {
        Objects.requireNonNull(endpoints, "endpoints cannot be null");
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("at least one endpoint is required");
        }
        this.endpoints = Collections.unmodifiableList(new ArrayList<>(endpoints));

        // parse everything up front so a malformed endpoint fails before any connection is opened
        List<RedisURI> uris = new ArrayList<>(this.endpoints.size());
        for (String endpoint : this.endpoints) {
            uris.add(toUri(endpoint));
        }

        RedisCodec<String, byte[]> codec = RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE);
        try {
            for (int i = 0; i < uris.size(); i++) {
                RedisClient client = RedisClient.create(uris.get(i));
                clients.add(client);
                StatefulRedisConnection<String, byte[]> connection = client.connect(codec);
                connections.add(connection);
                commands.add(connection.sync());
                log.info("Connected to Redis: {}", this.endpoints.get(i));
            }
        } catch (RedisException e) {
            log.error("Failed to connect to Redis endpoints {}: {}", this.endpoints, e.getMessage(), e);
            close();
            throw new KeyValueStoreException("Failed to connect to Redis endpoints " + this.endpoints, e);
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    static RedisURI toUri(String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        String trimmed = endpoint.trim();
        if (trimmed.startsWith("redis://") || trimmed.startsWith("rediss://")) {
            return RedisURI.create(trimmed);
        }
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1) {
            throw new IllegalArgumentException("endpoint must be host:port, got '" + endpoint + "'");
        }
        try {
            int port = Integer.parseInt(trimmed.substring(colon + 1));
            return RedisURI.create(trimmed.substring(0, colon), port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in endpoint '" + endpoint + "'", e);
        }
    }

    static int shardFor(String key, int shards) {
        return Math.floorMod(key.hashCode(), shards);
    }

    private RedisCommands<String, byte[]> route(String key) {
        if (closed.get()) {
            throw new IllegalStateException("Store is closed: " + endpoints);
        }
        Objects.requireNonNull(key, "key cannot be null");
        return commands.get(shardFor(key, commands.size()));
    }

    @Override
    public byte[] get(String key) {
        try {
            return route(key).get(key);
        } catch (RedisException e) {
            throw failure("GET", key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        try {
            route(key).set(key, value);
        } catch (RedisException e) {
            throw failure("SET", key, e);
        }
    }

    @Override
    public boolean add(String key, byte[] value) {
        try {
            return Boolean.TRUE.equals(route(key).setnx(key, value));
        } catch (RedisException e) {
            throw failure("SETNX", key, e);
        }
    }

    @Override
    public boolean append(String key, byte[] suffix) {
        try {
            Long appended = route(key).eval(APPEND_IF_PRESENT, ScriptOutputType.INTEGER, new String[]{key}, new byte[][]{suffix});
            return appended != null && appended == 1L;
        } catch (RedisException e) {
            throw failure("APPEND", key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            Long removed = route(key).del(key);
            return removed != null && removed > 0;
        } catch (RedisException e) {
            throw failure("DEL", key, e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (StatefulRedisConnection<String, byte[]> connection : connections) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close Redis connection: {}", e.getMessage(), e);
            }
        }
        for (RedisClient client : clients) {
            try {
                client.shutdown();
            } catch (RuntimeException e) {
                log.warn("Failed to shut down Redis client: {}", e.getMessage(), e);
            }
        }
        log.info("Closed Redis store for endpoints {}", endpoints);
    }

    private KeyValueStoreException failure(String op, String key, RedisException e) {
        log.error("Redis {} failed for key '{}': {}", op, key, e.getMessage(), e);
        return new KeyValueStoreException("Redis " + op + " failed for key=" + key, e);
    }
}
