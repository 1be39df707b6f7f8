package dev.memqueue.store;

import dev.memqueue.config.QueueConfig;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A durable {@link KeyValueStore} backed by an embedded RocksDB instance.
 *
 * <p>RocksDB has no native create-if-absent or append-if-present, so every mutation takes a
 * lock from a fixed stripe selected by key hash. Reads are lock-free. Mutations of the same key
 * from several threads of this JVM are therefore atomic; sharing the database directory between
 * processes is not supported by RocksDB itself.
 *
 * <p><strong>Resource Management:</strong> the store owns the database handle and must be closed.
 */
public class RocksKeyValueStore implements KeyValueStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksKeyValueStore.class);

    private static final int LOCK_STRIPES = 64;

    static { RocksDB.loadLibrary(); }

    private final String path;
    private final RocksDB db;
    private final WriteOptions writeOpts;
    private final ReadOptions readOpts;
    private final Object[] locks = new Object[LOCK_STRIPES];
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens (or creates) the database under {@link QueueConfig#getBasePath()}.
     *
     * @throws KeyValueStoreException if the directory or database cannot be opened
     */
    public RocksKeyValueStore(QueueConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.path = Objects.requireNonNull(config.getBasePath(), "basePath cannot be null");

        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }

        logger.info("Opening RocksDB key-value store at path: {}", path);

        try {
            File dbDir = new File(path);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                throw new KeyValueStoreException("Failed to create directory: " + path);
            }

            try (Options options = new Options()
                    .setCreateIfMissing(true)
                    .setCompressionType(config.getCompressionType())
                    .setWriteBufferSize((long) config.getWriteBufferSizeMB() * 1024 * 1024)
                    .setMaxWriteBufferNumber(config.getMaxWriteBufferNumber())) {

                this.db = RocksDB.open(options, path);
            }
        } catch (RocksDBException e) {
            logger.error("Failed to open RocksDB at '{}': {}", path, e.getMessage(), e);
            throw new KeyValueStoreException("Failed to open RocksDB at " + path, e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isSyncWrites())
                .setDisableWAL(config.isDisableWAL());
        this.readOpts = new ReadOptions().setVerifyChecksums(false);

        logger.debug("Initialized RocksDB options - sync: {}, WAL disabled: {}",
                config.isSyncWrites(), config.isDisableWAL());
    }

    @Override
    public byte[] get(String key) {
        ensureOpen();
        try {
            return db.get(readOpts, encode(key));
        } catch (RocksDBException e) {
            throw failure("get", key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        ensureOpen();
        Objects.requireNonNull(value, "value cannot be null");
        synchronized (lockFor(key)) {
            try {
                db.put(writeOpts, encode(key), value);
            } catch (RocksDBException e) {
                throw failure("set", key, e);
            }
        }
    }

    @Override
    public boolean add(String key, byte[] value) {
        ensureOpen();
        Objects.requireNonNull(value, "value cannot be null");
        byte[] k = encode(key);
        synchronized (lockFor(key)) {
            try {
                if (db.get(readOpts, k) != null) {
                    return false;
                }
                db.put(writeOpts, k, value);
                return true;
            } catch (RocksDBException e) {
                throw failure("add", key, e);
            }
        }
    }

    @Override
    public boolean append(String key, byte[] suffix) {
        ensureOpen();
        Objects.requireNonNull(suffix, "suffix cannot be null");
        byte[] k = encode(key);
        synchronized (lockFor(key)) {
            try {
                byte[] existing = db.get(readOpts, k);
                if (existing == null) {
                    return false;
                }
                byte[] merged = Arrays.copyOf(existing, existing.length + suffix.length);
                System.arraycopy(suffix, 0, merged, existing.length, suffix.length);
                db.put(writeOpts, k, merged);
                return true;
            } catch (RocksDBException e) {
                throw failure("append", key, e);
            }
        }
    }

    @Override
    public boolean delete(String key) {
        ensureOpen();
        byte[] k = encode(key);
        synchronized (lockFor(key)) {
            try {
                if (db.get(readOpts, k) == null) {
                    return false;
                }
                db.delete(writeOpts, k);
                return true;
            } catch (RocksDBException e) {
                throw failure("delete", key, e);
            }
        }
    }

    /**
     * Closes the database. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed store at '{}'", path);
            return;
        }

        logger.info("Closing RocksDB key-value store at '{}'", path);

        try {
            readOpts.close();
        } catch (Exception e) {
            logger.warn("Failed to close read options for '{}': {}", path, e.getMessage(), e);
        }
        try {
            writeOpts.close();
        } catch (Exception e) {
            logger.warn("Failed to close write options for '{}': {}", path, e.getMessage(), e);
        }
        try {
            db.close();
            logger.info("Successfully closed RocksDB at '{}'", path);
        } catch (Exception e) {
            logger.error("Failed to close RocksDB at '{}': {}", path, e.getMessage(), e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Store is closed: " + path);
        }
    }

    private Object lockFor(String key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private static byte[] encode(String key) {
        return Objects.requireNonNull(key, "key cannot be null").getBytes(StandardCharsets.UTF_8);
    }

    private KeyValueStoreException failure(String op, String key, RocksDBException e) {
        logger.error("RocksDB {} failed for key '{}' at '{}': {}", op, key, path, e.getMessage(), e);
        return new KeyValueStoreException("RocksDB " + op + " failed for key=" + key, e);
    }
}
