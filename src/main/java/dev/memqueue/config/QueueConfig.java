package dev.memqueue.config;

import org.rocksdb.CompressionType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Getter
@Setter
@Accessors(chain = true)
public class QueueConfig {
    // System property helpers so deployments and tests can override defaults
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return def; }
    }
    private static StoreType storeTypeProp() {
        try { return StoreType.valueOf(prop("mq.storeType", "IN_MEMORY")); }
        catch (IllegalArgumentException ignored) { return StoreType.IN_MEMORY; }
    }
    private static List<String> listProp(String key) {
        String v = System.getProperty(key);
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add);
        return out;
    }

    // Store
    private StoreType storeType = storeTypeProp();
    private List<String> primaryEndpoints = listProp("mq.endpoints");     // host:port, REDIS only
    private List<String> backupEndpoints = new ArrayList<>();             // mirroring is not supported, must stay empty

    // Queue behavior
    private boolean autoDelete = boolProp("mq.autoDelete", false);        // delete a message once it has been read
    private int clientLagSeconds = intProp("mq.clientLagSeconds", 120);   // silence after which nextMessage fast-forwards
    private int listWindowMinutes = 10;
    private int purgeWindowMinutes = 30;

    // RocksDB
    private String basePath = "./data/memqueue";
    private boolean syncWrites = false;       // WAL fsync on each write
    private boolean disableWAL = false;       // keep WAL by default
    private int writeBufferSizeMB = 64;       // per memtable
    private int maxWriteBufferNumber = 3;
    private CompressionType compressionType = CompressionType.LZ4_COMPRESSION;
}
