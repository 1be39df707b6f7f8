package dev.memqueue.store;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Simple in-memory implementation backed by ConcurrentHashMap.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {
    private final Map<String, byte[]> map = new ConcurrentHashMap<>();

    @Override
    public byte[] get(String key) {
        byte[] v = map.get(key);
        return v == null ? null : Arrays.copyOf(v, v.length);
    }

    @Override
    public void set(String key, byte[] value) {
        map.put(key, Arrays.copyOf(value, value.length));
    }

    @Override
    public boolean add(String key, byte[] value) {
        return map.putIfAbsent(key, Arrays.copyOf(value, value.length)) == null;
    }

    @Override
    public boolean append(String key, byte[] suffix) {
        AtomicBoolean appended = new AtomicBoolean(false);
        map.computeIfPresent(key, (k, existing) -> {
            byte[] merged = Arrays.copyOf(existing, existing.length + suffix.length);
            System.arraycopy(suffix, 0, merged, existing.length, suffix.length);
            appended.set(true);
            return merged;
        });
        return appended.get();
    }

    @Override
    public boolean delete(String key) {
        return map.remove(key) != null;
    }
}
