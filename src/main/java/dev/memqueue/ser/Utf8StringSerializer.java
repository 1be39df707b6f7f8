package dev.memqueue.ser;

import java.nio.charset.StandardCharsets;

/**
 * Stores String payloads as raw UTF-8, readable by non-Java clients of the same cache.
 */
public class Utf8StringSerializer implements Serializer<String> {
    @Override
    public byte[] serialize(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String deserialize(byte[] bytes, Class<String> type) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Utf8StringSerializer;
    }

    @Override
    public int hashCode() {
        return Utf8StringSerializer.class.hashCode();
    }
}
