package dev.memqueue.ser;

public interface Serializer<T> {
    byte[] serialize(T value);
    T deserialize(byte[] bytes, Class<T> type);
}
