package dev.memqueue.core;

/**
 * A time bucket holds data that is not a comma-terminated list of message keys.
 */
public class CorruptBucketException extends RuntimeException {
    private final String bucketKey;

    public CorruptBucketException(String bucketKey, String message) {
        super("Corrupt bucket " + bucketKey + ": " + message);
        this.bucketKey = bucketKey;
    }

    public String getBucketKey() {
        return bucketKey;
    }
}
