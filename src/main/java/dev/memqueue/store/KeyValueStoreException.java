package dev.memqueue.store;

/**
 * Raised when the backing store cannot complete an operation. Fatal to the calling queue operation.
 */
public class KeyValueStoreException extends RuntimeException {
    public KeyValueStoreException(String message) {
        super(message);
    }

    public KeyValueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
