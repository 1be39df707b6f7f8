package dev.memqueue.core;

import dev.memqueue.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partitions a queue's message keys into one append-only list per wall-clock minute.
 *
 * <p>Registration never locks: append-if-present and create-if-absent are each atomic in the
 * store, and message keys are unique, so the append / add / append sequence always ends with
 * the key present exactly once. Relative order of two writers appending in the same minute
 * is whatever order the store applied them in.
 */
public class TimeBucketIndex {
    private static final Logger logger = LoggerFactory.getLogger(TimeBucketIndex.class);

    private final KeyValueStore store;
    private final Clock clock;

    public TimeBucketIndex(KeyValueStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Bucket keys from {@code windowMinutes} minutes ago up to the current minute, oldest first.
     *
     * @return {@code windowMinutes + 1} keys
     * @throws IllegalArgumentException if windowMinutes is negative
     */
    public List<String> bucketKeys(String queue, int windowMinutes) {
        if (windowMinutes < 0) {
            throw new IllegalArgumentException("windowMinutes must be >= 0, got " + windowMinutes);
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.MINUTES);
        List<String> keys = new ArrayList<>(windowMinutes + 1);
        for (int i = windowMinutes; i >= 0; i--) {
            keys.add(QueueKeys.bucket(queue, now.minus(i, ChronoUnit.MINUTES)));
        }
        return keys;
    }

    /**
     * Adds {@code messageKey} to the current minute's bucket and touches the queue's existence marker.
     */
    public void registerMessage(String queue, String messageKey) {
        String bucket = QueueKeys.bucket(queue, clock.instant());
        byte[] entry = QueueKeys.utf8(messageKey + QueueKeys.DELIMITER);

        if (!store.append(bucket, entry)) {
            if (!store.add(bucket, entry)) {
                // another writer created the bucket between our append and add
                logger.debug("Lost bucket creation race on '{}', appending", bucket);
                if (!store.append(bucket, entry)) {
                    throw new IllegalStateException("Bucket " + bucket + " vanished while registering " + messageKey);
                }
            } else {
                logger.trace("Created bucket '{}'", bucket);
            }
        }

        store.set(QueueKeys.existenceMarker(queue), QueueKeys.utf8(Long.toString(clock.millis())));
    }
}
