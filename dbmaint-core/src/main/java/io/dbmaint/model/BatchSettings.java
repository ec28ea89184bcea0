package io.dbmaint.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Batching parameters of a predicate-based delete.
 *
 * @param size  maximum rows per delete statement; {@code 0} means a single unbounded delete
 * @param delay pause between non-terminal batches (ignored in dry-run)
 */
public record BatchSettings(int size, Duration delay) {

    public static final BatchSettings UNBOUNDED = new BatchSettings(0, Duration.ZERO);

    public BatchSettings {
        Objects.requireNonNull(delay, "delay");
        if (size < 0) {
            throw new IllegalArgumentException("batch size must be >= 0");
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("batch delay must be >= 0");
        }
    }

    public static BatchSettings of(int size, Duration delay) {
        return new BatchSettings(size, delay);
    }

    public boolean isBounded() {
        return size > 0;
    }
}
