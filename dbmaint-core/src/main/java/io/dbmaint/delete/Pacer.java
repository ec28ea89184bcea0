package io.dbmaint.delete;

import java.time.Duration;

/**
 * Suspends the calling thread between delete batches to bound lock contention and replication
 * lag on a live table.
 */
@FunctionalInterface
public interface Pacer {

    /**
     * Pacer backed by {@link Thread#sleep(long)}.
     */
    Pacer SLEEP = delay -> Thread.sleep(delay.toMillis());

    void pause(Duration delay) throws InterruptedException;
}
