package io.dbmaint.spi;

/**
 * Observability hook for exporting maintenance counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * <p>Implemented by {@code io.dbmaint.micrometer.MicrometerMetricsExporter}.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds to the number of rows removed by delete statements.
     */
    void incrementRowsDeleted(long rows);

    /**
     * Increments the count of delete batches issued.
     */
    void incrementBatches();

    /**
     * Increments the count of dumps written (or simulated in dry-run).
     */
    void incrementDumpsCompleted();

    /**
     * Increments the count of dumps that failed and aborted their table.
     */
    void incrementDumpsFailed();

    /**
     * Increments the count of statements that raised a driver error.
     */
    void incrementStatementFailures();

    /**
     * Increments the count of tables whose remaining steps were skipped.
     */
    default void incrementTablesAborted() {
    }

    /**
     * Records the wall-clock duration of one delete batch.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordBatchDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementRowsDeleted(long rows) {
        }

        @Override
        public void incrementBatches() {
        }

        @Override
        public void incrementDumpsCompleted() {
        }

        @Override
        public void incrementDumpsFailed() {
        }

        @Override
        public void incrementStatementFailures() {
        }
    }
}
