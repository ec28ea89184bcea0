package io.dbmaint.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.dbmaint.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a distribution summary with a {@link MeterRegistry} for export to
 * Prometheus, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dbmaint.rows.deleted}: rows removed by delete statements</li>
 *   <li>{@code dbmaint.delete.batches}: delete batches issued</li>
 *   <li>{@code dbmaint.dumps.completed}: dumps written</li>
 *   <li>{@code dbmaint.dumps.failed}: dumps that failed and aborted their table</li>
 *   <li>{@code dbmaint.statements.failed}: statements rejected by the database</li>
 *   <li>{@code dbmaint.tables.aborted}: tables whose remaining steps were skipped</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code dbmaint.delete.batch.duration.ms}: wall-clock time of one delete batch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter rowsDeleted;
    private final Counter batches;
    private final Counter dumpsCompleted;
    private final Counter dumpsFailed;
    private final Counter statementFailures;
    private final Counter tablesAborted;
    private final DistributionSummary batchDuration;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "dbmaint"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "dbmaint");
    }

    /**
     * Creates an exporter with a custom metric name prefix.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "nightly.dbmaint"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.rowsDeleted = Counter.builder(namePrefix + ".rows.deleted")
                .description("Rows removed by delete statements")
                .register(registry);
        this.batches = Counter.builder(namePrefix + ".delete.batches")
                .description("Delete batches issued")
                .register(registry);
        this.dumpsCompleted = Counter.builder(namePrefix + ".dumps.completed")
                .description("Table dumps written")
                .register(registry);
        this.dumpsFailed = Counter.builder(namePrefix + ".dumps.failed")
                .description("Table dumps that failed")
                .register(registry);
        this.statementFailures = Counter.builder(namePrefix + ".statements.failed")
                .description("Statements rejected by the database")
                .register(registry);
        this.tablesAborted = Counter.builder(namePrefix + ".tables.aborted")
                .description("Tables whose remaining steps were skipped after a failed dump")
                .register(registry);

        this.batchDuration = DistributionSummary.builder(namePrefix + ".delete.batch.duration.ms")
                .description("Delete batch execution time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementRowsDeleted(long rows) {
        if (closed) return;
        rowsDeleted.increment(rows);
    }

    @Override
    public void incrementBatches() {
        if (closed) return;
        batches.increment();
    }

    @Override
    public void incrementDumpsCompleted() {
        if (closed) return;
        dumpsCompleted.increment();
    }

    @Override
    public void incrementDumpsFailed() {
        if (closed) return;
        dumpsFailed.increment();
    }

    @Override
    public void incrementStatementFailures() {
        if (closed) return;
        statementFailures.increment();
    }

    @Override
    public void incrementTablesAborted() {
        if (closed) return;
        tablesAborted.increment();
    }

    @Override
    public void recordBatchDurationMs(long durationMs) {
        if (closed) return;
        batchDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(rowsDeleted, batches, dumpsCompleted, dumpsFailed,
                statementFailures, tablesAborted, batchDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
