package io.dbmaint.delete;

import io.dbmaint.ResultLog;
import io.dbmaint.model.BatchSettings;
import io.dbmaint.model.DeleteStrategy;
import io.dbmaint.spi.MetricsExporter;
import io.dbmaint.spi.SqlDialect;
import io.dbmaint.spi.SqlSession;
import io.dbmaint.sql.SqlExecutionException;
import io.dbmaint.sql.SqlExecutor;
import io.dbmaint.sql.SqlResult;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes rows from one table according to its {@link DeleteStrategy}.
 *
 * <p>Predicate-based strategies with a batch size {@code B > 0} issue
 * {@code DELETE ... WHERE predicate LIMIT B} repeatedly. Every batch is committed by itself, so an
 * interrupted run leaves the table partially cleaned but consistent. The loop stops after the
 * first batch that deletes fewer than {@code B} rows; between non-terminal batches the configured
 * delay is applied in live mode only. In dry-run every batch reports zero rows, so exactly one
 * simulated batch is issued.
 *
 * <p>Statement errors are reported with the table name and end the step; they never propagate.
 */
public final class BatchedDeletionEngine {
    private static final Logger logger = Logger.getLogger(BatchedDeletionEngine.class.getName());

    private final SqlExecutor executor;
    private final Pacer pacer;
    private final Clock clock;
    private final MetricsExporter metrics;

    public BatchedDeletionEngine(SqlExecutor executor, Pacer pacer, Clock clock, MetricsExporter metrics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs the delete step for {@code table}, appending its outcome to {@code results}.
     */
    public DeletionSummary delete(SqlSession session, String table, DeleteStrategy strategy, ResultLog results) {
        Objects.requireNonNull(strategy, "strategy");
        if (strategy instanceof DeleteStrategy.Truncate) {
            return truncate(session, table, results);
        }
        if (strategy instanceof DeleteStrategy.Condition condition) {
            return deleteMatching(session, table, condition.predicate(), condition.batching(),
                    "using condition", results);
        }
        if (strategy instanceof DeleteStrategy.OlderThan olderThan) {
            String predicate = session.dialect().olderThan(olderThan.dateColumn(), threshold(olderThan.days()));
            return deleteMatching(session, table, predicate, olderThan.batching(),
                    "older than " + olderThan.days() + " days", results);
        }
        if (strategy instanceof DeleteStrategy.Invalid invalid) {
            results.warn(invalid.reason());
        }
        return DeletionSummary.skipped();
    }

    /**
     * First day that is <em>not</em> deleted: today minus {@code days}, in the clock's zone.
     */
    LocalDate threshold(int days) {
        return LocalDate.now(clock).minusDays(days);
    }

    private DeletionSummary truncate(SqlSession session, String table, ResultLog results) {
        try {
            executor.execute(session, session.dialect().truncate(table));
            results.info("Table `" + table + "` truncated successfully.");
            return DeletionSummary.completed(0, 0);
        } catch (SqlExecutionException e) {
            metrics.incrementStatementFailures();
            results.error("Error truncating table `" + table + "`: " + e.getMessage());
            return DeletionSummary.failed(0, 0);
        }
    }

    private DeletionSummary deleteMatching(SqlSession session, String table, String predicate,
            BatchSettings batching, String description, ResultLog results) {
        SqlDialect dialect = session.dialect();
        if (!batching.isBounded()) {
            try {
                SqlResult result = executor.execute(session, dialect.delete(table, predicate, 0));
                long affected = result.affectedRows();
                metrics.incrementRowsDeleted(affected);
                results.info("Deleted " + affected + " rows from `" + table + "` " + description + ".");
                return DeletionSummary.completed(affected, 1);
            } catch (SqlExecutionException e) {
                metrics.incrementStatementFailures();
                results.error("Error deleting rows from `" + table + "`: " + e.getMessage());
                return DeletionSummary.failed(0, 0);
            }
        }
        return deleteInBatches(session, table, dialect.delete(table, predicate, batching.size()), batching, results);
    }

    private DeletionSummary deleteInBatches(SqlSession session, String table, String sql,
            BatchSettings batching, ResultLog results) {
        boolean pace = !batching.delay().isZero() && !executor.mode().isDryRun();
        long totalDeleted = 0;
        int batches = 0;
        BatchOutcome outcome;
        do {
            long startNanos = System.nanoTime();
            try {
                SqlResult result = executor.execute(session, sql);
                outcome = BatchOutcome.of(result.affectedRows(), batching.size());
            } catch (SqlExecutionException e) {
                metrics.incrementStatementFailures();
                results.error("Error deleting rows from `" + table + "`: " + e.getMessage());
                return DeletionSummary.failed(totalDeleted, batches);
            }
            batches++;
            totalDeleted += outcome.affectedRows();
            metrics.incrementBatches();
            metrics.incrementRowsDeleted(outcome.affectedRows());
            metrics.recordBatchDurationMs(Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L));
            results.info("Batch deleted " + outcome.affectedRows() + " rows from `" + table + "`.");

            if (!outcome.terminal() && pace) {
                try {
                    pacer.pause(batching.delay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.error("Interrupted while deleting from `" + table + "` after "
                            + batches + " batches (" + totalDeleted + " rows deleted).");
                    return DeletionSummary.failed(totalDeleted, batches);
                }
            }
        } while (!outcome.terminal());

        logger.log(Level.INFO, "Deleted {0} rows from `{1}` in {2} batches",
                new Object[]{totalDeleted, table, batches});
        return DeletionSummary.completed(totalDeleted, batches);
    }
}
