package io.dbmaint.run;

import io.dbmaint.ResultLog;
import io.dbmaint.audit.ForeignKeyAuditor;
import io.dbmaint.delete.BatchedDeletionEngine;
import io.dbmaint.delete.DeletionSummary;
import io.dbmaint.dump.BackupGate;
import io.dbmaint.dump.DumpResult;
import io.dbmaint.model.DeleteStrategy;
import io.dbmaint.model.TableSpec;
import io.dbmaint.spi.MetricsExporter;
import io.dbmaint.spi.SqlSession;
import io.dbmaint.sql.SqlExecutionException;
import io.dbmaint.sql.SqlExecutor;
import io.dbmaint.sql.SqlResult;

import java.util.Objects;

/**
 * Runs the configured steps for one table in fixed order:
 * dump, foreign-key audit, delete, optimize.
 *
 * <p>A failed dump ends processing of the table before anything destructive runs. Every other
 * failure is reported and the next step still runs. Each step appends at least one entry to the
 * result log, including skips and errors.
 */
public final class TableProcessor {
    private final BackupGate backupGate;
    private final ForeignKeyAuditor auditor;
    private final BatchedDeletionEngine deletionEngine;
    private final SqlExecutor executor;
    private final MetricsExporter metrics;

    public TableProcessor(BackupGate backupGate, ForeignKeyAuditor auditor, BatchedDeletionEngine deletionEngine,
            SqlExecutor executor, MetricsExporter metrics) {
        this.backupGate = Objects.requireNonNull(backupGate, "backupGate");
        this.auditor = Objects.requireNonNull(auditor, "auditor");
        this.deletionEngine = Objects.requireNonNull(deletionEngine, "deletionEngine");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public TableStatus process(SqlSession session, String database, TableSpec table, ResultLog results) {
        String name = table.name();
        results.info("Processing table `" + database + "`.`" + name + "`");
        boolean errors = false;

        if (table.dump().isPresent()) {
            DumpResult dump = backupGate.dumpTable(database, name, table.dump().get(), results);
            if (dump instanceof DumpResult.Failed failed) {
                metrics.incrementTablesAborted();
                results.error("Dump of `" + database + "`.`" + name + "` failed: " + failed.reason()
                        + "; skipping remaining steps for `" + name + "`");
                return TableStatus.ABORTED;
            }
        }

        if (table.checkForeignKeys()) {
            auditor.audit(session, database, name, results);
        }

        DeleteStrategy strategy = table.deleteStrategy();
        if (!(strategy instanceof DeleteStrategy.None)) {
            DeletionSummary summary = deletionEngine.delete(session, name, strategy, results);
            errors |= summary.failed() || strategy instanceof DeleteStrategy.Invalid;
        }

        if (table.runOptimize()) {
            errors |= !optimize(session, name, results);
        }

        return errors ? TableStatus.COMPLETED_WITH_ERRORS : TableStatus.COMPLETED;
    }

    private boolean optimize(SqlSession session, String table, ResultLog results) {
        try {
            SqlResult result = executor.execute(session, session.dialect().optimize(table));
            if (result.hasRows()) {
                results.info("Optimized `" + table + "`: " + result.rows());
            } else {
                results.info("Optimized `" + table + "`.");
            }
            return true;
        } catch (SqlExecutionException e) {
            metrics.incrementStatementFailures();
            results.error("Error optimizing table `" + table + "`: " + e.getMessage());
            return false;
        }
    }
}
