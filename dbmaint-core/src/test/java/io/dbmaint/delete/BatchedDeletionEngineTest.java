package io.dbmaint.delete;

import io.dbmaint.ExecutionMode;
import io.dbmaint.RecordingMetrics;
import io.dbmaint.RecordingSqlSession;
import io.dbmaint.ResultLog;
import io.dbmaint.model.BatchSettings;
import io.dbmaint.model.DeleteStrategy;
import io.dbmaint.sql.SqlExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchedDeletionEngineTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    private final List<Duration> pauses = new ArrayList<>();
    private final Pacer recordingPacer = pauses::add;
    private final RecordingMetrics metrics = new RecordingMetrics();
    private final ResultLog results = new ResultLog();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private BatchedDeletionEngine engine(ExecutionMode mode, Pacer pacer) {
        return new BatchedDeletionEngine(new SqlExecutor(mode), pacer, CLOCK, metrics);
    }

    private static DeleteStrategy condition(int batchSize, Duration delay) {
        return new DeleteStrategy.Condition("status = 'done'", BatchSettings.of(batchSize, delay));
    }

    @Test
    void batchedDeleteStopsOnFirstShortBatchAndPacesBetweenBatches() {
        RecordingSqlSession session = new RecordingSqlSession(250);

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "orders", condition(100, Duration.ofSeconds(1)), results);

        assertEquals(DeletionSummary.Status.COMPLETED, summary.status());
        assertEquals(250, summary.rowsDeleted());
        assertEquals(3, summary.batches());
        assertEquals(List.of(
                "Batch deleted 100 rows from `orders`.",
                "Batch deleted 100 rows from `orders`.",
                "Batch deleted 50 rows from `orders`."), results.entries());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), pauses);
        assertEquals(0, session.matchingRows);
        assertEquals(250, metrics.rowsDeleted.get());
        assertEquals(3, metrics.batches.get());
    }

    @Test
    void exactMultipleOfBatchSizeNeedsOneEmptyBatch() {
        RecordingSqlSession session = new RecordingSqlSession(200);

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "orders", condition(100, Duration.ofMillis(10)), results);

        assertEquals(3, summary.batches());
        assertEquals(200, summary.rowsDeleted());
        assertEquals("Batch deleted 0 rows from `orders`.", results.entries().get(2));
        assertEquals(2, pauses.size());
    }

    @Test
    void noMatchingRowsIssuesSingleBatch() {
        RecordingSqlSession session = new RecordingSqlSession(0);

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "orders", condition(100, Duration.ofSeconds(1)), results);

        assertEquals(1, summary.batches());
        assertEquals(List.of("Batch deleted 0 rows from `orders`."), results.entries());
        assertTrue(pauses.isEmpty());
    }

    @Test
    void zeroDelayNeverPauses() {
        RecordingSqlSession session = new RecordingSqlSession(350);

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "orders", condition(100, Duration.ZERO), results);

        assertEquals(4, summary.batches());
        assertTrue(pauses.isEmpty());
    }

    @Test
    void dryRunSimulatesOneBatchWithoutTouchingSession() {
        RecordingSqlSession session = new RecordingSqlSession(250);

        DeletionSummary summary = engine(ExecutionMode.DRY_RUN, recordingPacer)
                .delete(session, "orders", condition(100, Duration.ofSeconds(1)), results);

        assertEquals(1, summary.batches());
        assertEquals(0, summary.rowsDeleted());
        assertEquals(List.of("Batch deleted 0 rows from `orders`."), results.entries());
        assertTrue(session.statements.isEmpty());
        assertTrue(pauses.isEmpty());
        assertEquals(250, session.matchingRows);
    }

    @Test
    void unboundedDeleteIsSingleStatement() {
        RecordingSqlSession session = new RecordingSqlSession(250);

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "orders", new DeleteStrategy.Condition("status = 'done'", null), results);

        assertEquals(250, summary.rowsDeleted());
        assertEquals(List.of("DELETE FROM `orders` WHERE status = 'done'"), session.statements);
        assertEquals(List.of("Deleted 250 rows from `orders` using condition."), results.entries());
    }

    @Test
    void olderThanComparesStrictlyAgainstThresholdDate() {
        RecordingSqlSession session = new RecordingSqlSession(5);
        BatchedDeletionEngine engine = engine(ExecutionMode.LIVE, recordingPacer);

        engine.delete(session, "events", new DeleteStrategy.OlderThan(30, "created_at", null), results);

        assertEquals(LocalDate.of(2024, 2, 14), engine.threshold(30));
        assertEquals(List.of("DELETE FROM `events` WHERE `created_at` < '2024-02-14'"), session.statements);
        assertEquals(List.of("Deleted 5 rows from `events` older than 30 days."), results.entries());
    }

    @Test
    void olderThanDefaultsToDateColumnAndBatches() {
        RecordingSqlSession session = new RecordingSqlSession(3);

        engine(ExecutionMode.LIVE, recordingPacer).delete(session, "events",
                new DeleteStrategy.OlderThan(0, null, BatchSettings.of(2, Duration.ZERO)), results);

        assertEquals("DELETE FROM `events` WHERE `date` < '2024-03-15' LIMIT 2", session.statements.get(0));
        assertEquals(2, session.statements.size());
    }

    @Test
    void truncateIsIdempotent() {
        RecordingSqlSession session = new RecordingSqlSession(10);
        BatchedDeletionEngine engine = engine(ExecutionMode.LIVE, recordingPacer);

        DeletionSummary first = engine.delete(session, "logs", DeleteStrategy.TRUNCATE, results);
        DeletionSummary second = engine.delete(session, "logs", DeleteStrategy.TRUNCATE, results);

        assertEquals(DeletionSummary.Status.COMPLETED, first.status());
        assertEquals(DeletionSummary.Status.COMPLETED, second.status());
        assertEquals(List.of(
                "Table `logs` truncated successfully.",
                "Table `logs` truncated successfully."), results.entries());
    }

    @Test
    void truncateErrorIsReportedWithTableName() {
        RecordingSqlSession session = new RecordingSqlSession();
        session.failOn = sql -> sql.startsWith("TRUNCATE");

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "logs", DeleteStrategy.TRUNCATE, results);

        assertTrue(summary.failed());
        assertEquals(List.of("Error truncating table `logs`: boom"), results.entries());
        assertEquals(1, metrics.statementFailures.get());
    }

    @Test
    void statementErrorMidwayKeepsCommittedBatches() {
        RecordingSqlSession session = new RecordingSqlSession(250);
        int[] calls = {0};
        session.failOn = sql -> ++calls[0] == 2;

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "orders", condition(100, Duration.ZERO), results);

        assertTrue(summary.failed());
        assertEquals(100, summary.rowsDeleted());
        assertEquals(1, summary.batches());
        assertEquals("Error deleting rows from `orders`: boom", results.entries().get(1));
    }

    @Test
    void interruptDuringPacingStopsAndRestoresFlag() {
        RecordingSqlSession session = new RecordingSqlSession(250);
        Pacer interrupting = delay -> {
            throw new InterruptedException();
        };

        DeletionSummary summary = engine(ExecutionMode.LIVE, interrupting)
                .delete(session, "orders", condition(100, Duration.ofSeconds(1)), results);

        assertTrue(Thread.currentThread().isInterrupted());
        assertTrue(summary.failed());
        assertEquals(1, summary.batches());
        assertEquals("Interrupted while deleting from `orders` after 1 batches (100 rows deleted).",
                results.entries().get(1));
    }

    @Test
    void invalidStrategyIsReportedAndSkipped() {
        RecordingSqlSession session = new RecordingSqlSession(10);

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer).delete(session, "orders",
                new DeleteStrategy.Invalid("No delete_condition provided for `orders` with condition strategy."),
                results);

        assertEquals(DeletionSummary.Status.SKIPPED, summary.status());
        assertEquals(List.of("No delete_condition provided for `orders` with condition strategy."),
                results.entries());
        assertTrue(session.statements.isEmpty());
    }

    @Test
    void noneStrategyDoesNothing() {
        RecordingSqlSession session = new RecordingSqlSession(10);

        DeletionSummary summary = engine(ExecutionMode.LIVE, recordingPacer)
                .delete(session, "orders", DeleteStrategy.NONE, results);

        assertFalse(summary.failed());
        assertEquals(0, results.size());
    }

    @Test
    void batchOutcomeIsTerminalWhenShort() {
        assertTrue(BatchOutcome.of(99, 100).terminal());
        assertFalse(BatchOutcome.of(100, 100).terminal());
        assertTrue(BatchOutcome.of(0, 100).terminal());
    }
}
