package io.dbmaint;

import io.dbmaint.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class RecordingMetrics implements MetricsExporter {
    public final AtomicLong rowsDeleted = new AtomicLong();
    public final AtomicInteger batches = new AtomicInteger();
    public final AtomicInteger dumpsCompleted = new AtomicInteger();
    public final AtomicInteger dumpsFailed = new AtomicInteger();
    public final AtomicInteger statementFailures = new AtomicInteger();
    public final AtomicInteger tablesAborted = new AtomicInteger();

    @Override
    public void incrementRowsDeleted(long rows) {
        rowsDeleted.addAndGet(rows);
    }

    @Override
    public void incrementBatches() {
        batches.incrementAndGet();
    }

    @Override
    public void incrementDumpsCompleted() {
        dumpsCompleted.incrementAndGet();
    }

    @Override
    public void incrementDumpsFailed() {
        dumpsFailed.incrementAndGet();
    }

    @Override
    public void incrementStatementFailures() {
        statementFailures.incrementAndGet();
    }

    @Override
    public void incrementTablesAborted() {
        tablesAborted.incrementAndGet();
    }
}
