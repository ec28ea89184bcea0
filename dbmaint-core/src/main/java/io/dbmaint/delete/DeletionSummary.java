package io.dbmaint.delete;

/**
 * Outcome of the delete step for one table.
 *
 * @param status      how the step ended
 * @param rowsDeleted total rows deleted across all batches (always {@code 0} in dry-run)
 * @param batches     delete statements issued; {@code 0} for truncate and skipped steps
 */
public record DeletionSummary(Status status, long rowsDeleted, int batches) {

    public enum Status {
        COMPLETED,
        /** Nothing configured, or the configuration was defective. */
        SKIPPED,
        FAILED
    }

    static DeletionSummary completed(long rowsDeleted, int batches) {
        return new DeletionSummary(Status.COMPLETED, rowsDeleted, batches);
    }

    static DeletionSummary skipped() {
        return new DeletionSummary(Status.SKIPPED, 0, 0);
    }

    static DeletionSummary failed(long rowsDeleted, int batches) {
        return new DeletionSummary(Status.FAILED, rowsDeleted, batches);
    }

    public boolean failed() {
        return status == Status.FAILED;
    }
}
