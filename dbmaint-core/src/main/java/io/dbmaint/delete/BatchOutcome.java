package io.dbmaint.delete;

/**
 * Result of one bounded delete statement.
 *
 * @param affectedRows rows deleted by the batch ({@code 0} in dry-run)
 * @param terminal     whether the loop stops after this batch
 */
public record BatchOutcome(long affectedRows, boolean terminal) {

    /**
     * A batch is terminal when it deleted fewer rows than requested. This also covers a final
     * partial batch with {@code affectedRows > 0}, and a zero-row batch.
     *
     * <p>A concurrent writer shrinking the matching set mid-run can make a batch look terminal
     * while matching rows remain; they are picked up by the next run.
     */
    public static BatchOutcome of(long affectedRows, int requested) {
        return new BatchOutcome(affectedRows, affectedRows < requested);
    }
}
