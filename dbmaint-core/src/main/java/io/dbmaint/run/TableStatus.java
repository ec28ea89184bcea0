package io.dbmaint.run;

/**
 * How processing of one table ended.
 */
public enum TableStatus {
    /** Every configured step succeeded (or was simulated). */
    COMPLETED,
    /** All steps ran, but at least one reported an error or a configuration defect. */
    COMPLETED_WITH_ERRORS,
    /** The requested dump failed; no destructive step ran. */
    ABORTED
}
