package io.dbmaint;

/**
 * Process-wide execution mode of a maintenance run.
 *
 * <p>In {@link #DRY_RUN} every destructive or I/O-producing action is simulated: the statement or
 * command that would run is logged, nothing is mutated, written or uploaded, and affected-row
 * counts are reported as zero. Control flow is otherwise identical to {@link #LIVE}.
 */
public enum ExecutionMode {
    LIVE,
    DRY_RUN;

    public boolean isDryRun() {
        return this == DRY_RUN;
    }

    public static ExecutionMode of(boolean dryRun) {
        return dryRun ? DRY_RUN : LIVE;
    }
}
