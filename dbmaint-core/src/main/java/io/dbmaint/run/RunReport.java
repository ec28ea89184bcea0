package io.dbmaint.run;

import java.util.List;

/**
 * Summary of a maintenance run.
 *
 * @param results              the run's result log, in original order
 * @param tablesProcessed      tables handed to the table processor
 * @param tablesAborted        tables stopped by a failed dump
 * @param tablesWithErrors     tables that finished with at least one failed step
 * @param groupsSkipped        database groups skipped because the database could not be selected
 * @param connectionFailed     whether the session could not be opened at all
 * @param runFailed            whether an unexpected error ended the run early
 */
public record RunReport(
        List<String> results,
        int tablesProcessed,
        int tablesAborted,
        int tablesWithErrors,
        int groupsSkipped,
        boolean connectionFailed,
        boolean runFailed) {

    public RunReport {
        results = List.copyOf(results);
    }

    /**
     * Whether the run went through every configured group. Per-table errors do not count.
     */
    public boolean completed() {
        return !connectionFailed && !runFailed;
    }
}
