package io.dbmaint.audit;

import io.dbmaint.ResultLog;
import io.dbmaint.sql.SqlExecutionException;
import io.dbmaint.spi.SqlSession;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Advisory foreign-key audit. Reports which columns of a table reference other tables.
 *
 * <p>The audit is read-only, so it also runs in dry-run. Its outcome never blocks the delete step:
 * catalog errors are reported and swallowed here.
 */
public final class ForeignKeyAuditor {
    private static final Logger logger = Logger.getLogger(ForeignKeyAuditor.class.getName());

    /**
     * Audits {@code table} and appends exactly one entry to {@code results}.
     *
     * @return the references found; empty if none were found or the audit failed
     */
    public List<ForeignKeyReference> audit(SqlSession session, String database, String table, ResultLog results) {
        logger.log(Level.INFO, "Checking foreign keys for table `{0}`.`{1}`", new Object[]{database, table});
        try {
            List<ForeignKeyReference> references = session.foreignKeys(database, table);
            if (references.isEmpty()) {
                results.info("No foreign keys found for `" + table + "`.");
            } else {
                results.info("Foreign keys found for `" + table + "`: " + references);
            }
            return references;
        } catch (SqlExecutionException e) {
            logger.log(Level.FINE, "Foreign key audit failed for " + table, e);
            results.error("Error checking foreign keys for `" + table + "`: " + e.getMessage());
            return List.of();
        }
    }
}
