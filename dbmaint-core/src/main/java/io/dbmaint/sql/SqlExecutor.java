package io.dbmaint.sql;

import io.dbmaint.ExecutionMode;
import io.dbmaint.spi.SqlSession;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs mutating statements, honoring the run's {@link ExecutionMode}.
 *
 * <p>In dry-run nothing reaches the session and {@link SqlResult#NONE} is returned, so callers
 * see zero affected rows and no result set. In live mode the session executes the statement,
 * drains secondary results and commits.
 */
public final class SqlExecutor {
    private static final Logger logger = Logger.getLogger(SqlExecutor.class.getName());

    private final ExecutionMode mode;

    public SqlExecutor(ExecutionMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * Executes {@code sql} on {@code session}, or only logs it in dry-run.
     *
     * @throws SqlExecutionException in live mode if the driver reports an error
     */
    public SqlResult execute(SqlSession session, String sql) {
        logger.log(Level.INFO, "Executing SQL: {0}", sql);
        if (mode.isDryRun()) {
            logger.log(Level.INFO, "[DRY RUN] Would execute SQL: {0}", sql);
            return SqlResult.NONE;
        }
        return session.execute(sql);
    }

    public ExecutionMode mode() {
        return mode;
    }
}
