package io.dbmaint.spi;

import io.dbmaint.audit.ForeignKeyReference;
import io.dbmaint.sql.SqlExecutionException;
import io.dbmaint.sql.SqlResult;

import java.util.List;

/**
 * An open, authenticated database session.
 *
 * <p>The session is owned by the {@link io.dbmaint.run.RunCoordinator}; other components receive it
 * for the duration of a single call and must not retain it.
 *
 * <p>Implemented by {@code io.dbmaint.jdbc.JdbcSqlSession}.
 */
public interface SqlSession extends AutoCloseable {

    /**
     * Executes one statement, drains every secondary result, and commits.
     *
     * @param sql statement text
     * @return the first result set's rows and the first update count
     * @throws SqlExecutionException if the driver reports an error
     */
    SqlResult execute(String sql);

    /**
     * Reads catalog metadata for columns of {@code table} that reference other tables.
     *
     * @throws SqlExecutionException if the catalog cannot be read
     */
    List<ForeignKeyReference> foreignKeys(String database, String table);

    /**
     * Statement builder matching the database behind this session.
     */
    SqlDialect dialect();

    /**
     * Closes the underlying connection. Must be safe to call more than once.
     */
    @Override
    void close();
}
