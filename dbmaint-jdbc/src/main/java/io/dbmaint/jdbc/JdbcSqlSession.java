package io.dbmaint.jdbc;

import io.dbmaint.audit.ForeignKeyReference;
import io.dbmaint.jdbc.spi.Dialect;
import io.dbmaint.spi.SqlDialect;
import io.dbmaint.spi.SqlSession;
import io.dbmaint.sql.SqlExecutionException;
import io.dbmaint.sql.SqlResult;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SqlSession} over a single JDBC {@link Connection} with auto-commit disabled.
 *
 * <p>Every statement is committed on success and rolled back on failure, so a failed statement
 * never leaves the session in a half-finished transaction. Catalog reads are delegated to the
 * {@link Dialect}.
 */
public final class JdbcSqlSession implements SqlSession {
    private static final Logger logger = Logger.getLogger(JdbcSqlSession.class.getName());

    private final Connection connection;
    private final Dialect dialect;
    private boolean closed;

    public JdbcSqlSession(Connection connection, Dialect dialect) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    @Override
    public SqlResult execute(String sql) {
        try {
            SqlResult result = JdbcTemplate.execute(connection, sql);
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            return result;
        } catch (SQLException e) {
            rollback(e);
            throw new SqlExecutionException(e.getMessage(), e);
        }
    }

    @Override
    public List<ForeignKeyReference> foreignKeys(String database, String table) {
        return dialect.foreignKeys(connection, database, table);
    }

    @Override
    public SqlDialect dialect() {
        return dialect;
    }

    public Connection connection() {
        return connection;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to close database connection", e);
        }
    }

    private void rollback(SQLException cause) {
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.log(Level.WARNING, "Rollback after failed statement did not succeed", e);
        }
    }
}
