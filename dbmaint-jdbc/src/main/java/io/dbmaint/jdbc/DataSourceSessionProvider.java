package io.dbmaint.jdbc;

import io.dbmaint.SessionException;
import io.dbmaint.jdbc.dialect.Dialects;
import io.dbmaint.jdbc.spi.Dialect;
import io.dbmaint.spi.SessionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link SessionProvider} backed by a {@link DataSource}.
 *
 * <p>Each session holds one connection with auto-commit disabled. Without an explicit dialect the
 * dialect is detected from the connection's JDBC URL.
 *
 * @see Dialects#detect(String)
 */
public final class DataSourceSessionProvider implements SessionProvider {
    private final DataSource dataSource;
    private final Dialect dialect;

    public DataSourceSessionProvider(DataSource dataSource) {
        this(dataSource, null);
    }

    public DataSourceSessionProvider(DataSource dataSource, Dialect dialect) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.dialect = dialect;
    }

    @Override
    public JdbcSqlSession openSession() {
        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            throw new SessionException(e.getMessage(), e);
        }
        try {
            conn.setAutoCommit(false);
            Dialect resolved = dialect != null ? dialect : Dialects.detect(conn.getMetaData().getURL());
            return new JdbcSqlSession(conn, resolved);
        } catch (SQLException | IllegalArgumentException e) {
            closeQuietly(conn, e);
            throw new SessionException(e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection conn, Exception cause) {
        try {
            conn.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
