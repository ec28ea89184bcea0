package io.dbmaint.jdbc.spi;

import io.dbmaint.audit.ForeignKeyReference;
import io.dbmaint.spi.SqlDialect;

import java.sql.Connection;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific statement text and catalog access.
 * Register custom dialects via {@code META-INF/services/io.dbmaint.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ MariaDB, TiDB), H2.
 *
 * @see io.dbmaint.jdbc.dialect.Dialects
 */
public interface Dialect extends SqlDialect {

    /**
     * Unique identifier for this dialect (e.g., "mysql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * Reads the foreign keys declared on {@code database.table}, one entry per referencing column.
     *
     * @throws io.dbmaint.sql.SqlExecutionException if the catalog cannot be read
     */
    List<ForeignKeyReference> foreignKeys(Connection conn, String database, String table);
}
