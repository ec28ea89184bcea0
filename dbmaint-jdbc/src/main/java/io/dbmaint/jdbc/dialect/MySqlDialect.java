package io.dbmaint.jdbc.dialect;

import io.dbmaint.audit.ForeignKeyReference;
import io.dbmaint.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL dialect. Also compatible with MariaDB and TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

    private static final String FOREIGN_KEYS_SQL =
            "SELECT CONSTRAINT_NAME, TABLE_NAME, COLUMN_NAME, REFERENCED_TABLE_NAME, REFERENCED_COLUMN_NAME" +
            " FROM INFORMATION_SCHEMA.KEY_COLUMN_USAGE" +
            " WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND REFERENCED_TABLE_NAME IS NOT NULL" +
            " ORDER BY CONSTRAINT_NAME, ORDINAL_POSITION";

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
    }

    @Override
    protected char quoteChar() {
        return '`';
    }

    @Override
    public String useDatabase(String database) {
        return "USE " + quote(database);
    }

    @Override
    public String optimize(String table) {
        return "OPTIMIZE TABLE " + quote(table);
    }

    @Override
    public List<ForeignKeyReference> foreignKeys(Connection conn, String database, String table) {
        return JdbcTemplate.query(conn, FOREIGN_KEYS_SQL, rs -> new ForeignKeyReference(
                rs.getString("CONSTRAINT_NAME"),
                rs.getString("TABLE_NAME"),
                rs.getString("COLUMN_NAME"),
                rs.getString("REFERENCED_TABLE_NAME"),
                rs.getString("REFERENCED_COLUMN_NAME")), database, table);
    }
}
