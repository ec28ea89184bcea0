package io.dbmaint.jdbc.dialect;

import io.dbmaint.audit.ForeignKeyReference;
import io.dbmaint.jdbc.spi.Dialect;
import io.dbmaint.sql.Identifiers;
import io.dbmaint.sql.SqlExecutionException;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses supply the identifier quote character and can override methods to provide
 * database-specific SQL. Catalog access defaults to {@link DatabaseMetaData#getImportedKeys}.
 */
public abstract class AbstractDialect implements Dialect {

    /** Character placed around identifiers. */
    protected abstract char quoteChar();

    @Override
    public String quote(String identifier) {
        char q = quoteChar();
        return q + Identifiers.validate(identifier) + q;
    }

    @Override
    public String truncate(String table) {
        return "TRUNCATE TABLE " + quote(table);
    }

    @Override
    public String delete(String table, String predicate, int limit) {
        String sql = "DELETE FROM " + quote(table) + " WHERE " + predicate;
        return limit > 0 ? sql + limitClause(limit) : sql;
    }

    /** Row limit appended to a delete statement. */
    protected String limitClause(int limit) {
        return " LIMIT " + limit;
    }

    @Override
    public List<ForeignKeyReference> foreignKeys(Connection conn, String database, String table) {
        try {
            DatabaseMetaData meta = conn.getMetaData();
            try (ResultSet rs = importedKeys(meta, database, table)) {
                List<ForeignKeyReference> refs = new ArrayList<>();
                while (rs.next()) {
                    refs.add(new ForeignKeyReference(
                            rs.getString("FK_NAME"),
                            rs.getString("FKTABLE_NAME"),
                            rs.getString("FKCOLUMN_NAME"),
                            rs.getString("PKTABLE_NAME"),
                            rs.getString("PKCOLUMN_NAME")));
                }
                return refs;
            }
        } catch (SQLException e) {
            throw new SqlExecutionException(e.getMessage(), e);
        }
    }

    /**
     * Catalog lookup of imported keys. Databases disagree on whether a database maps to the JDBC
     * catalog or schema; the default treats it as a schema.
     */
    protected ResultSet importedKeys(DatabaseMetaData meta, String database, String table) throws SQLException {
        return meta.getImportedKeys(null, database, table);
    }
}
