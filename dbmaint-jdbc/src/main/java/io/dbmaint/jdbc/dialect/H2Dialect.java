package io.dbmaint.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>A database maps to an H2 schema. Optimize refreshes the table's selectivity statistics.
 */
public final class H2Dialect extends AbstractDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    protected char quoteChar() {
        return '"';
    }

    @Override
    public String useDatabase(String database) {
        return "SET SCHEMA " + quote(database);
    }

    @Override
    protected String limitClause(int limit) {
        return " FETCH FIRST " + limit + " ROWS ONLY";
    }

    @Override
    public String optimize(String table) {
        return "ANALYZE TABLE " + quote(table);
    }
}
