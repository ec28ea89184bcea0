package io.dbmaint.spi;

import java.time.LocalDate;

/**
 * Builds the statement text for every maintenance operation.
 *
 * <p>This is the only place configuration values are turned into SQL. Identifiers are validated
 * and quoted; raw delete predicates from configuration are operator-authored and inserted verbatim,
 * so configuration files must be treated with the same trust as the database credentials.
 *
 * <p>Implemented by {@code io.dbmaint.jdbc.spi.Dialect}.
 */
public interface SqlDialect {

    /**
     * Quotes a validated identifier.
     *
     * @throws IllegalArgumentException if {@code identifier} is not a plain name
     */
    String quote(String identifier);

    /** Statement that makes {@code database} the active database/schema of the session. */
    String useDatabase(String database);

    /** Unconditional removal of all rows. */
    String truncate(String table);

    /**
     * Predicate-based delete.
     *
     * @param predicate raw {@code WHERE} clause body
     * @param limit     maximum rows to delete; {@code <= 0} for no limit
     */
    String delete(String table, String predicate, int limit);

    /** Post-delete space reclamation / statistics refresh. */
    String optimize(String table);

    /**
     * Age predicate: {@code dateColumn < 'threshold'} with the threshold in ISO date form.
     * Rows exactly at the threshold do not match.
     */
    default String olderThan(String dateColumn, LocalDate threshold) {
        return quote(dateColumn) + " < '" + threshold + "'";
    }
}
