package io.dbmaint.sql;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one executed statement.
 *
 * @param rows         rows of the first result set, each an ordered column label to value map;
 *                     empty when the statement produced no result set
 * @param hasRows      whether the statement produced a result set at all
 * @param affectedRows first update count reported by the statement, {@code 0} if none
 */
public record SqlResult(List<Map<String, Object>> rows, boolean hasRows, long affectedRows) {

    /** Sentinel returned for simulated statements and statements without results. */
    public static final SqlResult NONE = new SqlResult(List.of(), false, 0);

    public SqlResult {
        rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        if (affectedRows < 0) {
            throw new IllegalArgumentException("affectedRows must be >= 0");
        }
    }

    public static SqlResult ofRows(List<Map<String, Object>> rows) {
        return new SqlResult(rows, true, 0);
    }

    public static SqlResult ofUpdateCount(long affectedRows) {
        return new SqlResult(List.of(), false, affectedRows);
    }
}
