package io.dbmaint.jdbc;

import io.dbmaint.sql.SqlExecutionException;
import io.dbmaint.sql.SqlResult;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JDBC helper to reduce boilerplate in sessions and dialects.
 */
public final class JdbcTemplate {

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /** Execute parameterized SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new SqlExecutionException(e.getMessage(), e);
        }
    }

    /**
     * Execute arbitrary statement text and drain every result it produces.
     *
     * <p>Keeps the rows of the first result set and the first update count; later results are read
     * and discarded so the connection is ready for the next statement.
     */
    public static SqlResult execute(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            boolean isResultSet = st.execute(sql);
            List<Map<String, Object>> rows = null;
            long affected = -1;
            while (true) {
                if (isResultSet) {
                    try (ResultSet rs = st.getResultSet()) {
                        List<Map<String, Object>> read = rows(rs);
                        if (rows == null) {
                            rows = read;
                        }
                    }
                } else {
                    int count = st.getUpdateCount();
                    if (count == -1) {
                        break;
                    }
                    if (affected < 0) {
                        affected = count;
                    }
                }
                isResultSet = st.getMoreResults();
            }
            return new SqlResult(rows != null ? rows : List.of(), rows != null, Math.max(affected, 0));
        }
    }

    /** Read all remaining rows as ordered column label to value maps. */
    public static List<Map<String, Object>> rows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private JdbcTemplate() {}
}
