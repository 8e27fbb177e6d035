package com.astrofiler.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Null-aware column helpers shared by the DAOs. Timestamps are stored as ISO-8601 text.
 */
final class JdbcSupport {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private JdbcSupport() {
    }

    static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.REAL);
        else ps.setDouble(idx, v);
    }

    static void setInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.INTEGER);
        else ps.setInt(idx, v);
    }

    static void setDateTime(PreparedStatement ps, int idx, LocalDateTime v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.VARCHAR);
        else ps.setString(idx, format(v));
    }

    /** Fixed-width form so that text comparison orders timestamps. */
    static String format(LocalDateTime v) {
        return v.format(TIMESTAMP);
    }

    static Double getDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    static Integer getInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    static LocalDateTime getDateTime(ResultSet rs, String column) throws SQLException {
        String v = rs.getString(column);
        return v == null || v.isEmpty() ? null : LocalDateTime.parse(v);
    }
}
