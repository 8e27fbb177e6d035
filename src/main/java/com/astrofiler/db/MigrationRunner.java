package com.astrofiler.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent SQLite schema creation.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);

    public void run(Database database) throws SQLException {
        String lastSql = "";
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            for (String sql : buildStatements()) {
                lastSql = sql;
                st.execute(sql);
            }
        } catch (SQLException e) {
            String detail = "migration_failed: failed_sql=" + summarize(lastSql) + ", cause=" + e.getMessage();
            LOG.error(detail);
            throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    private List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS fits_file (" +
                "id TEXT PRIMARY KEY," +
                "path TEXT NOT NULL," +
                "capture_date TEXT NULL," +
                "image_type TEXT NULL," +
                "object_name TEXT NULL," +
                "exposure REAL NULL," +
                "x_binning INTEGER NOT NULL DEFAULT 1," +
                "y_binning INTEGER NOT NULL DEFAULT 1," +
                "ccd_temp REAL NULL," +
                "telescope TEXT NULL," +
                "instrument TEXT NULL," +
                "gain REAL NULL," +
                "offset_value REAL NULL," +
                "filter_name TEXT NULL," +
                "content_hash TEXT NULL," +
                "calibrated INTEGER NOT NULL DEFAULT 0," +
                "session_id TEXT NULL," +
                "registered_at TEXT NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_fits_file_hash ON fits_file(content_hash)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_fits_file_session ON fits_file(session_id)");

        sqls.add("CREATE TABLE IF NOT EXISTS fits_session (" +
                "id TEXT PRIMARY KEY," +
                "object_name TEXT NOT NULL," +
                "session_date TEXT NULL," +
                "telescope TEXT NULL," +
                "imager TEXT NULL," +
                "x_binning INTEGER NULL," +
                "y_binning INTEGER NULL," +
                "ccd_temp REAL NULL," +
                "gain REAL NULL," +
                "offset_value REAL NULL," +
                "filter_name TEXT NULL," +
                "exposure REAL NULL," +
                "bias_session TEXT NULL," +
                "dark_session TEXT NULL," +
                "flat_session TEXT NULL," +
                "bias_master TEXT NULL," +
                "dark_master TEXT NULL," +
                "flat_master TEXT NULL" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS master (" +
                "id TEXT PRIMARY KEY," +
                "master_type TEXT NOT NULL," +
                "telescope TEXT NULL," +
                "instrument TEXT NULL," +
                "exposure REAL NULL," +
                "filter_name TEXT NULL," +
                "x_binning INTEGER NOT NULL DEFAULT 1," +
                "y_binning INTEGER NOT NULL DEFAULT 1," +
                "ccd_temp REAL NULL," +
                "gain REAL NULL," +
                "offset_value REAL NULL," +
                "path TEXT NOT NULL," +
                "content_hash TEXT NULL," +
                "file_size INTEGER NOT NULL DEFAULT 0," +
                "frame_count INTEGER NOT NULL DEFAULT 0," +
                "source_session_id TEXT NULL," +
                "validated INTEGER NOT NULL DEFAULT 0," +
                "validation_date TEXT NULL," +
                "creation_date TEXT NOT NULL," +
                "soft_deleted INTEGER NOT NULL DEFAULT 0" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS header_mapping (" +
                "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "header_field TEXT NOT NULL," +
                "old_value TEXT NOT NULL," +
                "new_value TEXT NOT NULL" +
                ")");
        return sqls;
    }

    private String summarize(String sql) {
        if (sql == null) return "";
        String s = sql.replaceAll("\\s+", " ").trim();
        return s.length() > 120 ? s.substring(0, 120) + "..." : s;
    }
}
