package com.astrofiler.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection factory for the SQLite catalogue file.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);

    private final Path file;
    private final String jdbcUrl;

    public Database(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("database file must not be null");
        }
        this.file = file.toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.file;
    }

    public Connection connect() throws SQLException {
        try {
            Path parent = file.getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
            }
            return configure(DriverManager.getConnection(jdbcUrl));
        } catch (SQLException e) {
            LOG.error("DB connect failed: url={}, cause={}", jdbcUrl, e.getMessage());
            throw e;
        } catch (IOException e) {
            throw new SQLException("Cannot create database directory for " + file, e);
        }
    }

    /** Applies connection settings; the connection is closed if that fails. */
    static Connection configure(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout = 5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public Path file() {
        return file;
    }
}
