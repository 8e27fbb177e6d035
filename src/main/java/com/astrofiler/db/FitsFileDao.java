package com.astrofiler.db;

import com.astrofiler.model.FitsFile;
import com.astrofiler.model.ImageType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.astrofiler.db.JdbcSupport.getDateTime;
import static com.astrofiler.db.JdbcSupport.getDouble;
import static com.astrofiler.db.JdbcSupport.setDateTime;
import static com.astrofiler.db.JdbcSupport.setDouble;

public final class FitsFileDao {
    private static final String COLUMNS = "id, path, capture_date, image_type, object_name, exposure, " +
            "x_binning, y_binning, ccd_temp, telescope, instrument, gain, offset_value, filter_name, " +
            "content_hash, calibrated, session_id";

    private final Database database;

    public FitsFileDao(Database database) {
        this.database = database;
    }

    public void insert(FitsFile f) throws SQLException {
        String sql = "INSERT INTO fits_file(" + COLUMNS + ", registered_at) " +
                "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, f.id);
            ps.setString(2, f.path);
            setDateTime(ps, 3, f.captureDate);
            ps.setString(4, f.type == null ? null : f.type.label());
            ps.setString(5, f.objectName);
            setDouble(ps, 6, f.exposure);
            ps.setInt(7, f.xBinning);
            ps.setInt(8, f.yBinning);
            setDouble(ps, 9, f.ccdTemp);
            ps.setString(10, f.telescope);
            ps.setString(11, f.instrument);
            setDouble(ps, 12, f.gain);
            setDouble(ps, 13, f.offset);
            ps.setString(14, f.filter);
            ps.setString(15, f.contentHash);
            ps.setInt(16, f.calibrated ? 1 : 0);
            ps.setString(17, f.sessionId);
            ps.setString(18, Instant.now().toString());
            ps.executeUpdate();
        }
    }

    public Optional<FitsFile> findById(String id) throws SQLException {
        List<FitsFile> rows = query("SELECT " + COLUMNS + " FROM fits_file WHERE id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Id of the earliest registered file with this content hash. */
    public Optional<String> findIdByHash(String hash) throws SQLException {
        String sql = "SELECT id FROM fits_file WHERE content_hash = ? ORDER BY rowid LIMIT 1";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, hash);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString(1));
                }
            }
        }
        return Optional.empty();
    }

    public List<FitsFile> findByHash(String hash) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM fits_file WHERE content_hash = ? ORDER BY rowid", hash);
    }

    public List<String> findDuplicateHashes() throws SQLException {
        String sql = "SELECT content_hash FROM fits_file WHERE content_hash IS NOT NULL " +
                "GROUP BY content_hash HAVING COUNT(*) > 1 ORDER BY content_hash";
        List<String> out = new ArrayList<>();
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
        }
        return out;
    }

    /** Files of the given kind with no session yet, oldest capture first. */
    public List<FitsFile> findUnassigned(boolean lights) throws SQLException {
        String typeFilter = lights ? "image_type = 'Light'" : "image_type IN ('Bias', 'Dark', 'Flat')";
        return query("SELECT " + COLUMNS + " FROM fits_file WHERE session_id IS NULL AND " + typeFilter +
                " ORDER BY capture_date, id");
    }

    public List<FitsFile> findBySession(String sessionId) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM fits_file WHERE session_id = ? ORDER BY capture_date, id", sessionId);
    }

    public List<FitsFile> findAll() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM fits_file ORDER BY rowid");
    }

    /** Assigns a session only if the file has none. Returns false when it was already assigned. */
    public boolean assignSession(String fileId, String sessionId) throws SQLException {
        String sql = "UPDATE fits_file SET session_id = ? WHERE id = ? AND session_id IS NULL";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setString(2, fileId);
            return ps.executeUpdate() == 1;
        }
    }

    public int clearSessionReferences() throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            return st.executeUpdate("UPDATE fits_file SET session_id = NULL WHERE session_id IS NOT NULL");
        }
    }

    public void updatePath(String id, String path) throws SQLException {
        String sql = "UPDATE fits_file SET path = ? WHERE id = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, path);
            ps.setString(2, id);
            ps.executeUpdate();
        }
    }

    /** Persists the fields that header mappings may rewrite. */
    public void updateMappedFields(FitsFile f) throws SQLException {
        String sql = "UPDATE fits_file SET telescope = ?, instrument = ?, object_name = ?, filter_name = ? WHERE id = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, f.telescope);
            ps.setString(2, f.instrument);
            ps.setString(3, f.objectName);
            ps.setString(4, f.filter);
            ps.setString(5, f.id);
            ps.executeUpdate();
        }
    }

    public void delete(String id) throws SQLException {
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM fits_file WHERE id = ?")) {
            ps.setString(1, id);
            ps.executeUpdate();
        }
    }

    public int count() throws SQLException {
        try (Connection conn = database.connect();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM fits_file")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private List<FitsFile> query(String sql, String... params) throws SQLException {
        List<FitsFile> out = new ArrayList<>();
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        }
        return out;
    }

    private FitsFile map(ResultSet rs) throws SQLException {
        FitsFile f = new FitsFile();
        f.id = rs.getString("id");
        f.path = rs.getString("path");
        f.captureDate = getDateTime(rs, "capture_date");
        f.type = ImageType.fromLabel(rs.getString("image_type")).orElse(null);
        f.objectName = rs.getString("object_name");
        f.exposure = getDouble(rs, "exposure");
        f.xBinning = rs.getInt("x_binning");
        f.yBinning = rs.getInt("y_binning");
        f.ccdTemp = getDouble(rs, "ccd_temp");
        f.telescope = rs.getString("telescope");
        f.instrument = rs.getString("instrument");
        f.gain = getDouble(rs, "gain");
        f.offset = getDouble(rs, "offset_value");
        f.filter = rs.getString("filter_name");
        f.contentHash = rs.getString("content_hash");
        f.calibrated = rs.getInt("calibrated") != 0;
        f.sessionId = rs.getString("session_id");
        return f;
    }
}
