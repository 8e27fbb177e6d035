package com.astrofiler.db;

import com.astrofiler.model.ImageType;
import com.astrofiler.model.Master;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.astrofiler.db.JdbcSupport.getDateTime;
import static com.astrofiler.db.JdbcSupport.getDouble;
import static com.astrofiler.db.JdbcSupport.setDateTime;
import static com.astrofiler.db.JdbcSupport.setDouble;

public final class MasterDao {
    private static final String COLUMNS = "id, master_type, telescope, instrument, exposure, filter_name, " +
            "x_binning, y_binning, ccd_temp, gain, offset_value, path, content_hash, file_size, frame_count, " +
            "source_session_id, validated, validation_date, creation_date, soft_deleted";

    private final Database database;

    public MasterDao(Database database) {
        this.database = database;
    }

    public void insert(Master m) throws SQLException {
        String sql = "INSERT INTO master(" + COLUMNS + ") " +
                "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, m.id);
            ps.setString(2, m.type.label());
            ps.setString(3, m.telescope);
            ps.setString(4, m.instrument);
            setDouble(ps, 5, m.exposure);
            ps.setString(6, m.filter);
            ps.setInt(7, m.xBinning);
            ps.setInt(8, m.yBinning);
            setDouble(ps, 9, m.ccdTemp);
            setDouble(ps, 10, m.gain);
            setDouble(ps, 11, m.offset);
            ps.setString(12, m.path);
            ps.setString(13, m.contentHash);
            ps.setLong(14, m.fileSize);
            ps.setInt(15, m.frameCount);
            ps.setString(16, m.sourceSessionId);
            ps.setInt(17, m.validated ? 1 : 0);
            setDateTime(ps, 18, m.validationDate);
            setDateTime(ps, 19, m.creationDate);
            ps.setInt(20, m.softDeleted ? 1 : 0);
            ps.executeUpdate();
        }
    }

    /** Rewrites the file-related fields of an existing master after it was restacked or moved. */
    public void updateFile(Master m) throws SQLException {
        String sql = "UPDATE master SET path = ?, content_hash = ?, file_size = ?, frame_count = ?, " +
                "source_session_id = ?, ccd_temp = ?, gain = ?, offset_value = ?, creation_date = ?, " +
                "validated = ?, validation_date = ?, soft_deleted = 0 WHERE id = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, m.path);
            ps.setString(2, m.contentHash);
            ps.setLong(3, m.fileSize);
            ps.setInt(4, m.frameCount);
            ps.setString(5, m.sourceSessionId);
            setDouble(ps, 6, m.ccdTemp);
            setDouble(ps, 7, m.gain);
            setDouble(ps, 8, m.offset);
            setDateTime(ps, 9, m.creationDate);
            ps.setInt(10, m.validated ? 1 : 0);
            setDateTime(ps, 11, m.validationDate);
            ps.setString(12, m.id);
            ps.executeUpdate();
        }
    }

    public void updateValidation(String id, boolean validated, LocalDateTime when) throws SQLException {
        String sql = "UPDATE master SET validated = ?, validation_date = ? WHERE id = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, validated ? 1 : 0);
            setDateTime(ps, 2, when);
            ps.setString(3, id);
            ps.executeUpdate();
        }
    }

    public void softDelete(String id) throws SQLException {
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement("UPDATE master SET soft_deleted = 1 WHERE id = ?")) {
            ps.setString(1, id);
            ps.executeUpdate();
        }
    }

    public Optional<Master> findById(String id) throws SQLException {
        List<Master> rows = query("SELECT " + COLUMNS + " FROM master WHERE id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Active masters of one type, most recent first, id as second key. */
    public List<Master> findActiveByType(ImageType type) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM master WHERE soft_deleted = 0 AND master_type = ? " +
                "ORDER BY creation_date DESC, id", type.label());
    }

    public List<Master> findActive() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM master WHERE soft_deleted = 0 ORDER BY creation_date, id");
    }

    public List<Master> findCreatedBefore(LocalDateTime cutoff) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM master WHERE soft_deleted = 0 AND creation_date < ? " +
                "ORDER BY creation_date, id", JdbcSupport.format(cutoff));
    }

    public List<Master> findAll() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM master ORDER BY creation_date, id");
    }

    private List<Master> query(String sql, String... params) throws SQLException {
        List<Master> out = new ArrayList<>();
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

    private Master map(ResultSet rs) throws SQLException {
        Master m = new Master();
        m.id = rs.getString("id");
        m.type = ImageType.fromLabel(rs.getString("master_type")).orElse(null);
        m.telescope = rs.getString("telescope");
        m.instrument = rs.getString("instrument");
        m.exposure = getDouble(rs, "exposure");
        m.filter = rs.getString("filter_name");
        m.xBinning = rs.getInt("x_binning");
        m.yBinning = rs.getInt("y_binning");
        m.ccdTemp = getDouble(rs, "ccd_temp");
        m.gain = getDouble(rs, "gain");
        m.offset = getDouble(rs, "offset_value");
        m.path = rs.getString("path");
        m.contentHash = rs.getString("content_hash");
        m.fileSize = rs.getLong("file_size");
        m.frameCount = rs.getInt("frame_count");
        m.sourceSessionId = rs.getString("source_session_id");
        m.validated = rs.getInt("validated") != 0;
        m.validationDate = getDateTime(rs, "validation_date");
        m.creationDate = getDateTime(rs, "creation_date");
        m.softDeleted = rs.getInt("soft_deleted") != 0;
        return m;
    }
}
