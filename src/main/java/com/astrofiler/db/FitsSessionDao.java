package com.astrofiler.db;

import com.astrofiler.model.FitsSession;
import com.astrofiler.model.ImageType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.astrofiler.db.JdbcSupport.getDateTime;
import static com.astrofiler.db.JdbcSupport.getDouble;
import static com.astrofiler.db.JdbcSupport.getInt;
import static com.astrofiler.db.JdbcSupport.setDateTime;
import static com.astrofiler.db.JdbcSupport.setDouble;
import static com.astrofiler.db.JdbcSupport.setInt;

public final class FitsSessionDao {
    private static final String COLUMNS = "id, object_name, session_date, telescope, imager, x_binning, y_binning, " +
            "ccd_temp, gain, offset_value, filter_name, exposure, bias_session, dark_session, flat_session, " +
            "bias_master, dark_master, flat_master";
    private static final String CALIBRATION_OBJECTS = "('Bias', 'Dark', 'Flat')";

    private final Database database;

    public FitsSessionDao(Database database) {
        this.database = database;
    }

    public void insert(FitsSession s) throws SQLException {
        String sql = "INSERT INTO fits_session(" + COLUMNS + ") " +
                "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, s.id);
            ps.setString(2, s.objectName);
            setDateTime(ps, 3, s.date);
            ps.setString(4, s.telescope);
            ps.setString(5, s.imager);
            setInt(ps, 6, s.xBinning);
            setInt(ps, 7, s.yBinning);
            setDouble(ps, 8, s.ccdTemp);
            setDouble(ps, 9, s.gain);
            setDouble(ps, 10, s.offset);
            ps.setString(11, s.filter);
            setDouble(ps, 12, s.exposure);
            ps.setString(13, s.biasSession);
            ps.setString(14, s.darkSession);
            ps.setString(15, s.flatSession);
            ps.setString(16, s.biasMaster);
            ps.setString(17, s.darkMaster);
            ps.setString(18, s.flatMaster);
            ps.executeUpdate();
        }
    }

    public Optional<FitsSession> findById(String id) throws SQLException {
        List<FitsSession> rows = query("SELECT " + COLUMNS + " FROM fits_session WHERE id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<FitsSession> findAll() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM fits_session ORDER BY session_date, id");
    }

    public List<FitsSession> findLightSessions() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM fits_session WHERE object_name NOT IN " + CALIBRATION_OBJECTS +
                " ORDER BY session_date, id");
    }

    public List<FitsSession> findCalibrationSessions() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM fits_session WHERE object_name IN " + CALIBRATION_OBJECTS +
                " ORDER BY session_date, id");
    }

    public List<FitsSession> findCalibrationSessions(ImageType type) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM fits_session WHERE object_name = ? ORDER BY session_date, id",
                type.label());
    }

    /** Writes a calibration-session reference only if the field is still empty. */
    public boolean fillCalibrationReference(String sessionId, ImageType type, String calibrationSessionId)
            throws SQLException {
        String column = referenceColumn(type);
        String sql = "UPDATE fits_session SET " + column + " = ? WHERE id = ? AND " + column + " IS NULL";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, calibrationSessionId);
            ps.setString(2, sessionId);
            return ps.executeUpdate() == 1;
        }
    }

    public int clearCalibrationReferences() throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            return st.executeUpdate("UPDATE fits_session SET bias_session = NULL, dark_session = NULL, flat_session = NULL");
        }
    }

    public void setMasterPath(String sessionId, ImageType type, String path) throws SQLException {
        String sql = "UPDATE fits_session SET " + masterColumn(type) + " = ? WHERE id = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, path);
            ps.setString(2, sessionId);
            ps.executeUpdate();
        }
    }

    /** Writes a master path only if the field is still empty. */
    public boolean fillMasterPath(String sessionId, ImageType type, String path) throws SQLException {
        String column = masterColumn(type);
        String sql = "UPDATE fits_session SET " + column + " = ? WHERE id = ? AND " + column + " IS NULL";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, path);
            ps.setString(2, sessionId);
            return ps.executeUpdate() == 1;
        }
    }

    /** Replaces every reference to a master file that has moved. */
    public int replaceMasterPath(String oldPath, String newPath) throws SQLException {
        int changed = 0;
        try (Connection conn = database.connect()) {
            for (String column : new String[]{"bias_master", "dark_master", "flat_master"}) {
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE fits_session SET " + column + " = ? WHERE " + column + " = ?")) {
                    ps.setString(1, newPath);
                    ps.setString(2, oldPath);
                    changed += ps.executeUpdate();
                }
            }
        }
        return changed;
    }

    public Set<String> findReferencedMasterPaths() throws SQLException {
        String sql = "SELECT bias_master FROM fits_session WHERE bias_master IS NOT NULL " +
                "UNION SELECT dark_master FROM fits_session WHERE dark_master IS NOT NULL " +
                "UNION SELECT flat_master FROM fits_session WHERE flat_master IS NOT NULL";
        Set<String> out = new LinkedHashSet<>();
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
        }
        return out;
    }

    public int deleteAll() throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            return st.executeUpdate("DELETE FROM fits_session");
        }
    }

    private static String referenceColumn(ImageType type) {
        switch (type) {
            case BIAS: return "bias_session";
            case DARK: return "dark_session";
            case FLAT: return "flat_session";
            default: throw new IllegalArgumentException("Not a calibration type: " + type);
        }
    }

    private static String masterColumn(ImageType type) {
        switch (type) {
            case BIAS: return "bias_master";
            case DARK: return "dark_master";
            case FLAT: return "flat_master";
            default: throw new IllegalArgumentException("Not a calibration type: " + type);
        }
    }

    private List<FitsSession> query(String sql, String... params) throws SQLException {
        List<FitsSession> out = new ArrayList<>();
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

    private FitsSession map(ResultSet rs) throws SQLException {
        FitsSession s = new FitsSession();
        s.id = rs.getString("id");
        s.objectName = rs.getString("object_name");
        s.date = getDateTime(rs, "session_date");
        s.telescope = rs.getString("telescope");
        s.imager = rs.getString("imager");
        s.xBinning = getInt(rs, "x_binning");
        s.yBinning = getInt(rs, "y_binning");
        s.ccdTemp = getDouble(rs, "ccd_temp");
        s.gain = getDouble(rs, "gain");
        s.offset = getDouble(rs, "offset_value");
        s.filter = rs.getString("filter_name");
        s.exposure = getDouble(rs, "exposure");
        s.biasSession = rs.getString("bias_session");
        s.darkSession = rs.getString("dark_session");
        s.flatSession = rs.getString("flat_session");
        s.biasMaster = rs.getString("bias_master");
        s.darkMaster = rs.getString("dark_master");
        s.flatMaster = rs.getString("flat_master");
        return s;
    }
}
