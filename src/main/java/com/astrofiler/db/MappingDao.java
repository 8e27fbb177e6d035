package com.astrofiler.db;

import com.astrofiler.model.HeaderMapping;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

public final class MappingDao {
    private final Database database;

    public MappingDao(Database database) {
        this.database = database;
    }

    public long insert(String field, String oldValue, String newValue) throws SQLException {
        String sql = "INSERT INTO header_mapping(header_field, old_value, new_value) VALUES(?, ?, ?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, field);
            ps.setString(2, oldValue);
            ps.setString(3, newValue);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        }
    }

    public boolean delete(long id) throws SQLException {
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM header_mapping WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        }
    }

    public List<HeaderMapping> findAll() throws SQLException {
        List<HeaderMapping> out = new ArrayList<>();
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT id, header_field, old_value, new_value FROM header_mapping ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new HeaderMapping(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4)));
            }
        }
        return out;
    }
}
