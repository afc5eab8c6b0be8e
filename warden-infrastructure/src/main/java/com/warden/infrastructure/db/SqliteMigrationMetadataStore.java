package com.warden.infrastructure.db;

import com.warden.application.ports.MigrationMetadataPort;
import com.warden.application.ports.StoreAccessException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Stores the migration marker as row ('encrypted', 'true') in encryption_metadata.
 */
public class SqliteMigrationMetadataStore implements MigrationMetadataPort {

    static final String MIGRATED_KEY = "encrypted";

    private final Database db;

    public SqliteMigrationMetadataStore(Database db) {
        this.db = db;
    }

    @Override
    public boolean isMigrated() {
        String sql = "SELECT value FROM encryption_metadata WHERE key = ?";
        try (Connection c = db.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, MIGRATED_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && "true".equals(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to read encryption_metadata", e);
        }
    }

    @Override
    public void markMigrated() {
        String sql = "INSERT INTO encryption_metadata(key, value, updated_at) VALUES(?, 'true', CURRENT_TIMESTAMP) " +
                "ON CONFLICT(key) DO UPDATE SET value=excluded.value, updated_at=excluded.updated_at";
        try (Connection c = db.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, MIGRATED_KEY);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to write encryption_metadata", e);
        }
    }
}
