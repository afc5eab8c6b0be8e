package com.warden.infrastructure.db;

import com.warden.application.crypto.FieldEncryptor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Moderation warnings. The reason is free text typed by moderators and is encrypted at rest.
 */
public class WarningRepository {

    public record WarningRow(long id, String guildId, String userId, String moderatorId, String reason) {}

    private final Database db;
    private final FieldEncryptor encryptor;

    public WarningRepository(Database db, FieldEncryptor encryptor) {
        this.db = Objects.requireNonNull(db, "db");
        this.encryptor = Objects.requireNonNull(encryptor, "encryptor");
    }

    public long add(String guildId, String userId, String moderatorId, String reason) throws SQLException {
        requireId(guildId, "guildId");
        requireId(userId, "userId");
        requireId(moderatorId, "moderatorId");

        String sql = "INSERT INTO warnings(guild_id, user_id, moderator_id, reason) VALUES(?,?,?,?)";

        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, guildId);
            ps.setString(2, userId);
            ps.setString(3, moderatorId);
            ps.setString(4, encryptor.encryptNullable(reason));
            ps.executeUpdate();

            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) return rs.getLong(1);
            }
        }
        throw new SQLException("Failed to obtain id of the new warning");
    }

    /** Warnings for a member, oldest first. */
    public List<WarningRow> list(String guildId, String userId) throws SQLException {
        String sql = """
            SELECT id, guild_id, user_id, moderator_id, reason
            FROM warnings WHERE guild_id=? AND user_id=? ORDER BY id
        """;

        List<WarningRow> out = new ArrayList<>();
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {

            ps.setString(1, guildId);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new WarningRow(
                            rs.getLong("id"),
                            rs.getString("guild_id"),
                            rs.getString("user_id"),
                            rs.getString("moderator_id"),
                            encryptor.decryptNullable(rs.getString("reason"))
                    ));
                }
            }
        }
        return out;
    }

    /** @return true if a warning with this id existed in the guild */
    public boolean delete(String guildId, long id) throws SQLException {
        String sql = "DELETE FROM warnings WHERE guild_id=? AND id=?";
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, guildId);
            ps.setLong(2, id);
            return ps.executeUpdate() > 0;
        }
    }

    private static void requireId(String v, String name) {
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
    }
}
