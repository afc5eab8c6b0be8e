package com.warden.infrastructure.db;

import com.warden.application.crypto.FieldEncryptor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Per-guild settings. Welcome and join-DM texts are stored through the field encryptor.
 */
public class GuildSettingsRepository {

    public record GuildSettingsRow(String guildId,
                                   String prefix,
                                   String modLogChannel,
                                   String welcomeChannel,
                                   String welcomeMessage,
                                   String joinDmTitle,
                                   String joinDmMessage) {

        public static GuildSettingsRow defaults(String guildId) {
            return new GuildSettingsRow(guildId, "/", null, null, null, null, null);
        }
    }

    private final Database db;
    private final FieldEncryptor encryptor;

    public GuildSettingsRepository(Database db, FieldEncryptor encryptor) {
        this.db = Objects.requireNonNull(db, "db");
        this.encryptor = Objects.requireNonNull(encryptor, "encryptor");
    }

    /** Returns stored settings, or defaults when the guild has none yet. */
    public GuildSettingsRow get(String guildId) throws SQLException {
        String sql = """
            SELECT guild_id, prefix, mod_log_channel, welcome_channel,
                   welcome_message, join_dm_title, join_dm_message
            FROM guild_settings WHERE guild_id=?
        """;

        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {

            ps.setString(1, guildId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return GuildSettingsRow.defaults(guildId);

                String prefix = rs.getString("prefix");
                return new GuildSettingsRow(
                        rs.getString("guild_id"),
                        prefix == null ? "/" : prefix,
                        rs.getString("mod_log_channel"),
                        rs.getString("welcome_channel"),
                        encryptor.decryptNullable(rs.getString("welcome_message")),
                        encryptor.decryptNullable(rs.getString("join_dm_title")),
                        encryptor.decryptNullable(rs.getString("join_dm_message"))
                );
            }
        }
    }

    public void upsert(GuildSettingsRow row) throws SQLException {
        Objects.requireNonNull(row, "row");
        if (row.guildId() == null || row.guildId().isBlank()) {
            throw new IllegalArgumentException("guildId cannot be empty");
        }

        String sql = """
            INSERT INTO guild_settings(guild_id, prefix, mod_log_channel, welcome_channel,
                                       welcome_message, join_dm_title, join_dm_message, updated_at)
            VALUES(?,?,?,?,?,?,?,CURRENT_TIMESTAMP)
            ON CONFLICT(guild_id) DO UPDATE SET
              prefix=excluded.prefix,
              mod_log_channel=excluded.mod_log_channel,
              welcome_channel=excluded.welcome_channel,
              welcome_message=excluded.welcome_message,
              join_dm_title=excluded.join_dm_title,
              join_dm_message=excluded.join_dm_message,
              updated_at=CURRENT_TIMESTAMP
        """;

        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {

            ps.setString(1, row.guildId());
            ps.setString(2, row.prefix() == null ? "/" : row.prefix());
            ps.setString(3, row.modLogChannel());
            ps.setString(4, row.welcomeChannel());
            ps.setString(5, encryptor.encryptNullable(row.welcomeMessage()));
            ps.setString(6, encryptor.encryptNullable(row.joinDmTitle()));
            ps.setString(7, encryptor.encryptNullable(row.joinDmMessage()));
            ps.executeUpdate();
        }
    }
}
