package com.warden.infrastructure.db;

import com.warden.application.ports.StoreAccessException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.Objects;

/**
 * SQLite file holding the moderation data. One JDBC connection per operation.
 */
public final class Database {

    private final Path path;
    private final String url;

    public Database(Path path) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        this.url = "jdbc:sqlite:" + this.path;
    }

    /** Opens the file at {@code path} and makes sure the schema exists. */
    public static Database open(String path) {
        Database db = new Database(Path.of(path));
        db.initSchema();
        return db;
    }

    public Path path() {
        return path;
    }

    public Connection getConnection() {
        try {
            Path dir = path.getParent();
            if (dir != null) Files.createDirectories(dir);

            Connection c = DriverManager.getConnection(url);
            try (Statement st = c.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL;");
                st.execute("PRAGMA foreign_keys=ON;");
                // migration and live writers share the file
                st.execute("PRAGMA busy_timeout=5000;");
            }
            return c;
        } catch (Exception e) {
            throw new StoreAccessException("Failed to connect to SQLite: " + url, e);
        }
    }

    /** Schema initialization (sensitive tables + encryption metadata). */
    public void initSchema() {
        String sql = """
        CREATE TABLE IF NOT EXISTS guild_settings (
          guild_id TEXT PRIMARY KEY,
          prefix TEXT DEFAULT '/',
          mod_log_channel TEXT,
          welcome_channel TEXT,
          welcome_message TEXT,
          join_dm_title TEXT,
          join_dm_message TEXT,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
          updated_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );

        CREATE TABLE IF NOT EXISTS warnings (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT NOT NULL,
          user_id TEXT NOT NULL,
          moderator_id TEXT NOT NULL,
          reason TEXT,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );

        CREATE TABLE IF NOT EXISTS deleted_messages (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT,
          channel_id TEXT NOT NULL,
          user_id TEXT NOT NULL,
          content TEXT NOT NULL,
          deleted_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );

        CREATE TABLE IF NOT EXISTS user_notes (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT NOT NULL,
          user_id TEXT NOT NULL,
          note TEXT NOT NULL,
          created_by TEXT NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
          UNIQUE(guild_id, user_id)
        );

        CREATE TABLE IF NOT EXISTS scheduled_messages (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT,
          channel_id TEXT NOT NULL,
          user_id TEXT NOT NULL,
          message TEXT NOT NULL,
          scheduled_for DATETIME NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
          executed INTEGER DEFAULT 0
        );

        CREATE TABLE IF NOT EXISTS afk_status (
          user_id TEXT PRIMARY KEY,
          message TEXT,
          set_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );

        CREATE TABLE IF NOT EXISTS reminders (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          user_id TEXT NOT NULL,
          channel_id TEXT NOT NULL,
          message TEXT NOT NULL,
          remind_at DATETIME NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
          completed INTEGER DEFAULT 0
        );

        CREATE TABLE IF NOT EXISTS tags (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT NOT NULL,
          name TEXT NOT NULL,
          content TEXT NOT NULL,
          created_by TEXT NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
          use_count INTEGER DEFAULT 0,
          UNIQUE(guild_id, name)
        );

        CREATE TABLE IF NOT EXISTS custom_commands (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT NOT NULL,
          name TEXT NOT NULL,
          response TEXT NOT NULL,
          created_by TEXT NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
          use_count INTEGER DEFAULT 0,
          UNIQUE(guild_id, name)
        );

        CREATE TABLE IF NOT EXISTS bot_bans (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          target_id TEXT NOT NULL UNIQUE,
          ban_type TEXT NOT NULL,
          reason TEXT,
          banned_by TEXT NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );

        CREATE TABLE IF NOT EXISTS mod_actions (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT NOT NULL,
          moderator_id TEXT NOT NULL,
          target_id TEXT NOT NULL,
          action TEXT NOT NULL,
          reason TEXT,
          timestamp INTEGER NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );

        CREATE TABLE IF NOT EXISTS mention_responses (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT NOT NULL,
          trigger_text TEXT NOT NULL,
          response TEXT NOT NULL,
          image_url TEXT,
          created_by TEXT NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
          UNIQUE(guild_id, trigger_text)
        );

        CREATE TABLE IF NOT EXISTS regex_filters (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          guild_id TEXT NOT NULL,
          pattern TEXT NOT NULL,
          action TEXT NOT NULL,
          reason TEXT,
          created_by TEXT NOT NULL,
          created_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );

        CREATE INDEX IF NOT EXISTS idx_warnings_guild_user ON warnings(guild_id, user_id);
        CREATE INDEX IF NOT EXISTS idx_mod_actions_guild ON mod_actions(guild_id);

        CREATE TABLE IF NOT EXISTS encryption_metadata (
          key TEXT PRIMARY KEY,
          value TEXT NOT NULL,
          updated_at DATETIME DEFAULT CURRENT_TIMESTAMP
        );
        """;

        try (Connection c = getConnection(); Statement st = c.createStatement()) {
            for (String stmt : sql.split(";")) {
                if (!stmt.isBlank()) st.executeUpdate(stmt);
            }
        } catch (Exception e) {
            throw new StoreAccessException("initSchema() error on " + url, e);
        }
    }
}
