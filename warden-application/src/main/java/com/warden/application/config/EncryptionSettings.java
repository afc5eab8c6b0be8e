package com.warden.application.config;

import com.warden.application.ports.ConfigPort;

import java.util.Objects;

/**
 * Resolved encryption settings. The passphrase is empty whenever encryption is switched off,
 * even if a key is configured.
 */
public record EncryptionSettings(String databasePath, String passphrase, int batchSize, boolean migrateOnStartup) {

    public EncryptionSettings {
        Objects.requireNonNull(databasePath, "databasePath");
        Objects.requireNonNull(passphrase, "passphrase");
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }

    public static EncryptionSettings from(ConfigPort config) {
        boolean enabled = config.getBoolean(ConfigKey.ENCRYPTION_ENABLED.key(), false);
        String key = enabled ? config.getSecret(ConfigKey.ENCRYPTION_KEY.key()) : "";

        return new EncryptionSettings(
                config.get(ConfigKey.DATABASE_PATH.key(), ConfigKey.DATABASE_PATH.defaultValue()).trim(),
                key == null ? "" : key,
                config.getInt(ConfigKey.MIGRATION_BATCH_SIZE.key(), 500),
                config.getBoolean(ConfigKey.MIGRATE_ON_STARTUP.key(), true)
        );
    }

    public boolean encryptionRequested() {
        return !passphrase.isEmpty();
    }

    @Override
    public String toString() {
        return "EncryptionSettings[databasePath=" + databasePath
                + ", encryption=" + (encryptionRequested() ? "on" : "off")
                + ", batchSize=" + batchSize
                + ", migrateOnStartup=" + migrateOnStartup + "]";
    }
}
