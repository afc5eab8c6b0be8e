package com.warden.application.config;

/**
 * Known configuration keys for Warden.
 * Secrets belong in secrets.properties or the environment, never in warden.properties.
 */
public enum ConfigKey {
    DATABASE_PATH("database.path", false, "data/warden.db"),

    // Field encryption
    ENCRYPTION_ENABLED("encryption.enabled", false, "false"),
    ENCRYPTION_KEY("encryption.key", true, ""),
    MIGRATION_BATCH_SIZE("encryption.migration.batchSize", false, "500"),
    MIGRATE_ON_STARTUP("encryption.migrateOnStartup", false, "true");

    private final String key;
    private final boolean secret;
    private final String defaultValue;

    ConfigKey(String key, boolean secret, String defaultValue) {
        this.key = key;
        this.secret = secret;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public String defaultValue() { return defaultValue; }
}
