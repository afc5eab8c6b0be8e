package com.warden.application.config;

import com.warden.application.ports.ConfigPort;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        String enabled = config.get(ConfigKey.ENCRYPTION_ENABLED.key(), ConfigKey.ENCRYPTION_ENABLED.defaultValue()).trim();
        if (!"true".equalsIgnoreCase(enabled) && !"false".equalsIgnoreCase(enabled)) {
            res.addError(ConfigKey.ENCRYPTION_ENABLED.key() + " must be true or false, got: " + enabled);
        } else if (Boolean.parseBoolean(enabled)) {
            String key = config.getSecret(ConfigKey.ENCRYPTION_KEY.key());
            if (key == null || key.isEmpty()) {
                res.addError("Missing required secret: " + ConfigKey.ENCRYPTION_KEY.key()
                        + " (encryption.enabled=true)");
            }
        }

        String rawBatch = config.get(ConfigKey.MIGRATION_BATCH_SIZE.key(), ConfigKey.MIGRATION_BATCH_SIZE.defaultValue());
        try {
            if (Integer.parseInt(rawBatch.trim()) <= 0) {
                res.addError(ConfigKey.MIGRATION_BATCH_SIZE.key() + " must be positive, got: " + rawBatch);
            }
        } catch (NumberFormatException e) {
            res.addError(ConfigKey.MIGRATION_BATCH_SIZE.key() + " is not a number: " + rawBatch);
        }

        String path = config.get(ConfigKey.DATABASE_PATH.key(), ConfigKey.DATABASE_PATH.defaultValue());
        if (path == null || path.isBlank()) {
            res.addError(ConfigKey.DATABASE_PATH.key() + " is empty");
        }

        return res;
    }
}
