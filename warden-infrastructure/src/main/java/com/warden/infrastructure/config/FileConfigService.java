package com.warden.infrastructure.config;

import com.warden.application.config.ConfigKey;
import com.warden.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * File + env configuration for Warden.
 *
 * Load order (low -> high priority):
 *  1) warden.properties
 *  2) .env (optional)
 *  3) secrets.properties (optional)
 *  4) OS environment variables (highest priority)
 *
 * Env overrides use the WARDEN_* mapping (encryption.key -> WARDEN_ENCRYPTION_KEY) for every
 * known {@link ConfigKey} and every key present in the files.
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    private final Properties props = new Properties();
    private final Path configDir;

    private FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = configDir;
        loadAll();
        applyEnvOverrides(env);
    }

    public static FileConfigService forDirectory(Path configDir, Map<String, String> env) throws IOException {
        return new FileConfigService(Objects.requireNonNull(configDir, "configDir"), Objects.requireNonNull(env, "env"));
    }

    private void loadAll() throws IOException {
        loadPropsIfExists(configDir.resolve("warden.properties"));

        Map<String, String> dotEnv = DotEnv.loadIfExists(configDir.resolve(".env"));
        for (Map.Entry<String, String> e : dotEnv.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }

        loadPropsIfExists(configDir.resolve("secrets.properties"));
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (!Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        log.debug("Loaded config file {}", file);
    }

    private void applyEnvOverrides(Map<String, String> env) {
        Set<String> keys = new LinkedHashSet<>(props.stringPropertyNames());
        for (ConfigKey ck : ConfigKey.values()) {
            keys.add(ck.key());
        }

        for (String key : keys) {
            String val = env.get(toEnvKey(key));
            if (val != null) props.setProperty(key, val);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - encryption.key                  -> WARDEN_ENCRYPTION_KEY
     * - encryption.migration.batchSize  -> WARDEN_ENCRYPTION_MIGRATION_BATCH_SIZE
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return "WARDEN_" + s.toUpperCase();
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not a number, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        String t = v.trim();
        if (t.equalsIgnoreCase("true")) return true;
        if (t.equalsIgnoreCase("false")) return false;
        log.warn("Config {}='{}' is not true/false, using {}", key, v, defaultValue);
        return defaultValue;
    }

    @Override
    public String getSecret(String key) {
        return props.getProperty(key);
    }
}
