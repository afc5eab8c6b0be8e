package com.warden.infrastructure.config;

import com.warden.application.config.ConfigKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * .env loader for deployment secrets.
 *
 * <p>Lines are KEY=value, optionally prefixed with "export ". Lines starting with # are comments and
 * an unquoted value ends at " #". Single or double quotes keep the value verbatim.
 *
 * <p>Names written the way the process environment spells them (WARDEN_ENCRYPTION_KEY) are returned
 * under the matching {@link ConfigKey} (encryption.key), so a .env file and exported variables
 * can be used interchangeably. Other names are returned as written.
 */
public final class DotEnv {

    private static final Logger log = LoggerFactory.getLogger(DotEnv.class);

    private DotEnv() {}

    public static Map<String, String> loadIfExists(Path envFile) throws IOException {
        Map<String, String> map = new LinkedHashMap<>();
        if (envFile == null || !Files.exists(envFile)) return map;

        List<String> lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
        for (int n = 0; n < lines.size(); n++) {
            String t = lines.get(n).trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            if (t.startsWith("export ")) t = t.substring("export ".length()).trim();

            int eq = t.indexOf('=');
            if (eq <= 0) {
                log.warn("Ignoring {} line {}: expected KEY=value", envFile.getFileName(), n + 1);
                continue;
            }

            map.put(configKey(t.substring(0, eq).trim()), parseValue(t.substring(eq + 1).trim()));
        }
        return map;
    }

    static String parseValue(String raw) {
        if (raw.length() >= 2) {
            char q = raw.charAt(0);
            if ((q == '"' || q == '\'') && raw.charAt(raw.length() - 1) == q) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        int hash = raw.indexOf(" #");
        return hash < 0 ? raw : raw.substring(0, hash).trim();
    }

    static String configKey(String name) {
        if (!name.startsWith("WARDEN_")) return name;
        for (ConfigKey ck : ConfigKey.values()) {
            if (FileConfigService.toEnvKey(ck.key()).equals(name)) return ck.key();
        }
        return name;
    }
}
