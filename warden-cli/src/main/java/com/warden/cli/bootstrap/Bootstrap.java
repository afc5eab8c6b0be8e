package com.warden.cli.bootstrap;

import com.warden.application.config.EncryptionSettings;
import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.migration.EncryptionCoverageService;
import com.warden.application.migration.EncryptionMigrationService;
import com.warden.application.ports.ConfigPort;
import com.warden.application.ports.SensitiveRowPort;
import com.warden.domain.store.SensitiveTables;
import com.warden.infrastructure.config.FileConfigService;
import com.warden.infrastructure.db.Database;
import com.warden.infrastructure.db.SqliteMigrationMetadataStore;
import com.warden.infrastructure.db.SqliteSensitiveRowStore;
import com.warden.infrastructure.security.FieldEncryptors;

import java.io.IOException;
import java.nio.file.Path;

public final class Bootstrap {

    private Bootstrap() {
    }

    public record Components(EncryptionSettings settings,
                             FieldEncryptor encryptor,
                             Database database,
                             SensitiveRowPort rows,
                             EncryptionMigrationService migration,
                             EncryptionCoverageService coverage) {}

    /**
     * Reads {@code --config <dir>} from the arguments; defaults to ./config.
     */
    public static Path configDir(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equalsIgnoreCase(args[i]) && i + 1 < args.length) {
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(System.getProperty("user.dir")).resolve("config");
    }

    /**
     * Loads warden.properties, .env and secrets.properties from {@code dir}, with WARDEN_* env on top.
     */
    public static ConfigPort loadConfig(Path dir) throws IOException {
        return FileConfigService.forDirectory(dir, System.getenv());
    }

    /**
     * Derives the key (if encryption is enabled), opens the database and wires the services.
     *
     * @throws com.warden.infrastructure.security.FieldEncryptionException if the cipher cannot be set up
     * @throws com.warden.application.ports.StoreAccessException if the database cannot be opened
     */
    public static Components wire(ConfigPort config) {
        EncryptionSettings settings = EncryptionSettings.from(config);
        FieldEncryptor encryptor = FieldEncryptors.fromSettings(settings);

        Database db = Database.open(settings.databasePath());
        SqliteSensitiveRowStore rows = new SqliteSensitiveRowStore(db);

        EncryptionMigrationService migration = new EncryptionMigrationService(
                encryptor, rows, new SqliteMigrationMetadataStore(db),
                SensitiveTables.all(), settings.batchSize());
        EncryptionCoverageService coverage = new EncryptionCoverageService(
                encryptor, rows, SensitiveTables.all(), settings.batchSize());

        return new Components(settings, encryptor, db, rows, migration, coverage);
    }
}
