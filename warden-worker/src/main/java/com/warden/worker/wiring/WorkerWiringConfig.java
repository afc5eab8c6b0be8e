package com.warden.worker.wiring;

import com.warden.application.config.EncryptionSettings;
import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.migration.EncryptionCoverageService;
import com.warden.application.migration.EncryptionMigrationService;
import com.warden.application.ports.MigrationMetadataPort;
import com.warden.application.ports.SensitiveRowPort;
import com.warden.domain.store.SensitiveTables;
import com.warden.infrastructure.db.Database;
import com.warden.infrastructure.db.GuildSettingsRepository;
import com.warden.infrastructure.db.SqliteMigrationMetadataStore;
import com.warden.infrastructure.db.SqliteSensitiveRowStore;
import com.warden.infrastructure.db.WarningRepository;
import com.warden.infrastructure.security.FieldEncryptors;
import com.warden.worker.config.DatabaseProperties;
import com.warden.worker.config.EncryptionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerWiringConfig {

  private static final Logger log = LoggerFactory.getLogger(WorkerWiringConfig.class);

  @Bean
  public EncryptionSettings encryptionSettings(EncryptionProperties encryption, DatabaseProperties database) {
    EncryptionSettings settings = encryption.toSettings(database.path());
    log.info("Warden storage: {}", settings);
    return settings;
  }

  /** Key derivation happens here, once. A broken cipher setup fails the context. */
  @Bean
  public FieldEncryptor fieldEncryptor(EncryptionSettings settings) {
    return FieldEncryptors.fromSettings(settings);
  }

  @Bean
  public Database database(EncryptionSettings settings) {
    return Database.open(settings.databasePath());
  }

  @Bean
  public SensitiveRowPort sensitiveRowPort(Database db) {
    return new SqliteSensitiveRowStore(db);
  }

  @Bean
  public MigrationMetadataPort migrationMetadataPort(Database db) {
    return new SqliteMigrationMetadataStore(db);
  }

  @Bean
  public EncryptionMigrationService encryptionMigrationService(
      FieldEncryptor encryptor, SensitiveRowPort rows, MigrationMetadataPort metadata, EncryptionSettings settings) {
    return new EncryptionMigrationService(encryptor, rows, metadata, SensitiveTables.all(), settings.batchSize());
  }

  @Bean
  public EncryptionCoverageService encryptionCoverageService(
      FieldEncryptor encryptor, SensitiveRowPort rows, EncryptionSettings settings) {
    return new EncryptionCoverageService(encryptor, rows, SensitiveTables.all(), settings.batchSize());
  }

  @Bean
  public GuildSettingsRepository guildSettingsRepository(Database db, FieldEncryptor encryptor) {
    return new GuildSettingsRepository(db, encryptor);
  }

  @Bean
  public WarningRepository warningRepository(Database db, FieldEncryptor encryptor) {
    return new WarningRepository(db, encryptor);
  }
}
