package com.warden.worker.startup;

import com.warden.application.config.EncryptionSettings;
import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.migration.EncryptionMigrationService;
import com.warden.application.migration.MigrationException;
import com.warden.application.migration.MigrationReport;
import com.warden.worker.metrics.EncryptionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Startup step for field encryption:
 * - key validation failure stops the application (the key cannot be trusted with real data)
 * - migration failure is logged and startup continues; the next start retries from scratch
 */
@Component
public class EncryptionMigrationStartup implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(EncryptionMigrationStartup.class);

  private final FieldEncryptor encryptor;
  private final EncryptionMigrationService migration;
  private final EncryptionSettings settings;
  private final EncryptionMetrics metrics;

  private final AtomicReference<MigrationOutcome> last =
      new AtomicReference<>(MigrationOutcome.of(MigrationOutcome.State.PENDING));

  public EncryptionMigrationStartup(
      FieldEncryptor encryptor,
      EncryptionMigrationService migration,
      EncryptionSettings settings,
      EncryptionMetrics metrics
  ) {
    this.encryptor = encryptor;
    this.migration = migration;
    this.settings = settings;
    this.metrics = metrics;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!encryptor.isEnabled()) {
      last.set(MigrationOutcome.of(MigrationOutcome.State.ENCRYPTION_DISABLED));
      return;
    }

    // KeyValidationException propagates and fails startup
    encryptor.validateKey();
    log.info("Field encryption key validated");

    if (!settings.migrateOnStartup()) {
      log.info("Startup migration disabled (warden.encryption.migrate-on-startup=false)");
      last.set(MigrationOutcome.of(MigrationOutcome.State.SKIPPED));
      return;
    }

    last.set(migrate());
  }

  MigrationOutcome migrate() {
    try {
      MigrationReport report = migration.migrateToEncrypted();
      metrics.recordMigration(report);
      return MigrationOutcome.completed(report);
    } catch (MigrationException e) {
      log.error("Encryption migration failed{}; continuing startup, it will be retried on next start",
          e.table() == null ? "" : " at table " + e.table(), e);
      metrics.recordMigrationFailure();
      return MigrationOutcome.failed(e.table(), e.getMessage());
    }
  }

  public MigrationOutcome lastOutcome() {
    return last.get();
  }
}
