package com.warden.worker.health;

import com.warden.application.crypto.FieldEncryptor;
import com.warden.infrastructure.security.AesGcmFieldEncryptor;
import com.warden.worker.startup.EncryptionMigrationStartup;
import com.warden.worker.startup.MigrationOutcome;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * /actuator/health component "encryption". DOWN when the startup migration failed.
 */
@Component("encryption")
public class EncryptionHealthIndicator implements HealthIndicator {

  private final FieldEncryptor encryptor;
  private final EncryptionMigrationStartup startup;

  public EncryptionHealthIndicator(FieldEncryptor encryptor, EncryptionMigrationStartup startup) {
    this.encryptor = encryptor;
    this.startup = startup;
  }

  @Override
  public Health health() {
    MigrationOutcome outcome = startup.lastOutcome();

    Health.Builder b = outcome.state() == MigrationOutcome.State.FAILED ? Health.down() : Health.up();
    b.withDetail("enabled", encryptor.isEnabled())
        .withDetail("migration", outcome.state().name())
        .withDetail("at", outcome.at().toString());

    if (outcome.report() != null && !outcome.report().alreadyMigrated()) {
      b.withDetail("valuesEncrypted", outcome.report().valuesEncrypted());
    }
    if (outcome.table() != null) {
      b.withDetail("failedTable", outcome.table());
    }
    if (outcome.error() != null) {
      b.withDetail("error", outcome.error());
    }
    if (encryptor instanceof AesGcmFieldEncryptor aes) {
      b.withDetail("authenticationFailures", aes.authenticationFailures());
    }
    return b.build();
  }
}
