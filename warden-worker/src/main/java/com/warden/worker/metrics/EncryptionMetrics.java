package com.warden.worker.metrics;

import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.migration.MigrationReport;
import com.warden.infrastructure.security.AesGcmFieldEncryptor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Exposes:
 * - warden.encryption.auth_failures (gauge, only when encryption is enabled)
 * - warden.encryption.migration.values_encrypted (counter)
 * - warden.encryption.migration.failed (counter)
 */
@Component
public class EncryptionMetrics {

  private final Counter valuesEncrypted;
  private final Counter failed;

  public EncryptionMetrics(MeterRegistry registry, FieldEncryptor encryptor) {
    if (encryptor instanceof AesGcmFieldEncryptor aes) {
      registry.gauge("warden.encryption.auth_failures", aes, AesGcmFieldEncryptor::authenticationFailures);
    }

    this.valuesEncrypted = Counter.builder("warden.encryption.migration.values_encrypted")
        .description("Plaintext values encrypted by the startup migration")
        .register(registry);
    this.failed = Counter.builder("warden.encryption.migration.failed")
        .description("Startup migration runs that stopped with an error")
        .register(registry);
  }

  public void recordMigration(MigrationReport report) {
    valuesEncrypted.increment(report.valuesEncrypted());
  }

  public void recordMigrationFailure() {
    failed.increment();
  }
}
