package com.warden.worker.config;

import com.warden.application.config.EncryptionSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Field encryption settings (warden.encryption.*).
 *
 * IMPORTANT:
 * - key must come from env (WARDEN_ENCRYPTION_KEY) or an external config file, never from the jar
 * - changing key makes every encrypted value unreadable
 */
@ConfigurationProperties(prefix = "warden.encryption")
public record EncryptionProperties(

    boolean enabled,

    String key,

    /**
     * Encrypt existing plaintext once during startup.
     */
    @DefaultValue("true") boolean migrateOnStartup,

    @DefaultValue("500") int batchSize

) {

  /**
   * @throws IllegalStateException if encryption is enabled without a key, or batchSize is not positive
   */
  public EncryptionSettings toSettings(String databasePath) {
    if (batchSize <= 0) {
      throw new IllegalStateException("warden.encryption.batch-size must be positive, got: " + batchSize);
    }
    if (enabled && (key == null || key.isEmpty())) {
      throw new IllegalStateException(
          "warden.encryption.enabled=true but warden.encryption.key is empty (set WARDEN_ENCRYPTION_KEY)");
    }
    return new EncryptionSettings(databasePath, enabled ? key : "", batchSize, migrateOnStartup);
  }

  @Override
  public String toString() {
    return "EncryptionProperties[enabled=" + enabled + ", key=" + (key == null || key.isEmpty() ? "<empty>" : "***")
        + ", migrateOnStartup=" + migrateOnStartup + ", batchSize=" + batchSize + "]";
  }
}
