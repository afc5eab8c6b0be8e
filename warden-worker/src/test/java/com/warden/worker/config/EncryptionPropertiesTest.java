package com.warden.worker.config;

import com.warden.application.config.EncryptionSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptionPropertiesTest {

  @Test
  void keyIsIgnoredWhileDisabled() {
    EncryptionSettings s = new EncryptionProperties(false, "correct-horse", true, 500).toSettings("data/warden.db");

    assertThat(s.encryptionRequested()).isFalse();
    assertThat(s.passphrase()).isEmpty();
  }

  @Test
  void enabledNeedsAKey() {
    assertThatThrownBy(() -> new EncryptionProperties(true, "", true, 500).toSettings("data/warden.db"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("WARDEN_ENCRYPTION_KEY");
    assertThatThrownBy(() -> new EncryptionProperties(false, null, true, 0).toSettings("data/warden.db"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void toStringHidesKey() {
    assertThat(new EncryptionProperties(true, "correct-horse", true, 500).toString())
        .doesNotContain("correct-horse");
  }
}
