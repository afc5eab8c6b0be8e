package com.warden.infrastructure.security;

import com.warden.application.config.EncryptionSettings;
import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.crypto.NullFieldEncryptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the encryptor for a passphrase: disabled when it is empty, AES-GCM otherwise.
 */
public final class FieldEncryptors {

    private static final Logger log = LoggerFactory.getLogger(FieldEncryptors.class);

    private FieldEncryptors() {}

    /**
     * @throws FieldEncryptionException if a passphrase is given but the cipher cannot be set up
     */
    public static FieldEncryptor fromPassphrase(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            log.info("Field encryption disabled (no passphrase configured)");
            return NullFieldEncryptor.INSTANCE;
        }

        long started = System.nanoTime();
        AesGcmFieldEncryptor encryptor = new AesGcmFieldEncryptor(KeyDeriver.derive(passphrase));
        log.info("Field encryption enabled (AES-256-GCM, key derived in {} ms)",
                (System.nanoTime() - started) / 1_000_000);
        return encryptor;
    }

    public static FieldEncryptor fromSettings(EncryptionSettings settings) {
        return fromPassphrase(settings.passphrase());
    }
}
