package com.warden.infrastructure.security;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * Passphrase to AES-256 key via PBKDF2-HMAC-SHA256.
 *
 * <p>The salt is a constant so the same passphrase yields the same key after a restart; changing
 * the salt or iteration count makes every stored ciphertext unreadable.
 * Takes a few hundred milliseconds on purpose: call once at startup, never per request.
 */
public final class KeyDeriver {

    static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    static final int ITERATIONS = 100_000;
    static final int KEY_BITS = 256;
    private static final byte[] SALT = "warden-field-encryption-v1".getBytes(StandardCharsets.UTF_8);

    private KeyDeriver() {}

    public static SecretKey derive(String passphrase) {
        Objects.requireNonNull(passphrase, "passphrase");
        if (passphrase.isEmpty()) {
            throw new IllegalArgumentException("passphrase is empty");
        }

        PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(), SALT, ITERATIONS, KEY_BITS);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new FieldEncryptionException("Failed to derive field encryption key", e);
        } finally {
            spec.clearPassword();
        }
    }
}
