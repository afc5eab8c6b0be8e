package com.warden.infrastructure.security;

import com.warden.application.crypto.CiphertextEnvelope;
import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.crypto.KeyValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AES-256-GCM field encryption.
 *
 * Format: base64( nonce(12) || ciphertext+tag(16) ), fresh random nonce per value.
 *
 * Decryption never fails on data: anything that is not a valid envelope under this key is treated
 * as legacy plaintext and returned as stored. Authentication failures on envelope-shaped values are
 * counted and logged, since they usually mean a wrong key rather than old data.
 *
 * A Cipher is created per call (Cipher is not thread-safe); the key is immutable and shared.
 */
public final class AesGcmFieldEncryptor implements FieldEncryptor {

    private static final Logger log = LoggerFactory.getLogger(AesGcmFieldEncryptor.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int TAG_BITS = CiphertextEnvelope.TAG_LENGTH * 8;
    static final String VALIDATION_PLAINTEXT = "warden-encryption-test";

    private static final SecureRandom RNG = new SecureRandom();

    private final SecretKey key;
    private final AtomicLong authenticationFailures = new AtomicLong();

    /**
     * @throws FieldEncryptionException if the key cannot drive AES-GCM on this platform
     */
    public AesGcmFieldEncryptor(SecretKey key) {
        this.key = Objects.requireNonNull(key, "key");
        try {
            newCipher(Cipher.ENCRYPT_MODE, new byte[CiphertextEnvelope.NONCE_LENGTH]);
        } catch (GeneralSecurityException e) {
            throw new FieldEncryptionException("Failed to initialise AES-GCM with the derived key", e);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String encrypt(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        if (plaintext.isEmpty()) return plaintext;

        byte[] nonce = new byte[CiphertextEnvelope.NONCE_LENGTH];
        RNG.nextBytes(nonce);

        try {
            Cipher cipher = newCipher(Cipher.ENCRYPT_MODE, nonce);
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return CiphertextEnvelope.encode(nonce, sealed);
        } catch (GeneralSecurityException e) {
            throw new FieldEncryptionException("Failed to encrypt field", e);
        }
    }

    @Override
    public String decrypt(String stored) {
        Objects.requireNonNull(stored, "stored");
        if (stored.isEmpty()) return stored;

        byte[] raw = CiphertextEnvelope.decodeOrNull(stored);
        if (raw == null || raw.length < CiphertextEnvelope.MIN_LENGTH) {
            // not base64 or too short: legacy plaintext
            return stored;
        }

        byte[] nonce = Arrays.copyOfRange(raw, 0, CiphertextEnvelope.NONCE_LENGTH);
        Cipher cipher;
        try {
            cipher = newCipher(Cipher.DECRYPT_MODE, nonce);
        } catch (GeneralSecurityException e) {
            throw new FieldEncryptionException("Failed to initialise AES-GCM for decryption", e);
        }

        try {
            byte[] plain = cipher.doFinal(raw, CiphertextEnvelope.NONCE_LENGTH, raw.length - CiphertextEnvelope.NONCE_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            onAuthenticationFailure();
            return stored;
        }
    }

    @Override
    public void validateKey() {
        String encrypted;
        try {
            encrypted = encrypt(VALIDATION_PLAINTEXT);
        } catch (FieldEncryptionException e) {
            throw new KeyValidationException("encryption test failed", e);
        }

        String decrypted = decrypt(encrypted);
        if (!VALIDATION_PLAINTEXT.equals(decrypted)) {
            throw new KeyValidationException("encryption round-trip failed: data mismatch");
        }
    }

    /** Ciphertext-shaped values that did not authenticate under this key since startup. */
    public long authenticationFailures() {
        return authenticationFailures.get();
    }

    private void onAuthenticationFailure() {
        long n = authenticationFailures.incrementAndGet();
        if (n == 1) {
            log.warn("A stored value looks encrypted but does not authenticate with the configured key; "
                    + "returning it unchanged. Check encryption.key if this repeats.");
        } else {
            log.debug("Authentication failure #{} on a ciphertext-shaped value", n);
        }
    }

    private Cipher newCipher(int mode, byte[] nonce) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, key, new GCMParameterSpec(TAG_BITS, nonce));
        return cipher;
    }

    @Override
    public String toString() {
        return "AesGcmFieldEncryptor";
    }
}
