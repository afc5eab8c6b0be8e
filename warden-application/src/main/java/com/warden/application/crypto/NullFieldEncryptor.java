package com.warden.application.crypto;

import java.util.Objects;

/**
 * Encryption switched off: every value passes through unchanged.
 */
public final class NullFieldEncryptor implements FieldEncryptor {

    public static final NullFieldEncryptor INSTANCE = new NullFieldEncryptor();

    private NullFieldEncryptor() {}

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String encrypt(String plaintext) {
        return Objects.requireNonNull(plaintext, "plaintext");
    }

    @Override
    public String decrypt(String stored) {
        return Objects.requireNonNull(stored, "stored");
    }

    @Override
    public void validateKey() {
        throw new KeyValidationException("encryption is not enabled");
    }

    @Override
    public String toString() {
        return "NullFieldEncryptor";
    }
}
