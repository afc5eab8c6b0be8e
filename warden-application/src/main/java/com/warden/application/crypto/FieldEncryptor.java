package com.warden.application.crypto;

/**
 * Encrypts and decrypts sensitive text fields before they are stored and after they are loaded.
 *
 * <p>Two variants exist: an AES-GCM implementation when a passphrase is configured, and
 * {@link NullFieldEncryptor} when it is not. Callers always go through this interface and never
 * branch on whether encryption is on.
 *
 * <p>Implementations are safe for concurrent use.
 */
public interface FieldEncryptor {

    boolean isEnabled();

    /**
     * Encrypts a non-null value. Empty strings are returned unchanged.
     *
     * @return base64 ciphertext envelope, or the input when encryption is disabled
     */
    String encrypt(String plaintext);

    /**
     * Decrypts a non-null stored value. Values that are not ciphertext (legacy plaintext written
     * before encryption was enabled) are returned unchanged rather than rejected.
     */
    String decrypt(String stored);

    /** Like {@link #encrypt(String)} but accepts {@code null}, which maps to {@code null}. */
    default String encryptNullable(String plaintext) {
        return plaintext == null ? null : encrypt(plaintext);
    }

    /** Like {@link #decrypt(String)} but accepts {@code null}, which maps to {@code null}. */
    default String decryptNullable(String stored) {
        return stored == null ? null : decrypt(stored);
    }

    /**
     * Heuristic: true when the value has the shape of a ciphertext envelope.
     * A long base64-looking plaintext is reported as encrypted too.
     *
     * @see CiphertextEnvelope#hasCiphertextShape(String)
     */
    default boolean isEncrypted(String value) {
        return CiphertextEnvelope.hasCiphertextShape(value);
    }

    /**
     * Round-trips a known string to prove the key is usable.
     *
     * @throws KeyValidationException if encryption is disabled or the round trip fails
     */
    void validateKey();
}
