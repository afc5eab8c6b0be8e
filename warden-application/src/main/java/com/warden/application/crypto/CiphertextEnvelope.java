package com.warden.application.crypto;

import java.util.Base64;

/**
 * Stored ciphertext layout: base64( nonce(12) || payload || tag(16) ).
 */
public final class CiphertextEnvelope {

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    /** Nonce, at least one payload byte and the tag. */
    public static final int MIN_LENGTH = NONCE_LENGTH + 1 + TAG_LENGTH;

    private CiphertextEnvelope() {}

    /**
     * Strict standard base64 decode (padding required).
     *
     * @return decoded bytes, or null if the value is empty or not base64
     */
    public static byte[] decodeOrNull(String value) {
        if (value == null || value.isEmpty()) return null;
        if (value.length() % 4 != 0) return null;
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException notBase64) {
            return null;
        }
    }

    public static boolean hasCiphertextShape(String value) {
        byte[] decoded = decodeOrNull(value);
        return decoded != null && decoded.length >= MIN_LENGTH;
    }

    public static String encode(byte[] nonce, byte[] sealed) {
        byte[] out = new byte[nonce.length + sealed.length];
        System.arraycopy(nonce, 0, out, 0, nonce.length);
        System.arraycopy(sealed, 0, out, nonce.length, sealed.length);
        return Base64.getEncoder().encodeToString(out);
    }
}
