package com.warden.application.crypto;

/**
 * The configured key cannot be trusted with real data.
 */
public class KeyValidationException extends RuntimeException {

    public KeyValidationException(String message) {
        super(message);
    }

    public KeyValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
