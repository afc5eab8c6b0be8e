package com.warden.infrastructure.security;

/**
 * The cipher itself is broken (bad key material, missing algorithm, exhausted entropy source).
 * Not raised for odd-looking input data.
 */
public class FieldEncryptionException extends RuntimeException {

    public FieldEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
