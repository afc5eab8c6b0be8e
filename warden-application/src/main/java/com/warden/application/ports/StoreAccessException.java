package com.warden.application.ports;

/**
 * A read or write against the underlying store failed.
 */
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
