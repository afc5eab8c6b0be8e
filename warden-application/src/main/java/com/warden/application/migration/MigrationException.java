package com.warden.application.migration;

/**
 * A migration run stopped early. The completion marker was not written, so the next run starts over.
 */
public class MigrationException extends RuntimeException {

    private final String table;

    public MigrationException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    /** The table whose pass failed, or null if the failure was on the completion marker. */
    public String table() {
        return table;
    }
}
