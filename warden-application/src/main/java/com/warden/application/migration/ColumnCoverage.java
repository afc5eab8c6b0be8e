package com.warden.application.migration;

/**
 * How many stored values of one column look encrypted. Empty and null values are counted apart.
 */
public record ColumnCoverage(String table, String column, long encrypted, long plaintext, long empty) {

    public boolean fullyEncrypted() {
        return plaintext == 0;
    }
}
