package com.warden.application.migration;

public record TableMigrationResult(
        String table,
        long rowsScanned,
        long rowsUpdated,
        long valuesEncrypted,
        long rowsChangedConcurrently
) {}
