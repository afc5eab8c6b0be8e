package com.warden.application.migration;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of {@link EncryptionMigrationService#migrateToEncrypted()}.
 *
 * @param alreadyMigrated true when the completion marker was already set and nothing was scanned
 */
public record MigrationReport(boolean alreadyMigrated, List<TableMigrationResult> tables, Duration elapsed) {

    public MigrationReport {
        tables = List.copyOf(tables);
    }

    static MigrationReport skipped() {
        return new MigrationReport(true, List.of(), Duration.ZERO);
    }

    public long rowsUpdated() {
        return tables.stream().mapToLong(TableMigrationResult::rowsUpdated).sum();
    }

    public long valuesEncrypted() {
        return tables.stream().mapToLong(TableMigrationResult::valuesEncrypted).sum();
    }
}
