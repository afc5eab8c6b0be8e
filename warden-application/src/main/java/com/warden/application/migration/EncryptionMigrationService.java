package com.warden.application.migration;

import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.ports.MigrationMetadataPort;
import com.warden.application.ports.SensitiveRowPort;
import com.warden.application.ports.StoreAccessException;
import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTable;
import com.warden.domain.store.SensitiveTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One-time bulk encryption of historical plaintext in every sensitive column.
 *
 * <p>Safe to call on every startup: once the completion marker is set this is a no-op, and before
 * that every table pass skips values that already look like ciphertext. A failed run leaves the
 * marker unset, so the next call rescans from the first table.
 *
 * <p>Row updates are compare-and-swap. If application code rewrites a row between the scan and the
 * update, the row is read again and only the columns that are still plaintext are retried; values the
 * application wrote went through {@link FieldEncryptor#encrypt(String)} and are left alone. A row that
 * keeps changing past {@link #MAX_ROW_ATTEMPTS} fails the table pass.
 *
 * <p>Not meant to run concurrently with itself.
 */
public class EncryptionMigrationService {

    private static final Logger log = LoggerFactory.getLogger(EncryptionMigrationService.class);

    public static final int DEFAULT_BATCH_SIZE = 500;
    public static final int MAX_ROW_ATTEMPTS = 5;

    private final FieldEncryptor encryptor;
    private final SensitiveRowPort rows;
    private final MigrationMetadataPort metadata;
    private final List<SensitiveTable> tables;
    private final int batchSize;

    public EncryptionMigrationService(FieldEncryptor encryptor, SensitiveRowPort rows, MigrationMetadataPort metadata) {
        this(encryptor, rows, metadata, SensitiveTables.all(), DEFAULT_BATCH_SIZE);
    }

    public EncryptionMigrationService(
            FieldEncryptor encryptor,
            SensitiveRowPort rows,
            MigrationMetadataPort metadata,
            List<SensitiveTable> tables,
            int batchSize
    ) {
        this.encryptor = Objects.requireNonNull(encryptor, "encryptor");
        this.rows = Objects.requireNonNull(rows, "rows");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.tables = List.copyOf(tables);
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        this.batchSize = batchSize;
    }

    /**
     * Encrypts every sensitive value that is not ciphertext yet, then records completion.
     *
     * @throws IllegalStateException if encryption is disabled
     * @throws MigrationException if a table pass or the completion marker fails; the marker stays unset
     */
    public MigrationReport migrateToEncrypted() {
        if (!encryptor.isEnabled()) {
            throw new IllegalStateException("encryption is not enabled");
        }

        if (readMarker()) {
            log.debug("Encryption migration already completed, nothing to do");
            return MigrationReport.skipped();
        }

        long started = System.nanoTime();
        log.info("Starting encryption migration of {} tables (batchSize={})", tables.size(), batchSize);

        List<TableMigrationResult> results = new ArrayList<>();
        for (SensitiveTable table : tables) {
            TableMigrationResult r;
            try {
                r = migrateTable(table);
            } catch (MigrationException e) {
                log.error("Encryption migration aborted at table {}", table.name(), e);
                throw e;
            } catch (RuntimeException e) {
                log.error("Encryption migration aborted at table {}", table.name(), e);
                throw new MigrationException(table.name(), "failed to migrate " + table.name(), e);
            }
            results.add(r);
            log.info("Migrated {}: scanned={} updated={} values={} changedConcurrently={}",
                    r.table(), r.rowsScanned(), r.rowsUpdated(), r.valuesEncrypted(), r.rowsChangedConcurrently());
        }

        try {
            metadata.markMigrated();
        } catch (StoreAccessException e) {
            throw new MigrationException(null, "failed to mark migration complete", e);
        }

        MigrationReport report = new MigrationReport(false, results, Duration.ofNanos(System.nanoTime() - started));
        log.info("Encryption migration complete: {} values encrypted in {} rows ({} ms)",
                report.valuesEncrypted(), report.rowsUpdated(), report.elapsed().toMillis());
        return report;
    }

    public boolean isMigrated() {
        return readMarker();
    }

    private boolean readMarker() {
        try {
            return metadata.isMigrated();
        } catch (StoreAccessException e) {
            throw new MigrationException(null, "failed to read migration marker", e);
        }
    }

    private TableMigrationResult migrateTable(SensitiveTable table) {
        long scanned = 0;
        long updated = 0;
        long values = 0;
        long concurrent = 0;

        Object after = null;
        while (true) {
            List<SensitiveRow> page = rows.scan(table, after, batchSize);

            for (SensitiveRow row : page) {
                scanned++;

                SensitiveRow current = row;
                for (int attempt = 1; current != null; attempt++) {
                    Map<String, String> expected = new LinkedHashMap<>();
                    Map<String, String> replacement = new LinkedHashMap<>();
                    for (String column : table.columns()) {
                        String v = current.value(column);
                        if (v == null || v.isEmpty() || encryptor.isEncrypted(v)) continue;
                        expected.put(column, v);
                        replacement.put(column, encryptor.encrypt(v));
                    }
                    if (replacement.isEmpty()) break;

                    if (rows.updateIfUnchanged(table, current.key(), expected, replacement)) {
                        updated++;
                        values += replacement.size();
                        break;
                    }

                    if (attempt == 1) concurrent++;
                    if (attempt == MAX_ROW_ATTEMPTS) {
                        throw new MigrationException(table.name(),
                                "row " + current.key() + " in " + table.name() + " kept changing during migration", null);
                    }
                    log.debug("Row {} in {} changed during migration, re-reading it", current.key(), table.name());
                    current = rows.find(table, current.key()).orElse(null);
                }
            }

            if (page.size() < batchSize) break;
            after = page.get(page.size() - 1).key();
        }

        return new TableMigrationResult(table.name(), scanned, updated, values, concurrent);
    }
}
