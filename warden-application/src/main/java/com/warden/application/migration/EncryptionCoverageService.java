package com.warden.application.migration;

import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.ports.SensitiveRowPort;
import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTable;
import com.warden.domain.store.SensitiveTables;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only scan that reports, per sensitive column, how much of the stored data is ciphertext-shaped.
 * Uses the same heuristic as migration, so a plaintext that happens to be long valid base64 counts
 * as encrypted here as well.
 */
public class EncryptionCoverageService {

    private final FieldEncryptor encryptor;
    private final SensitiveRowPort rows;
    private final List<SensitiveTable> tables;
    private final int batchSize;

    public EncryptionCoverageService(FieldEncryptor encryptor, SensitiveRowPort rows) {
        this(encryptor, rows, SensitiveTables.all(), EncryptionMigrationService.DEFAULT_BATCH_SIZE);
    }

    public EncryptionCoverageService(FieldEncryptor encryptor, SensitiveRowPort rows, List<SensitiveTable> tables, int batchSize) {
        this.encryptor = Objects.requireNonNull(encryptor, "encryptor");
        this.rows = Objects.requireNonNull(rows, "rows");
        this.tables = List.copyOf(tables);
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        this.batchSize = batchSize;
    }

    public List<ColumnCoverage> scan() {
        List<ColumnCoverage> out = new ArrayList<>();
        for (SensitiveTable t : tables) {
            out.addAll(scan(t));
        }
        return out;
    }

    public List<ColumnCoverage> scan(SensitiveTable table) {
        int n = table.columns().size();
        long[] encrypted = new long[n];
        long[] plaintext = new long[n];
        long[] empty = new long[n];

        Object after = null;
        while (true) {
            List<SensitiveRow> page = rows.scan(table, after, batchSize);
            for (SensitiveRow row : page) {
                for (int i = 0; i < n; i++) {
                    String v = row.value(table.columns().get(i));
                    if (v == null || v.isEmpty()) empty[i]++;
                    else if (encryptor.isEncrypted(v)) encrypted[i]++;
                    else plaintext[i]++;
                }
            }
            if (page.size() < batchSize) break;
            after = page.get(page.size() - 1).key();
        }

        List<ColumnCoverage> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new ColumnCoverage(table.name(), table.columns().get(i), encrypted[i], plaintext[i], empty[i]));
        }
        return out;
    }
}
