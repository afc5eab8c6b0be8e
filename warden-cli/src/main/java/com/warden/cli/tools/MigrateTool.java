package com.warden.cli.tools;

import com.warden.application.crypto.KeyValidationException;
import com.warden.application.migration.MigrationException;
import com.warden.application.migration.MigrationReport;
import com.warden.application.migration.TableMigrationResult;
import com.warden.application.ports.ConfigPort;
import com.warden.application.ports.StoreAccessException;
import com.warden.cli.bootstrap.Bootstrap;
import com.warden.infrastructure.security.FieldEncryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Encrypts every plaintext sensitive value in the database, once.
 *
 * Usage:
 *   java -jar warden-cli.jar migrate [--config <dir>]
 *
 * Exit codes:
 *   0: migrated, or already migrated
 *   2: config invalid, encryption disabled, or the key cannot be used
 *   3: migration failed (safe to re-run)
 */
public class MigrateTool {

    private static final Logger log = LoggerFactory.getLogger(MigrateTool.class);

    public static int run(String[] args) {
        return run(args, System.out);
    }

    public static int run(String[] args, PrintStream out) {
        ConfigPort cfg = ToolSupport.loadValidConfig(args, out);
        if (cfg == null) return 2;

        Bootstrap.Components c;
        try {
            c = Bootstrap.wire(cfg);
            if (!c.encryptor().isEnabled()) {
                out.println("Encryption is disabled (encryption.enabled=false); nothing to migrate.");
                return 2;
            }
            c.encryptor().validateKey();
        } catch (FieldEncryptionException | KeyValidationException | StoreAccessException e) {
            log.error("Cannot start migration", e);
            out.println("❌ Cannot start migration: " + e.getMessage());
            return 2;
        }

        MigrationReport report;
        try {
            report = c.migration().migrateToEncrypted();
        } catch (MigrationException e) {
            out.println("❌ Migration failed" + (e.table() == null ? "" : " at table " + e.table())
                    + ": " + e.getMessage());
            out.println("   Nothing was marked complete; re-run migrate once the cause is fixed.");
            return 3;
        }

        if (report.alreadyMigrated()) {
            out.println("✅ Already migrated (" + c.settings().databasePath() + ").");
            return 0;
        }

        for (TableMigrationResult t : report.tables()) {
            out.printf(" - %-20s scanned=%d updated=%d values=%d%s%n",
                    t.table(), t.rowsScanned(), t.rowsUpdated(), t.valuesEncrypted(),
                    t.rowsChangedConcurrently() > 0 ? " changedConcurrently=" + t.rowsChangedConcurrently() : "");
        }
        out.println("✅ Encrypted " + report.valuesEncrypted() + " values in " + report.rowsUpdated()
                + " rows (" + report.elapsed().toMillis() + " ms).");
        return 0;
    }
}
