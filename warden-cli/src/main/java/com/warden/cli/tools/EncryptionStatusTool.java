package com.warden.cli.tools;

import com.warden.application.migration.ColumnCoverage;
import com.warden.application.migration.MigrationException;
import com.warden.application.ports.ConfigPort;
import com.warden.application.ports.StoreAccessException;
import com.warden.cli.bootstrap.Bootstrap;
import com.warden.domain.store.SensitiveTable;
import com.warden.domain.store.SensitiveTables;
import com.warden.infrastructure.security.FieldEncryptionException;

import java.io.PrintStream;
import java.util.List;

/**
 * Usage:
 *   java -jar warden-cli.jar status [--config <dir>] [--table <name>]
 *
 * Prints the migration marker and, per sensitive column, how many values look encrypted.
 */
public class EncryptionStatusTool {

    public static int run(String[] args) {
        return run(args, System.out);
    }

    public static int run(String[] args, PrintStream out) {
        SensitiveTable only = null;
        for (int i = 0; i < args.length; i++) {
            if ("--table".equalsIgnoreCase(args[i]) && i + 1 < args.length) {
                try {
                    only = SensitiveTables.byName(args[++i].trim());
                } catch (IllegalArgumentException e) {
                    out.println("❌ " + e.getMessage());
                    return 2;
                }
            }
        }

        ConfigPort cfg = ToolSupport.loadValidConfig(args, out);
        if (cfg == null) return 2;

        try {
            Bootstrap.Components c = Bootstrap.wire(cfg);

            out.println("database: " + c.database().path());
            out.println("encryption: " + (c.encryptor().isEnabled() ? "enabled" : "disabled"));
            out.println("migration marker: " + (c.migration().isMigrated() ? "set" : "not set"));

            List<ColumnCoverage> coverage = only == null ? c.coverage().scan() : c.coverage().scan(only);
            long plaintext = 0;
            out.println();
            for (ColumnCoverage cc : coverage) {
                out.printf(" - %-40s encrypted=%d plaintext=%d empty=%d%n",
                        cc.table() + "." + cc.column(), cc.encrypted(), cc.plaintext(), cc.empty());
                plaintext += cc.plaintext();
            }
            out.println();
            out.println(plaintext == 0
                    ? "All stored sensitive values are encrypted."
                    : plaintext + " sensitive values are still plaintext.");
            return 0;
        } catch (FieldEncryptionException | StoreAccessException | MigrationException e) {
            out.println("❌ Status failed: " + e.getMessage());
            return 2;
        }
    }
}
