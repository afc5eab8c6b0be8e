package com.warden.cli.tools;

import com.warden.application.crypto.FieldEncryptor;
import com.warden.application.crypto.KeyValidationException;
import com.warden.application.ports.ConfigPort;
import com.warden.application.ports.StoreAccessException;
import com.warden.cli.bootstrap.Bootstrap;
import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTable;
import com.warden.domain.store.SensitiveTables;
import com.warden.infrastructure.security.FieldEncryptionException;

import java.io.PrintStream;

/**
 * Checks that the configured key works, and that it opens what is already stored.
 *
 * Usage:
 *   java -jar warden-cli.jar verify-key [--config <dir>] [--sample N]
 *
 * Exit codes:
 *   0: OK
 *   2: config invalid or encryption disabled
 *   4: key validation failed, or stored ciphertext does not decrypt with this key
 */
public class KeyCheckTool {

    static final int DEFAULT_SAMPLE = 50;

    public static int run(String[] args) {
        return run(args, System.out);
    }

    public static int run(String[] args, PrintStream out) {
        int sample = DEFAULT_SAMPLE;
        for (int i = 0; i < args.length; i++) {
            if ("--sample".equalsIgnoreCase(args[i]) && i + 1 < args.length) {
                try {
                    sample = Math.max(0, Integer.parseInt(args[++i].trim()));
                } catch (NumberFormatException e) {
                    out.println("❌ --sample expects a number, got: " + args[i]);
                    return 2;
                }
            }
        }

        ConfigPort cfg = ToolSupport.loadValidConfig(args, out);
        if (cfg == null) return 2;

        Bootstrap.Components c;
        try {
            c = Bootstrap.wire(cfg);
        } catch (FieldEncryptionException e) {
            out.println("❌ Key cannot be used: " + e.getMessage());
            return 4;
        } catch (StoreAccessException e) {
            out.println("❌ Database unavailable: " + e.getMessage());
            return 2;
        }

        FieldEncryptor enc = c.encryptor();
        if (!enc.isEnabled()) {
            out.println("Encryption is disabled (encryption.enabled=false).");
            return 2;
        }

        try {
            enc.validateKey();
        } catch (KeyValidationException e) {
            out.println("❌ Key validation failed: " + e.getMessage());
            return 4;
        }
        out.println("✅ Round trip OK.");

        if (sample == 0) return 0;

        long checked = 0;
        long unreadable = 0;
        try {
            for (SensitiveTable t : SensitiveTables.all()) {
                for (SensitiveRow row : c.rows().scan(t, null, sample)) {
                    for (String col : t.columns()) {
                        String v = row.value(col);
                        if (v == null || !enc.isEncrypted(v)) continue;
                        checked++;
                        // decrypt hands back the stored value when it does not authenticate
                        if (v.equals(enc.decrypt(v))) unreadable++;
                    }
                }
            }
        } catch (StoreAccessException e) {
            out.println("❌ Database unavailable: " + e.getMessage());
            return 2;
        }

        if (unreadable > 0) {
            out.println("❌ " + unreadable + " of " + checked
                    + " stored encrypted values do not decrypt with this key.");
            return 4;
        }
        out.println("✅ " + checked + " stored encrypted values decrypt with this key.");
        return 0;
    }
}
