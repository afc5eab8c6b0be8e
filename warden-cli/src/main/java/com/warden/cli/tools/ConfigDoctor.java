package com.warden.cli.tools;

import com.warden.application.config.ConfigValidationResult;
import com.warden.application.config.ConfigValidator;
import com.warden.application.ports.ConfigPort;
import com.warden.cli.bootstrap.Bootstrap;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Usage:
 *   java -jar warden-cli.jar validate-config [--config <dir>]
 *
 * Exit codes:
 *   0: OK
 *   2: Problems found
 */
public class ConfigDoctor {

    public static int run(String[] args) {
        return run(args, System.out);
    }

    public static int run(String[] args, PrintStream out) {
        Path dir = Bootstrap.configDir(args);

        out.println("configDir: " + dir.toAbsolutePath());
        out.println("warden.properties: " + Files.exists(dir.resolve("warden.properties")));
        out.println("secrets.properties: " + Files.exists(dir.resolve("secrets.properties")));
        out.println(".env: " + Files.exists(dir.resolve(".env")));

        ConfigPort cfg;
        try {
            cfg = Bootstrap.loadConfig(dir);
        } catch (IOException e) {
            out.println("❌ Failed to read config: " + e.getMessage());
            return 2;
        }

        ConfigPrinter.printMasked(cfg, out);

        ConfigValidationResult res = new ConfigValidator().validate(cfg);
        if (res.isValid()) {
            out.println("✅ Config OK.");
            return 0;
        }

        out.println("❌ Config problems:");
        for (String err : res.errors()) {
            out.println(" - " + err);
        }
        out.println("\nTips:");
        out.println(" - Put encryption.key in secrets.properties, or set WARDEN_ENCRYPTION_KEY.");
        out.println(" - Leave encryption.enabled=false to run without field encryption.");
        return 2;
    }
}
