package com.warden.cli.tools;

import com.warden.application.config.ConfigValidationResult;
import com.warden.application.config.ConfigValidator;
import com.warden.application.ports.ConfigPort;
import com.warden.cli.bootstrap.Bootstrap;

import java.io.IOException;
import java.io.PrintStream;

final class ToolSupport {

    private ToolSupport() {}

    /** Loads and validates config; prints the problems and returns null if it is unusable. */
    static ConfigPort loadValidConfig(String[] args, PrintStream out) {
        ConfigPort cfg;
        try {
            cfg = Bootstrap.loadConfig(Bootstrap.configDir(args));
        } catch (IOException e) {
            out.println("❌ Failed to read config: " + e.getMessage());
            return null;
        }

        ConfigValidationResult res = new ConfigValidator().validate(cfg);
        if (!res.isValid()) {
            out.println("❌ Config problems (run validate-config for details):");
            for (String err : res.errors()) {
                out.println(" - " + err);
            }
            return null;
        }
        return cfg;
    }
}
