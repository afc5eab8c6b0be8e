package com.warden.cli.tools;

import com.warden.application.config.ConfigKey;
import com.warden.application.ports.ConfigPort;

import java.io.PrintStream;

public final class ConfigPrinter {

    private ConfigPrinter() {}

    /** Prints every known key; secrets are masked. */
    public static void printMasked(ConfigPort cfg, PrintStream out) {
        out.println("Config (masked)");
        for (ConfigKey k : ConfigKey.values()) {
            String v = k.isSecret() ? mask(cfg.getSecret(k.key())) : cfg.get(k.key(), k.defaultValue());
            out.println(" - " + k.key() + " = " + v);
        }
    }

    static String mask(String v) {
        if (v == null || v.isEmpty()) return "<empty>";
        if (v.length() <= 6) return "***";
        return v.substring(0, 2) + "***" + v.substring(v.length() - 2);
    }
}
