package com.warden.cli;

import com.warden.cli.tools.ConfigDoctor;
import com.warden.cli.tools.EncryptionStatusTool;
import com.warden.cli.tools.KeyCheckTool;
import com.warden.cli.tools.MigrateTool;

import java.io.PrintStream;
import java.util.Arrays;

public class Main {

    public static void main(String[] args) {
        System.exit(dispatch(args));
    }

    static int dispatch(String[] args) {
        if (args.length == 0) {
            printHelp(System.out);
            return 1;
        }

        String cmd = args[0].trim().toLowerCase();
        String[] tail = Arrays.copyOfRange(args, 1, args.length);

        switch (cmd) {
            case "migrate":
                return MigrateTool.run(tail);

            case "verify-key":
                return KeyCheckTool.run(tail);

            case "status":
                return EncryptionStatusTool.run(tail);

            case "validate-config":
            case "doctor":
                return ConfigDoctor.run(tail);

            case "help":
            case "--help":
            case "-h":
                printHelp(System.out);
                return 0;

            default:
                System.err.println("Unknown command: " + cmd);
                printHelp(System.err);
                return 1;
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("Warden field encryption CLI");
        out.println("Usage:");
        out.println("  java -jar warden-cli.jar migrate          [--config <dir>]   (encrypt existing plaintext, once)");
        out.println("  java -jar warden-cli.jar verify-key       [--config <dir>] [--sample N]");
        out.println("  java -jar warden-cli.jar status           [--config <dir>]   (per-column encryption coverage)");
        out.println("  java -jar warden-cli.jar validate-config  [--config <dir>]");
        out.println();
        out.println("Config is read from <dir>/warden.properties, .env and secrets.properties (default dir: ./config);");
        out.println("WARDEN_* environment variables override, e.g. WARDEN_ENCRYPTION_KEY.");
    }
}
