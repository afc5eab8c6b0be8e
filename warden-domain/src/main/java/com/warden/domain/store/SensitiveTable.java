package com.warden.domain.store;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A table whose text columns hold sensitive data, addressed by a single key column.
 * Names end up in SQL text, so only plain identifiers are accepted.
 */
public record SensitiveTable(String name, String keyColumn, List<String> columns) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public SensitiveTable {
        requireIdentifier(name, "name");
        requireIdentifier(keyColumn, "keyColumn");
        Objects.requireNonNull(columns, "columns");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("SensitiveTable " + name + " has no columns");
        }
        for (String c : columns) {
            requireIdentifier(c, "column");
            if (c.equals(keyColumn)) {
                throw new IllegalArgumentException("Key column cannot be sensitive: " + name + "." + c);
            }
        }
        if (columns.stream().distinct().count() != columns.size()) {
            throw new IllegalArgumentException("Duplicate sensitive column in " + name);
        }
        columns = List.copyOf(columns);
    }

    public static SensitiveTable of(String name, String keyColumn, String... columns) {
        return new SensitiveTable(name, keyColumn, List.of(columns));
    }

    private static void requireIdentifier(String value, String what) {
        Objects.requireNonNull(value, what);
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a plain SQL identifier (" + what + "): " + value);
        }
    }
}
