package com.warden.application.ports.impl;

import com.warden.application.ports.SensitiveRowPort;
import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Dev-only row store. Replace with DB-backed implementation in infrastructure.
 * Keys are ordered by their string form.
 */
public final class InMemorySensitiveRowStore implements SensitiveRowPort {

    private static final Comparator<Object> KEY_ORDER = Comparator.comparing(Object::toString);

    private final Map<String, NavigableMap<Object, Map<String, String>>> tables = new HashMap<>();

    public synchronized void put(SensitiveTable table, Object key, Map<String, String> values) {
        Objects.requireNonNull(key, "key");
        Map<String, String> copy = new LinkedHashMap<>();
        for (String c : table.columns()) {
            copy.put(c, values.get(c));
        }
        rowsOf(table).put(key, copy);
    }

    public synchronized String get(SensitiveTable table, Object key, String column) {
        Map<String, String> row = rowsOf(table).get(key);
        return row == null ? null : row.get(column);
    }

    @Override
    public synchronized List<SensitiveRow> scan(SensitiveTable table, Object afterKey, int limit) {
        NavigableMap<Object, Map<String, String>> rows = rowsOf(table);
        NavigableMap<Object, Map<String, String>> view = afterKey == null ? rows : rows.tailMap(afterKey, false);

        List<SensitiveRow> out = new ArrayList<>();
        for (Map.Entry<Object, Map<String, String>> e : view.entrySet()) {
            if (out.size() >= limit) break;
            out.add(new SensitiveRow(e.getKey(), e.getValue()));
        }
        return out;
    }

    @Override
    public synchronized Optional<SensitiveRow> find(SensitiveTable table, Object key) {
        Map<String, String> row = rowsOf(table).get(key);
        return row == null ? Optional.empty() : Optional.of(new SensitiveRow(key, row));
    }

    @Override
    public synchronized boolean updateIfUnchanged(SensitiveTable table, Object key,
                                                  Map<String, String> expected, Map<String, String> replacement) {
        Map<String, String> row = rowsOf(table).get(key);
        if (row == null) return false;

        for (String c : replacement.keySet()) {
            if (!Objects.equals(row.get(c), expected.get(c))) return false;
        }
        row.putAll(replacement);
        return true;
    }

    private NavigableMap<Object, Map<String, String>> rowsOf(SensitiveTable table) {
        return tables.computeIfAbsent(table.name(), n -> new TreeMap<>(KEY_ORDER));
    }
}
