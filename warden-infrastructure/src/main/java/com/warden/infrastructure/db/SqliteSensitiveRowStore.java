package com.warden.infrastructure.db;

import com.warden.application.ports.SensitiveRowPort;
import com.warden.application.ports.StoreAccessException;
import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyset-paginated reads and compare-and-swap writes over the sensitive columns of a table.
 * Table and column names come from {@link SensitiveTable}, which only admits plain identifiers.
 */
public class SqliteSensitiveRowStore implements SensitiveRowPort {

    private final Database db;

    public SqliteSensitiveRowStore(Database db) {
        this.db = db;
    }

    @Override
    public List<SensitiveRow> scan(SensitiveTable table, Object afterKey, int limit) {
        String key = table.keyColumn();
        String sql = selectFrom(table)
                + (afterKey == null ? "" : " WHERE " + key + " > ?")
                + " ORDER BY " + key + " LIMIT ?";

        List<SensitiveRow> out = new ArrayList<>();
        try (Connection c = db.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (afterKey != null) ps.setObject(i++, afterKey);
            ps.setInt(i, limit);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toRow(table, rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to scan " + table.name(), e);
        }
        return out;
    }

    @Override
    public Optional<SensitiveRow> find(SensitiveTable table, Object key) {
        String sql = selectFrom(table) + " WHERE " + table.keyColumn() + " = ?";
        try (Connection c = db.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toRow(table, rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to read " + table.name() + " row " + key, e);
        }
    }

    @Override
    public boolean updateIfUnchanged(SensitiveTable table, Object key,
                                     Map<String, String> expected, Map<String, String> replacement) {
        if (replacement.isEmpty()) return false;
        for (String column : replacement.keySet()) {
            if (!table.columns().contains(column)) {
                throw new IllegalArgumentException("Not a sensitive column of " + table.name() + ": " + column);
            }
        }

        List<String> columns = new ArrayList<>(replacement.keySet());
        StringBuilder sql = new StringBuilder("UPDATE ").append(table.name()).append(" SET ");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sql.append(", ");
            sql.append(columns.get(i)).append(" = ?");
        }
        sql.append(" WHERE ").append(table.keyColumn()).append(" = ?");
        for (String column : columns) {
            // IS matches NULL = NULL too
            sql.append(" AND ").append(column).append(" IS ?");
        }

        try (Connection c = db.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            for (String column : columns) {
                ps.setString(i++, replacement.get(column));
            }
            ps.setObject(i++, key);
            for (String column : columns) {
                ps.setString(i++, expected.get(column));
            }
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to update " + table.name() + " row " + key, e);
        }
    }

    private static String selectFrom(SensitiveTable table) {
        return "SELECT " + table.keyColumn() + ", " + String.join(", ", table.columns()) + " FROM " + table.name();
    }

    private static SensitiveRow toRow(SensitiveTable table, ResultSet rs) throws SQLException {
        Object key = rs.getObject(1);
        // non-INTEGER primary keys accept NULL in SQLite; such a row cannot be addressed for update
        if (key == null) {
            throw new StoreAccessException(table.name() + " has a row with NULL " + table.keyColumn(), null);
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int col = 0; col < table.columns().size(); col++) {
            values.put(table.columns().get(col), rs.getString(col + 2));
        }
        return new SensitiveRow(key, values);
    }
}
