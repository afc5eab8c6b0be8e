package com.warden.application.ports;

import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row-level access to the sensitive columns of a table, used by migration and coverage scans.
 */
public interface SensitiveRowPort {

    /**
     * Returns up to {@code limit} rows ordered by key, starting after {@code afterKey}
     * ({@code null} starts at the beginning).
     *
     * @throws StoreAccessException on read failure
     */
    List<SensitiveRow> scan(SensitiveTable table, Object afterKey, int limit);

    /**
     * Re-reads one row by key.
     *
     * @return empty if the row no longer exists
     * @throws StoreAccessException on read failure
     */
    Optional<SensitiveRow> find(SensitiveTable table, Object key);

    /**
     * Writes {@code replacement} values into one row, but only if every replaced column still holds the
     * value given in {@code expected}. Columns not named in {@code replacement} are untouched.
     *
     * @return false if the row is gone or one of the columns changed since it was read
     * @throws StoreAccessException on write failure
     */
    boolean updateIfUnchanged(SensitiveTable table, Object key,
                              Map<String, String> expected, Map<String, String> replacement);
}
