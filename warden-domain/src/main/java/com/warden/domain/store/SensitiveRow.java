package com.warden.domain.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a {@link SensitiveTable}: its key and the current stored value of each sensitive column.
 * Column values may be null.
 */
public record SensitiveRow(Object key, Map<String, String> values) {

    public SensitiveRow {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(values, "values");
        // Map.copyOf rejects null values, which are legal column contents here
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String value(String column) {
        return values.get(column);
    }
}
