package com.tsforecast.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One submitted input row. Values are scalars only: {@link String}, {@link Double},
 * {@link Boolean} or {@code null}; anything else is stored as its string form.
 */
public final class RawRecord {

    private final Map<String, Object> values;

    private RawRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static RawRecord of(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((column, value) -> copy.put(column, toScalar(value)));
        return new RawRecord(copy);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    private static Object toScalar(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
