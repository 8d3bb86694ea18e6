package eu.optima.listino.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the company price list. The field set is fixed when the record is
 * created; values may be null.
 */
public final class CanonicalRecord {
    private final int rowIndex;
    private final LinkedHashMap<String, String> values;

    public CanonicalRecord(int rowIndex, Map<String, String> values) {
        this.rowIndex = rowIndex;
        this.values = new LinkedHashMap<>(values);
    }

    public int rowIndex() {
        return rowIndex;
    }

    public String get(String field) {
        return values.get(field);
    }

    public boolean hasField(String field) {
        return values.containsKey(field);
    }

    /** @return the previous value */
    public String put(String field, String value) {
        if (!values.containsKey(field))
            throw new IllegalArgumentException("field '" + field + "' is not part of the price list schema");
        return values.put(field, value);
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    public CanonicalRecord copy() {
        return new CanonicalRecord(rowIndex, values);
    }

    @Override
    public String toString() {
        return "#" + rowIndex + " " + values;
    }
}
