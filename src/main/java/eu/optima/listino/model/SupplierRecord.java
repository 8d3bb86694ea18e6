package eu.optima.listino.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A supplier row already expressed in canonical field names. Every field of the
 * vocabulary is present; fields the supplier does not provide hold null.
 */
public final class SupplierRecord {
    private final int sourceRow;
    private final LinkedHashMap<String, String> values = new LinkedHashMap<>();

    public SupplierRecord(int sourceRow, Collection<String> fields) {
        this.sourceRow = sourceRow;
        for (String f : fields)
            values.put(f, null);
    }

    public static SupplierRecord of(int sourceRow, Collection<String> fields, Map<String, String> supplied) {
        var r = new SupplierRecord(sourceRow, fields);
        supplied.forEach(r::put);
        return r;
    }

    public int sourceRow() {
        return sourceRow;
    }

    public String get(String field) {
        return values.get(field);
    }

    public void put(String field, String value) {
        values.put(field, value);
    }

    public Set<String> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "supplier row " + sourceRow + " " + values;
    }
}
