package eu.optima.listino.tools;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

import eu.optima.listino.model.CanonicalRecord;
import eu.optima.listino.model.RawTable;
import eu.optima.listino.model.TabularData;

/**
 * The company price list held in memory. The field set comes from the header
 * row and never changes; rows are append-only, so a row index stays valid for
 * the lifetime of the store.
 * <p>
 * Not thread-safe. A reconciliation takes the single writer session through
 * {@link #acquireWriter()}.
 */
public class CanonicalStore {

    private final List<String> fields;
    private final List<CanonicalRecord> rows = new ArrayList<>();

    // field -> trimmed value -> row indices in store order; built on first lookup
    private final Map<String, Map<String, TreeSet<Integer>>> indexes = new HashMap<>();

    private final AtomicBoolean writing = new AtomicBoolean(false);

    public CanonicalStore(List<String> fields) {
        if (fields == null || fields.isEmpty())
            throw new IllegalArgumentException("a price list needs at least one field");
        if (fields.stream().distinct().count() != fields.size())
            throw new IllegalArgumentException("duplicate field names: " + fields);
        this.fields = List.copyOf(fields);
    }

    public static CanonicalStore fromTable(RawTable table) {
        var store = new CanonicalStore(table.headers().stream().map(String::trim).toList());
        for (List<String> row : table.rows()) {
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < store.fields.size(); c++)
                values.put(store.fields.get(c), row.get(c));
            store.append(values);
        }
        return store;
    }

    public List<String> fields() {
        return fields;
    }

    public boolean hasField(String field) {
        return fields.contains(field);
    }

    public int size() {
        return rows.size();
    }

    /** A detached copy of the row; write through {@link #set} instead. */
    public CanonicalRecord record(int rowIndex) {
        return rows.get(checkRow(rowIndex)).copy();
    }

    public String get(int rowIndex, String field) {
        checkField(field);
        return rows.get(checkRow(rowIndex)).get(field);
    }

    public void set(int rowIndex, String field, String value) {
        checkField(field);
        String old = rows.get(checkRow(rowIndex)).put(field, value);
        var index = indexes.get(field);
        if (index != null) {
            unindex(index, old, rowIndex);
            index(index, value, rowIndex);
        }
    }

    /** All store fields set to null. */
    public Map<String, String> blankRecord() {
        Map<String, String> blank = new LinkedHashMap<>();
        for (String f : fields)
            blank.put(f, null);
        return blank;
    }

    /**
     * Appends a row. Fields missing from {@code values} are null; fields the
     * store does not have are rejected.
     *
     * @return the new row index
     */
    public int append(Map<String, String> values) {
        for (String f : values.keySet())
            checkField(f);
        Map<String, String> full = blankRecord();
        full.putAll(values);
        int rowIndex = rows.size();
        rows.add(new CanonicalRecord(rowIndex, full));
        for (var e : indexes.entrySet())
            index(e.getValue(), full.get(e.getKey()), rowIndex);
        return rowIndex;
    }

    /**
     * Rows whose trimmed value for {@code field} equals the trimmed lookup value
     * (case-sensitive), ascending. Blank lookups and unknown fields find nothing.
     */
    public List<Integer> find(String field, String value) {
        if (!hasField(field) || ValueNormalizer.isBlank(value))
            return List.of();
        var hits = indexFor(field).get(value.trim());
        return hits == null ? List.of() : List.copyOf(hits);
    }

    public CanonicalStore copy() {
        var c = new CanonicalStore(fields);
        for (CanonicalRecord r : rows)
            c.rows.add(r.copy());
        return c;
    }

    public TabularData toTabular() {
        List<List<Object>> out = new ArrayList<>(rows.size());
        for (CanonicalRecord r : rows)
            out.add(new ArrayList<>(r.values().values()));
        return new TabularData(fields, out);
    }

    /**
     * Claims the store for one reconciliation. Only one writer may be active; a
     * second claim before {@link Writer#close()} fails.
     */
    public Writer acquireWriter() {
        if (!writing.compareAndSet(false, true))
            throw new IllegalStateException("price list is already being reconciled; feed supplier batches sequentially");
        return new Writer();
    }

    public final class Writer implements AutoCloseable {
        private boolean open = true;

        private Writer() {
        }

        @Override
        public void close() {
            if (open) {
                open = false;
                writing.set(false);
            }
        }
    }

    // ---------- index maintenance ----------

    private Map<String, TreeSet<Integer>> indexFor(String field) {
        return indexes.computeIfAbsent(field, f -> {
            Map<String, TreeSet<Integer>> index = new HashMap<>();
            for (CanonicalRecord r : rows)
                index(index, r.get(f), r.rowIndex());
            return index;
        });
    }

    private static void index(Map<String, TreeSet<Integer>> index, String value, int rowIndex) {
        if (ValueNormalizer.isBlank(value))
            return;
        index.computeIfAbsent(value.trim(), k -> new TreeSet<>()).add(rowIndex);
    }

    private static void unindex(Map<String, TreeSet<Integer>> index, String value, int rowIndex) {
        if (ValueNormalizer.isBlank(value))
            return;
        var set = index.get(value.trim());
        if (set != null) {
            set.remove(rowIndex);
            if (set.isEmpty())
                index.remove(value.trim());
        }
    }

    private void checkField(String field) {
        if (!fields.contains(field))
            throw new IllegalArgumentException("field '" + field + "' is not part of the price list schema");
    }

    private int checkRow(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size())
            throw new IndexOutOfBoundsException("row " + rowIndex + " not in price list of " + rows.size() + " rows");
        return rowIndex;
    }
}
