package eu.optima.listino.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import eu.optima.listino.model.ColumnMapping;
import eu.optima.listino.model.RawTable;
import eu.optima.listino.model.SupplierRecord;

/** Turns a raw supplier table into canonical-shaped rows using a resolved column mapping. */
public class SupplierTableShaper {

    public enum Mode {
        /** Only confirmed or static mappings are applied. */
        STRICT,
        /** Any mapping is applied, suggestions included. */
        AUTO
    }

    private final FieldVocabulary vocabulary;

    public SupplierTableShaper() {
        this(FieldVocabulary.defaults());
    }

    public SupplierTableShaper(FieldVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Builds a static mapping from a per-supplier dictionary (original column ->
     * canonical field). Entries whose column the table lacks are ignored; when
     * two present columns target the same field the first entry wins.
     */
    public static ColumnMapping fromStatic(Map<String, String> dictionary, List<String> headers) {
        Map<String, String> byField = new LinkedHashMap<>();
        for (var e : dictionary.entrySet()) {
            if (headers.contains(e.getKey()))
                byField.putIfAbsent(e.getValue(), e.getKey());
        }
        return new ColumnMapping(byField, ColumnMapping.Origin.STATIC);
    }

    public List<SupplierRecord> shape(RawTable table, ColumnMapping mapping, Mode mode) {
        if (mode == Mode.STRICT && !mapping.isApproved())
            throw new IllegalStateException("column mapping must be confirmed before it is applied: " + mapping);
        List<String> missing = mapping.missingColumns(table.headers());
        if (!missing.isEmpty())
            throw new IllegalArgumentException("column mapping references columns not in the table: " + missing);

        Set<String> fields = new LinkedHashSet<>(vocabulary.fields());
        fields.addAll(mapping.fields());

        Map<String, Integer> columnOf = new LinkedHashMap<>();
        for (String f : mapping.fields())
            columnOf.put(f, table.columnIndex(mapping.column(f)));

        List<SupplierRecord> out = new ArrayList<>(table.size());
        for (int r = 0; r < table.size(); r++) {
            List<String> row = table.rows().get(r);
            if (row.stream().allMatch(ValueNormalizer::isBlank))
                continue;
            var rec = new SupplierRecord(r, fields);
            for (var e : columnOf.entrySet())
                rec.put(e.getKey(), ValueNormalizer.storageText(row.get(e.getValue())));
            out.add(rec);
        }
        return out;
    }
}
