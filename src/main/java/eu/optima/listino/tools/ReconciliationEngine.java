package eu.optima.listino.tools;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import eu.optima.listino.model.MatchResult;
import eu.optima.listino.model.ReconciliationOutcome;
import eu.optima.listino.model.SupplierRecord;

/**
 * Classifies every supplier row as UPDATE or INSERT and applies it to the
 * canonical store.
 * <p>
 * Only input fields are ever written on an existing row; everything else
 * (derived or formula-bearing columns) is left as it is. When no input fields
 * are given, every field the supplier row carries counts as input. A new row
 * also receives the supplier's key fields, input or not, so a later run matches
 * it instead of inserting it again. Rows are
 * applied in order, so a row inserted earlier in a batch is matched by later
 * rows with the same key.
 */
public class ReconciliationEngine {

    /** A supplier row together with the match it would get. */
    public record PlannedRow(SupplierRecord row, MatchResult match) {
    }

    /** Dry-run split of a batch; the caller may pick rows and pass them to {@code apply}. */
    public record Preview(List<PlannedRow> updates, List<PlannedRow> inserts) {
        public Preview {
            updates = List.copyOf(updates);
            inserts = List.copyOf(inserts);
        }
    }

    private final RecordMatcher matcher;

    public ReconciliationEngine() {
        this(new RecordMatcher());
    }

    public ReconciliationEngine(RecordMatcher matcher) {
        this.matcher = matcher;
    }

    public List<ReconciliationOutcome> apply(List<SupplierRecord> supplierRows, List<String> keys,
            Set<String> inputFields, CanonicalStore store) {
        return apply(supplierRows, keys, inputFields, store, new ReconciliationReport());
    }

    public List<ReconciliationOutcome> apply(List<SupplierRecord> supplierRows, List<String> keys,
            Set<String> inputFields, CanonicalStore store, ReconciliationReport report) {
        if (keys == null || keys.isEmpty())
            throw new IllegalArgumentException("at least one key field is required");

        List<ReconciliationOutcome> outcomes = new ArrayList<>(supplierRows.size());
        try (var writer = store.acquireWriter()) {
            for (SupplierRecord row : supplierRows) {
                MatchResult match = matcher.match(row, keys, store);
                ReconciliationOutcome outcome;
                if (match.found()) {
                    if (match.isAmbiguous())
                        report.recordAmbiguous(row, match);
                    outcome = update(row, match, inputFields, store);
                } else {
                    outcome = insert(row, keys, inputFields, store);
                }
                report.recordOutcome(outcome);
                outcomes.add(outcome);
            }
        }
        return outcomes;
    }

    /**
     * Matches every row against the store as it is now, without writing. Rows
     * that duplicate a key inserted earlier in the same batch both show up as
     * inserts here.
     */
    public Preview preview(List<SupplierRecord> supplierRows, List<String> keys, CanonicalStore store) {
        List<PlannedRow> updates = new ArrayList<>();
        List<PlannedRow> inserts = new ArrayList<>();
        for (SupplierRecord row : supplierRows) {
            MatchResult match = matcher.match(row, keys, store);
            (match.found() ? updates : inserts).add(new PlannedRow(row, match));
        }
        return new Preview(updates, inserts);
    }

    private ReconciliationOutcome update(SupplierRecord row, MatchResult match, Set<String> inputFields,
            CanonicalStore store) {
        int target = match.rowIndex();
        Set<String> changed = new LinkedHashSet<>();
        for (String field : writableFields(row, inputFields, store)) {
            String incoming = row.get(field);
            if (incoming == null)
                continue;
            if (!ValueNormalizer.sameText(incoming, store.get(target, field))) {
                store.set(target, field, incoming);
                changed.add(field);
            }
        }
        return ReconciliationOutcome.updated(target, changed, row.sourceRow(), match.isAmbiguous());
    }

    private ReconciliationOutcome insert(SupplierRecord row, List<String> keys, Set<String> inputFields,
            CanonicalStore store) {
        Map<String, String> values = store.blankRecord();
        Set<String> copied = new LinkedHashSet<>(writableFields(row, inputFields, store));
        // keys travel with the new row so the next run finds it
        for (String key : keys)
            if (store.hasField(key) && row.fields().contains(key))
                copied.add(key);
        for (String field : copied) {
            String incoming = row.get(field);
            if (incoming != null)
                values.put(field, incoming);
        }
        int rowIndex = store.append(values);
        return ReconciliationOutcome.inserted(rowIndex, row.sourceRow());
    }

    // store field order, restricted to input fields (or to what the row carries)
    private static List<String> writableFields(SupplierRecord row, Set<String> inputFields, CanonicalStore store) {
        List<String> out = new ArrayList<>();
        for (String field : store.fields()) {
            boolean allowed = inputFields != null ? inputFields.contains(field) : row.fields().contains(field);
            if (allowed)
                out.add(field);
        }
        return out;
    }
}
