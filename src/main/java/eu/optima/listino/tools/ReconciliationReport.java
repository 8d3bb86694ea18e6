package eu.optima.listino.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import eu.optima.listino.model.MatchResult;
import eu.optima.listino.model.ReconciliationOutcome;
import eu.optima.listino.model.SupplierRecord;

/** Batch summary: counts per outcome, ambiguous matches and unmapped fields per supplier. */
public final class ReconciliationReport {
    private int updated = 0;
    private int unchanged = 0;
    private int inserted = 0;
    private int ambiguous = 0;
    private int skippedSuppliers = 0;
    private final Map<String, Integer> changedByField = new LinkedHashMap<>();
    private final Map<String, List<String>> unmappedBySupplier = new LinkedHashMap<>();
    private final List<String> samples = new ArrayList<>();
    private final int maxSamples;

    public ReconciliationReport() {
        this(200);
    }

    public ReconciliationReport(int maxSamples) {
        this.maxSamples = Math.max(0, maxSamples);
    }

    public synchronized void reset() {
        updated = 0;
        unchanged = 0;
        inserted = 0;
        ambiguous = 0;
        skippedSuppliers = 0;
        changedByField.clear();
        unmappedBySupplier.clear();
        samples.clear();
    }

    public synchronized void recordOutcome(ReconciliationOutcome outcome) {
        switch (outcome.kind()) {
            case INSERTED -> inserted++;
            case UPDATED -> {
                if (outcome.changedFields().isEmpty()) {
                    unchanged++;
                } else {
                    updated++;
                    for (String f : outcome.changedFields())
                        changedByField.merge(f, 1, Integer::sum);
                }
            }
        }
    }

    public synchronized void recordAmbiguous(SupplierRecord row, MatchResult match) {
        ambiguous++;
        if (samples.size() < maxSamples) {
            samples.add(String.format(Locale.ROOT, "{supplierRow:%d, key:'%s', value:'%s', candidates:%d, used:#%d}",
                    row.sourceRow(), match.keyField(), row.get(match.keyField()), match.candidates(),
                    match.rowIndex()));
        }
    }

    public synchronized void recordUnmapped(String supplier, List<String> fields) {
        if (fields == null || fields.isEmpty())
            return;
        unmappedBySupplier.computeIfAbsent(supplier, k -> new ArrayList<>()).addAll(fields);
    }

    public synchronized void recordSkippedSupplier(String supplier, List<String> unresolved) {
        skippedSuppliers++;
        recordUnmapped(supplier, unresolved);
    }

    public synchronized int updated() {
        return updated;
    }

    public synchronized int unchanged() {
        return unchanged;
    }

    public synchronized int inserted() {
        return inserted;
    }

    public synchronized int ambiguous() {
        return ambiguous;
    }

    public synchronized int skippedSuppliers() {
        return skippedSuppliers;
    }

    public synchronized Map<String, List<String>> unmapped() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        unmappedBySupplier.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }

    public synchronized List<String> samples() {
        return List.copyOf(samples);
    }

    public synchronized List<String> summaryLines() {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "Rows updated: %d | unchanged: %d | inserted: %d | ambiguous: %d",
                updated, unchanged, inserted, ambiguous));
        if (!changedByField.isEmpty()) {
            lines.add("-- changed fields --");
            changedByField.forEach((f, n) -> lines.add("  " + f + ": " + n));
        }
        if (skippedSuppliers > 0)
            lines.add("Suppliers skipped: " + skippedSuppliers);
        if (!unmappedBySupplier.isEmpty()) {
            lines.add("-- unmapped fields --");
            unmappedBySupplier.forEach((s, f) -> lines.add("  " + s + " -> " + f));
        }
        if (!samples.isEmpty()) {
            lines.add("-- ambiguous matches (" + samples.size() + ") --");
            for (String s : samples)
                lines.add("  " + s);
        }
        return lines;
    }

    public void printSummary() {
        for (String line : summaryLines())
            System.out.println(line);
    }
}
