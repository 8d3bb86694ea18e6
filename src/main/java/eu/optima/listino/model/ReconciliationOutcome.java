package eu.optima.listino.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What happened to one supplier row.
 *
 * @param rowIndex      canonical row updated, or the index of the appended row
 * @param changedFields fields overwritten on update; empty when nothing changed or on insert
 * @param supplierRow   source row number within the supplier table
 * @param ambiguous     the update target was chosen among several candidates
 */
public record ReconciliationOutcome(Kind kind, int rowIndex, Set<String> changedFields, int supplierRow,
        boolean ambiguous) {

    public enum Kind {
        UPDATED,
        INSERTED
    }

    public ReconciliationOutcome {
        changedFields = Collections.unmodifiableSet(new LinkedHashSet<>(changedFields));
    }

    public static ReconciliationOutcome updated(int rowIndex, Set<String> changed, int supplierRow, boolean ambiguous) {
        return new ReconciliationOutcome(Kind.UPDATED, rowIndex, changed, supplierRow, ambiguous);
    }

    public static ReconciliationOutcome inserted(int rowIndex, int supplierRow) {
        return new ReconciliationOutcome(Kind.INSERTED, rowIndex, Set.of(), supplierRow, false);
    }

    public boolean changed() {
        return kind == Kind.INSERTED || !changedFields.isEmpty();
    }
}
