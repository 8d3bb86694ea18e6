package eu.optima.listino.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical field -> original column name, resolved once per supplier table.
 * Fields that could not be resolved are simply absent. Instances are immutable;
 * overrides and confirmation return new mappings.
 */
public final class ColumnMapping {

    public enum Origin {
        /** Produced by the column mapper; advisory until confirmed. */
        SUGGESTED,
        /** Reviewed (and possibly overridden) by the caller. */
        CONFIRMED,
        /** Fixed per-supplier dictionary, applied without review. */
        STATIC
    }

    private final LinkedHashMap<String, String> byField;
    private final Origin origin;

    public ColumnMapping(Map<String, String> byField, Origin origin) {
        this.byField = new LinkedHashMap<>();
        byField.forEach((field, column) -> {
            if (field != null && column != null)
                this.byField.put(field, column);
        });
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public static ColumnMapping suggested(Map<String, String> byField) {
        return new ColumnMapping(byField, Origin.SUGGESTED);
    }

    public static ColumnMapping confirmed(Map<String, String> byField) {
        return new ColumnMapping(byField, Origin.CONFIRMED);
    }

    /** @return the original column for the field, or null when unresolved */
    public String column(String field) {
        return byField.get(field);
    }

    public boolean isResolved(String field) {
        return byField.containsKey(field);
    }

    public Set<String> fields() {
        return Collections.unmodifiableSet(byField.keySet());
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(byField);
    }

    public Origin origin() {
        return origin;
    }

    /** True when the mapping may be applied on the strict path. */
    public boolean isApproved() {
        return origin != Origin.SUGGESTED;
    }

    public ColumnMapping confirm() {
        return origin == Origin.SUGGESTED ? new ColumnMapping(byField, Origin.CONFIRMED) : this;
    }

    /**
     * Replaces (or adds) the column for one field. The column must exist in the
     * table the mapping is meant for.
     */
    public ColumnMapping withOverride(String field, String column, Collection<String> tableHeaders) {
        if (!tableHeaders.contains(column))
            throw new IllegalArgumentException("column '" + column + "' does not exist in the supplier table");
        var copy = new LinkedHashMap<>(byField);
        copy.put(field, column);
        return new ColumnMapping(copy, Origin.CONFIRMED);
    }

    public ColumnMapping without(String field) {
        var copy = new LinkedHashMap<>(byField);
        copy.remove(field);
        return new ColumnMapping(copy, origin == Origin.SUGGESTED ? Origin.SUGGESTED : Origin.CONFIRMED);
    }

    /** Fields from {@code expected} this mapping does not resolve, in the given order. */
    public List<String> unresolved(Collection<String> expected) {
        return expected.stream().filter(f -> !byField.containsKey(f)).toList();
    }

    /** Columns referenced by this mapping that the table does not have. */
    public List<String> missingColumns(Collection<String> tableHeaders) {
        return byField.values().stream().filter(c -> !tableHeaders.contains(c)).distinct().toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ColumnMapping other))
            return false;
        return origin == other.origin && byField.equals(other.byField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(byField, origin);
    }

    @Override
    public String toString() {
        return origin + " " + byField;
    }
}
