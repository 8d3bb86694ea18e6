package eu.optima.listino.enums;

/** Which side of the reconciliation a table comes from; selects the mapper targets. */
public enum Role {
    INTERNAL("internal"),
    SUPPLIER("supplier");

    public final String label;

    Role(String label) {
        this.label = label;
    }

    public static Role parse(String s) {
        if (s == null)
            return SUPPLIER;
        switch (s.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "internal":
            case "azienda":
                return INTERNAL;
            case "supplier":
            case "fornitore":
            default:
                return SUPPLIER;
        }
    }
}
