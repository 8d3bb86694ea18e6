package eu.optima.listino.tools;

import java.util.List;

/** A field an operation depends on is absent from the price list schema. */
public class MissingFieldException extends RuntimeException {
    private final List<String> missing;

    public MissingFieldException(List<String> missing) {
        super("Column(s) " + missing + " not found in the price list");
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
