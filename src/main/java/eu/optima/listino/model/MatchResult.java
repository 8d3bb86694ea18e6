package eu.optima.listino.model;

/**
 * Outcome of matching one supplier row against the canonical store.
 *
 * @param rowIndex   matched row, or -1 for {@link Kind#NO_MATCH}
 * @param keyField   key field that produced the match, null for no match
 * @param candidates number of canonical rows sharing the key value
 */
public record MatchResult(Kind kind, int rowIndex, String keyField, int candidates) {

    public enum Kind {
        NO_MATCH,
        MATCHED,
        /** Several rows share the key value; the first in store order is used. */
        AMBIGUOUS
    }

    private static final MatchResult NONE = new MatchResult(Kind.NO_MATCH, -1, null, 0);

    public static MatchResult noMatch() {
        return NONE;
    }

    public static MatchResult matched(int rowIndex, String keyField) {
        return new MatchResult(Kind.MATCHED, rowIndex, keyField, 1);
    }

    public static MatchResult ambiguous(int firstRowIndex, String keyField, int candidates) {
        return new MatchResult(Kind.AMBIGUOUS, firstRowIndex, keyField, candidates);
    }

    public boolean found() {
        return kind != Kind.NO_MATCH;
    }

    public boolean isAmbiguous() {
        return kind == Kind.AMBIGUOUS;
    }
}
