package eu.optima.listino.tools;

import java.util.List;

import eu.optima.listino.model.MatchResult;
import eu.optima.listino.model.SupplierRecord;

/**
 * Resolves a supplier row to at most one canonical row, trying key fields in
 * priority order. A key the supplier leaves blank is skipped: empty never
 * matches empty. When several rows share the key value the first one in store
 * order is taken and the result is marked ambiguous.
 */
public class RecordMatcher {

    public MatchResult match(SupplierRecord supplierRow, List<String> keys, CanonicalStore store) {
        if (keys == null || keys.isEmpty())
            throw new IllegalArgumentException("at least one key field is required");
        for (String key : keys) {
            String value = supplierRow.get(key);
            if (ValueNormalizer.isBlank(value))
                continue;
            List<Integer> hits = store.find(key, value);
            if (hits.size() == 1)
                return MatchResult.matched(hits.get(0), key);
            if (hits.size() > 1)
                return MatchResult.ambiguous(hits.get(0), key, hits.size());
        }
        return MatchResult.noMatch();
    }
}
