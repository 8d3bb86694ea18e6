package eu.optima.listino.tools;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import me.xdrop.fuzzywuzzy.FuzzySearch;

import eu.optima.listino.enums.Role;
import eu.optima.listino.model.ColumnMapping;

/**
 * Suggests which original column holds each canonical field.
 * <p>
 * Two passes over the role's targets, in priority order: a vocabulary pass
 * (header tokens against the field's hint set), then a similarity pass against
 * the field's fallback label for whatever is still unresolved. A column is
 * assigned to at most one field; a column whose tokens hit several fields goes
 * first to the field with the most hits on it. The result is advisory.
 */
public class ColumnMapper {

    public static final int DEFAULT_THRESHOLD = 72;

    private final FieldVocabulary vocabulary;
    private final int threshold;

    public ColumnMapper() {
        this(FieldVocabulary.defaults(), Integer.getInteger("listino.mapper.threshold", DEFAULT_THRESHOLD));
    }

    public ColumnMapper(FieldVocabulary vocabulary, int threshold) {
        if (threshold < 0 || threshold > 100)
            throw new IllegalArgumentException("threshold must be within 0..100, got " + threshold);
        this.vocabulary = vocabulary;
        this.threshold = threshold;
    }

    public int threshold() {
        return threshold;
    }

    public ColumnMapping suggestMapping(List<String> columns, Role role) {
        // header -> normalized form, header order preserved
        Map<String, String> normalized = new LinkedHashMap<>();
        for (String c : columns) {
            if (c == null)
                continue;
            String n = ValueNormalizer.normalizeHeader(c);
            if (!n.isEmpty())
                normalized.putIfAbsent(c, n);
        }

        Map<String, String> byField = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        List<FieldVocabulary.MappingTarget> targets = vocabulary.targets(role);

        // header -> target with the most hint hits on it, earlier target on ties
        Map<String, String> owner = new LinkedHashMap<>();
        for (var e : normalized.entrySet()) {
            int best = 0;
            for (var t : targets) {
                int hits = hits(e.getValue(), t.hints());
                if (hits > best) {
                    best = hits;
                    owner.put(e.getKey(), t.field());
                }
            }
        }

        for (var t : targets) {
            Map<String, String> owned = new LinkedHashMap<>();
            normalized.forEach((h, n) -> {
                if (t.field().equals(owner.get(h)))
                    owned.put(h, n);
            });
            String hit = guessByVocabulary(owned, claimed, t.hints());
            if (hit != null) {
                byField.put(t.field(), hit);
                claimed.add(hit);
            }
        }
        for (var t : targets) {
            if (byField.containsKey(t.field()))
                continue;
            String hit = guessByVocabulary(normalized, claimed, t.hints());
            if (hit != null) {
                byField.put(t.field(), hit);
                claimed.add(hit);
            }
        }

        for (var t : targets) {
            if (byField.containsKey(t.field()))
                continue;
            String best = bestGuess(normalized, claimed, t.label());
            if (best != null) {
                byField.put(t.field(), best);
                claimed.add(best);
            }
        }

        // report in target order, not resolution order
        Map<String, String> ordered = new LinkedHashMap<>();
        for (var t : targets)
            if (byField.containsKey(t.field()))
                ordered.put(t.field(), byField.get(t.field()));
        return ColumnMapping.suggested(ordered);
    }

    /** Target fields of the role the mapping leaves unresolved. */
    public List<String> unresolvedFields(ColumnMapping mapping, Role role) {
        return mapping.unresolved(vocabulary.targetFields(role));
    }

    /**
     * Similarity of a header to a label, 0..100, on the normalized forms.
     * Weighted ratio: plain, partial and token-based ratios, the best one wins.
     */
    public static int score(String label, String header) {
        String l = ValueNormalizer.normalizeHeader(label);
        String h = ValueNormalizer.normalizeHeader(header);
        if (l.isEmpty() || h.isEmpty())
            return 0;
        return FuzzySearch.weightedRatio(l, h);
    }

    private static int hits(String normalizedHeader, List<String> hints) {
        if (hints.isEmpty())
            return 0;
        Set<String> vocab = new HashSet<>(hints);
        int hits = 0;
        for (String tok : new HashSet<>(Arrays.asList(normalizedHeader.split(" "))))
            if (vocab.contains(tok))
                hits++;
        return hits;
    }

    // most distinct hint tokens wins, then the larger share of hinted tokens, then header order
    private static String guessByVocabulary(Map<String, String> normalized, Set<String> claimed, List<String> hints) {
        String best = null;
        int bestHits = 0;
        double bestShare = 0.0;
        for (var e : normalized.entrySet()) {
            if (claimed.contains(e.getKey()))
                continue;
            int hits = hits(e.getValue(), hints);
            if (hits == 0)
                continue;
            double share = hits / (double) new HashSet<>(Arrays.asList(e.getValue().split(" "))).size();
            if (hits > bestHits || (hits == bestHits && share > bestShare)) {
                best = e.getKey();
                bestHits = hits;
                bestShare = share;
            }
        }
        return best;
    }

    private String bestGuess(Map<String, String> normalized, Set<String> claimed, String label) {
        String best = null;
        int bestScore = -1;
        for (String header : normalized.keySet()) {
            if (claimed.contains(header))
                continue;
            int s = score(label, header);
            if (s > bestScore) {
                best = header;
                bestScore = s;
            }
        }
        return (best != null && bestScore >= threshold) ? best : null;
    }
}
