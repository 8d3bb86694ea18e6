package eu.optima.listino.tools;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;

import eu.optima.listino.enums.Role;

/**
 * Canonical field names shared by the column mapper and the reconciliation
 * engine, plus mapper hints and per-supplier static dictionaries. Loaded from
 * {@code listino/vocabulary.json}.
 */
public final class FieldVocabulary {

    // Canonical field names (company price list)
    public static final String FIELD_CODE = "codice";
    public static final String FIELD_SUPPLIER_CODE = "codice fornitore";
    public static final String FIELD_DESCRIPTION = "Descrizione articolo";
    public static final String FIELD_LIST_PRICE = "prezzo di listino";
    public static final String FIELD_COST = "costo fornitore";
    public static final String FIELD_EAN = "Codice EAN";
    public static final String FIELD_UNIT = "unità di misura per unità di vendita";
    public static final String FIELD_QTY_PER_UNIT = "L";
    public static final String FIELD_DISCOUNT_1 = "AJ";
    public static final String FIELD_DISCOUNT_2 = "AK";
    public static final String FIELD_DISCOUNT_3 = "AL";

    public static final String DEFAULT_RESOURCE = "/listino/vocabulary.json";

    private static final ObjectMapper M = new ObjectMapper();
    private static volatile FieldVocabulary defaults;

    /** One field the column mapper tries to resolve for a role. */
    public record MappingTarget(String field, List<String> hints, String label) {
    }

    /** JSON document shape. */
    public record Document(List<String> fields, List<String> keyFields,
            Map<String, List<MappingTarget>> roles, Map<String, Map<String, String>> presets) {
    }

    private final List<String> fields;
    private final List<String> keyFields;
    private final Map<Role, List<MappingTarget>> targets;
    private final Map<String, Map<String, String>> presets;

    private FieldVocabulary(Document doc) {
        if (doc.fields() == null || doc.fields().isEmpty())
            throw new IllegalStateException("vocabulary declares no fields");
        if (doc.keyFields() == null || doc.keyFields().isEmpty())
            throw new IllegalStateException("vocabulary declares no key fields");
        this.fields = List.copyOf(new LinkedHashSet<>(doc.fields()));
        this.keyFields = List.copyOf(doc.keyFields());

        this.targets = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            List<MappingTarget> declared = doc.roles() == null ? null : doc.roles().get(role.label);
            if (declared == null)
                throw new IllegalStateException("vocabulary has no mapper targets for role '" + role.label + "'");
            List<MappingTarget> normalized = new ArrayList<>(declared.size());
            for (MappingTarget t : declared) {
                if (t.field() == null || t.field().isBlank())
                    throw new IllegalStateException("mapper target without field for role '" + role.label + "'");
                List<String> hints = new ArrayList<>();
                if (t.hints() != null)
                    for (String h : t.hints())
                        hints.add(ValueNormalizer.normalizeHeader(h));
                normalized.add(new MappingTarget(t.field(), List.copyOf(hints),
                        ValueNormalizer.normalizeHeader(t.label() == null ? t.field() : t.label())));
            }
            targets.put(role, List.copyOf(normalized));
        }

        Map<String, Map<String, String>> p = new LinkedHashMap<>();
        if (doc.presets() != null)
            doc.presets().forEach((name, dict) -> p.put(name.toLowerCase(java.util.Locale.ROOT),
                    Collections.unmodifiableMap(new LinkedHashMap<>(dict))));
        this.presets = Collections.unmodifiableMap(p);
    }

    public static FieldVocabulary defaults() {
        if (defaults == null) {
            synchronized (FieldVocabulary.class) {
                if (defaults == null) {
                    try (InputStream in = FieldVocabulary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                        if (in == null)
                            throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
                        defaults = load(in);
                    } catch (IOException e) {
                        throw new IllegalStateException("cannot read " + DEFAULT_RESOURCE, e);
                    }
                }
            }
        }
        return defaults;
    }

    public static FieldVocabulary load(InputStream in) {
        try {
            return new FieldVocabulary(M.readValue(in, Document.class));
        } catch (IOException e) {
            throw new IllegalStateException("malformed field vocabulary: " + e.getMessage(), e);
        }
    }

    public List<String> fields() {
        return fields;
    }

    public List<String> defaultKeyFields() {
        return keyFields;
    }

    public List<MappingTarget> targets(Role role) {
        return targets.get(role);
    }

    public List<String> targetFields(Role role) {
        return targets.get(role).stream().map(MappingTarget::field).toList();
    }

    public Set<String> presetNames() {
        return presets.keySet();
    }

    /** @return original column -> canonical field, or null if no such preset */
    public Map<String, String> preset(String name) {
        return name == null ? null : presets.get(name.trim().toLowerCase(java.util.Locale.ROOT));
    }
}
