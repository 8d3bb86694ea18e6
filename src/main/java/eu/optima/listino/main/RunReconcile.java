package eu.optima.listino.main;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import eu.optima.listino.dao.JpaMappingStore;
import eu.optima.listino.enums.Role;
import eu.optima.listino.model.ColumnMapping;
import eu.optima.listino.model.OfferRecord;
import eu.optima.listino.model.RawTable;
import eu.optima.listino.tools.CanonicalStore;
import eu.optima.listino.tools.ColumnMapper;
import eu.optima.listino.tools.FieldVocabulary;
import eu.optima.listino.tools.JsonFileMappingStore;
import eu.optima.listino.tools.MappingStore;
import eu.optima.listino.tools.MissingFieldException;
import eu.optima.listino.tools.OfferGenerator;
import eu.optima.listino.tools.ReconciliationEngine;
import eu.optima.listino.tools.ReconciliationReport;
import eu.optima.listino.tools.SupplierTableShaper;
import eu.optima.listino.tools.TableJson;

/**
 * Reconciles a base price list with supplier lists (JSON tables), one supplier
 * after the other, then optionally writes the updated list and the offers.
 */
public class RunReconcile {

    public record Result(CanonicalStore store, List<OfferRecord> offers, ReconciliationReport report) {
    }

    public static void main(String[] args) {
        try {
            run(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: RunReconcile --base=<table.json> --suppliers=<a.json,b.json> [--preset=<name>]"
                    + " [--mapping-store=file|db] [--mappings=<dir>] [--keys=a|b] [--input-fields=a|b]"
                    + " [--accept-suggestions=true]"
                    + " [--out=<file>] [--offers=<file>] [--discount=0.10] [--price-field=<field>]");
            System.exit(2);
        }
    }

    public static Result run(String[] args) {
        String base = arg(args, "--base=", null);
        if (base == null || base.isBlank())
            throw new IllegalArgumentException("--base is required");
        List<String> suppliers = split(arg(args, "--suppliers=", ""), ",");
        String preset = arg(args, "--preset=", null);
        String mappingsDir = arg(args, "--mappings=", null);
        String mappingStore = arg(args, "--mapping-store=", "file");
        String out = arg(args, "--out=", null);
        String offersOut = arg(args, "--offers=", null);
        String priceField = arg(args, "--price-field=", FieldVocabulary.FIELD_LIST_PRICE);
        boolean acceptSuggestions = Boolean.parseBoolean(arg(args, "--accept-suggestions=", "false"));
        BigDecimal discount;
        try {
            discount = new BigDecimal(arg(args, "--discount=", "0.10").trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--discount must be a decimal number");
        }

        FieldVocabulary vocabulary = FieldVocabulary.defaults();
        List<String> keys = split(arg(args, "--keys=", ""), "|");
        if (keys.isEmpty())
            keys = vocabulary.defaultKeyFields();
        List<String> inputList = split(arg(args, "--input-fields=", ""), "|");
        Set<String> inputFields = inputList.isEmpty() ? null : new LinkedHashSet<>(inputList);

        Map<String, String> presetDictionary = null;
        if (preset != null) {
            presetDictionary = vocabulary.preset(preset);
            if (presetDictionary == null)
                throw new IllegalArgumentException("unknown preset '" + preset + "', known: " + vocabulary.presetNames());
        }

        MappingStore mappings = switch (mappingStore.trim().toLowerCase(Locale.ROOT)) {
            case "file" -> mappingsDir == null ? JsonFileMappingStore.fromEnv()
                    : new JsonFileMappingStore(Paths.get(mappingsDir));
            case "db" -> new JpaMappingStore();
            default -> throw new IllegalArgumentException("--mapping-store must be 'file' or 'db', got '"
                    + mappingStore + "'");
        };
        var mapper = new ColumnMapper();
        var shaper = new SupplierTableShaper(vocabulary);
        var engine = new ReconciliationEngine();
        var report = new ReconciliationReport();

        CanonicalStore store = CanonicalStore.fromTable(TableJson.read(Paths.get(base)));
        System.out.printf(Locale.ROOT, ">>> RunReconcile base=%s rows=%d suppliers=%d keys=%s%n",
                base, store.size(), suppliers.size(), keys);

        // one supplier at a time: the store has a single writer
        for (String supplierPath : suppliers) {
            Path path = Paths.get(supplierPath);
            String supplierKey = supplierKey(path);
            RawTable table = TableJson.read(path);

            ColumnMapping mapping;
            if (presetDictionary != null) {
                mapping = SupplierTableShaper.fromStatic(presetDictionary, table.headers());
                report.recordUnmapped(supplierKey, mapper.unresolvedFields(mapping, Role.SUPPLIER));
            } else {
                mapping = savedMapping(mappings, supplierKey, table).orElse(null);
                if (mapping == null) {
                    ColumnMapping suggestion = mapper.suggestMapping(table.headers(), Role.SUPPLIER);
                    List<String> unresolved = mapper.unresolvedFields(suggestion, Role.SUPPLIER);
                    if (!acceptSuggestions) {
                        System.out.printf(Locale.ROOT,
                                "Supplier %s: mapping needs confirmation, suggested %s, unresolved %s -> skipped%n",
                                supplierKey, suggestion.asMap(), unresolved);
                        report.recordSkippedSupplier(supplierKey, unresolved);
                        continue;
                    }
                    mapping = suggestion.confirm();
                    mappings.save(supplierKey, mapping);
                    report.recordUnmapped(supplierKey, unresolved);
                }
            }

            var rows = shaper.shape(table, mapping, SupplierTableShaper.Mode.STRICT);
            var outcomes = engine.apply(rows, keys, inputFields, store, report);
            long changed = outcomes.stream().filter(o -> o.changed()).count();
            System.out.printf(Locale.ROOT, "Supplier %s: %d rows, %d changed (%s mapping)%n",
                    supplierKey, rows.size(), changed, mapping.origin());
        }

        report.printSummary();
        System.out.printf(Locale.ROOT, "Price list rows: %d%n", store.size());

        if (out != null) {
            TableJson.write(Paths.get(out), store.toTabular());
            System.out.println("Updated price list written to " + out);
        }

        List<OfferRecord> offers = List.of();
        try {
            offers = new OfferGenerator().generate(store, priceField, discount);
            if (offersOut != null) {
                TableJson.write(Paths.get(offersOut), OfferGenerator.toTabular(offers, priceField));
                System.out.println("Offers written to " + offersOut);
            }
        } catch (MissingFieldException e) {
            System.err.println("Offers not generated: " + e.getMessage());
        }
        return new Result(store, offers, report);
    }

    private static Optional<ColumnMapping> savedMapping(MappingStore mappings, String supplierKey, RawTable table) {
        Optional<ColumnMapping> saved = mappings.load(supplierKey);
        if (saved.isPresent()) {
            List<String> missing = saved.get().missingColumns(table.headers());
            if (!missing.isEmpty()) {
                System.err.printf(Locale.ROOT, "Saved mapping for %s refers to missing columns %s; ignoring it%n",
                        supplierKey, missing);
                return Optional.empty();
            }
            System.out.println("Using saved mapping for " + supplierKey);
        }
        return saved;
    }

    static String supplierKey(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static List<String> split(String raw, String sep) {
        if (raw == null || raw.isBlank())
            return List.of();
        return Arrays.stream(raw.split(java.util.regex.Pattern.quote(sep)))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String arg(String[] args, String key, String def) {
        for (String a : args)
            if (a.startsWith(key))
                return a.substring(key.length());
        return def;
    }
}
