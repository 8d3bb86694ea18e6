package eu.optima.listino.tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import eu.optima.listino.model.ColumnMapping;

/** Stores each mapping as {@code <dir>/<supplier>/mapping.json} (field -> column). */
public class JsonFileMappingStore implements MappingStore {

    private static final ObjectMapper M = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._ -]");
    private static final String FILE_NAME = "mapping.json";

    private final Path baseDir;

    public JsonFileMappingStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    /** Directory from LISTINO_MAPPINGS_DIR, or ./mappings. */
    public static JsonFileMappingStore fromEnv() {
        String dir = System.getenv("LISTINO_MAPPINGS_DIR");
        return new JsonFileMappingStore(Paths.get(dir == null || dir.isBlank() ? "mappings" : dir));
    }

    @Override
    public Optional<ColumnMapping> load(String supplierKey) {
        Path file = fileFor(supplierKey);
        if (!Files.isRegularFile(file))
            return Optional.empty();
        try {
            LinkedHashMap<String, String> byField = M.readValue(file.toFile(),
                    new TypeReference<LinkedHashMap<String, String>>() {
                    });
            return Optional.of(ColumnMapping.confirmed(byField));
        } catch (IOException e) {
            System.err.printf(Locale.ROOT, "Ignoring unreadable mapping %s: %s%n", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(String supplierKey, ColumnMapping mapping) {
        Path file = fileFor(supplierKey);
        try {
            Files.createDirectories(file.getParent());
            M.writeValue(file.toFile(), mapping.asMap());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save mapping for '" + supplierKey + "'", e);
        }
    }

    Path fileFor(String supplierKey) {
        return baseDir.resolve(safeName(supplierKey)).resolve(FILE_NAME);
    }

    static String safeName(String supplierKey) {
        if (supplierKey == null || supplierKey.isBlank())
            throw new IllegalArgumentException("supplier key is required");
        String s = UNSAFE.matcher(supplierKey.trim()).replaceAll("_");
        if (s.chars().allMatch(c -> c == '.'))
            throw new IllegalArgumentException("invalid supplier key '" + supplierKey + "'");
        return s;
    }
}
