package eu.optima.listino.tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import eu.optima.listino.model.RawTable;
import eu.optima.listino.model.TabularData;

/**
 * JSON form of a table: {@code {"headers": [...], "rows": [[...], ...]}}.
 * Cells are read as text whatever their JSON type; JSON null stays null.
 */
public class TableJson {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static RawTable parse(String json) {
        try {
            return toTable(OBJECT_MAPPER.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse table JSON", e);
        }
    }

    public static RawTable read(Path file) {
        try {
            return toTable(OBJECT_MAPPER.readTree(file.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read table " + file, e);
        }
    }

    public static String toJson(TabularData data) {
        try {
            return OBJECT_MAPPER.writeValueAsString(document(data));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(Path file, TabularData data) {
        try {
            if (file.getParent() != null)
                Files.createDirectories(file.getParent());
            OBJECT_MAPPER.writeValue(file.toFile(), document(data));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write table " + file, e);
        }
    }

    private static Map<String, Object> document(TabularData data) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("headers", data.fields());
        doc.put("rows", data.rows());
        return doc;
    }

    private static RawTable toTable(JsonNode root) {
        if (root == null || !root.isObject() || !root.path("headers").isArray())
            throw new IllegalArgumentException("table JSON needs a 'headers' array");
        List<String> headers = new ArrayList<>();
        for (JsonNode h : root.get("headers"))
            headers.add(h.asText().trim());

        List<List<String>> rows = new ArrayList<>();
        JsonNode rowsNode = root.path("rows");
        if (!rowsNode.isMissingNode() && !rowsNode.isArray())
            throw new IllegalArgumentException("table JSON 'rows' must be an array");
        for (JsonNode r : rowsNode) {
            if (!r.isArray())
                throw new IllegalArgumentException("every table row must be an array");
            List<String> row = new ArrayList<>(headers.size());
            for (JsonNode cell : r)
                row.add(cell.isNull() ? null : cell.asText());
            rows.add(row);
        }
        return new RawTable(headers, rows);
    }
}
