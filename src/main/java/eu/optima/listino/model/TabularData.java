package eu.optima.listino.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Export shape: ordered field names and ordered rows, left to an external writer to serialize. */
public record TabularData(List<String> fields, List<List<Object>> rows) {

    public TabularData {
        fields = List.copyOf(fields);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> r : rows)
            copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
        rows = Collections.unmodifiableList(copy);
    }
}
