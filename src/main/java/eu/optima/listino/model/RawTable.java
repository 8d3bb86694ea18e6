package eu.optima.listino.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A parsed table as handed over by a file/sheet reader: ordered headers plus
 * rectangular rows of raw cells (string or null).
 */
public record RawTable(List<String> headers, List<List<String>> rows) {

    public RawTable {
        if (headers == null)
            throw new IllegalArgumentException("headers must not be null");
        Set<String> seen = new HashSet<>();
        for (String h : headers) {
            if (h == null)
                throw new IllegalArgumentException("header names must not be null");
            if (!seen.add(h))
                throw new IllegalArgumentException("duplicate header '" + h + "'");
        }
        List<List<String>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (int r = 0; r < rows.size(); r++) {
                List<String> row = rows.get(r);
                if (row == null || row.size() != headers.size()) {
                    throw new IllegalArgumentException(String.format(java.util.Locale.ROOT,
                            "row %d has %d cells, expected %d", r, row == null ? 0 : row.size(), headers.size()));
                }
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        headers = List.copyOf(headers);
        rows = Collections.unmodifiableList(copy);
    }

    public int columnIndex(String header) {
        return headers.indexOf(header);
    }

    public boolean hasColumn(String header) {
        return headers.contains(header);
    }

    public String cell(int row, String header) {
        int c = columnIndex(header);
        if (c < 0)
            throw new IllegalArgumentException("unknown column '" + header + "'");
        return rows.get(row).get(c);
    }

    public int size() {
        return rows.size();
    }
}
