package org.snowlite.engine.run;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed CSV content of a seed: a header and string cells. Empty cells load as NULL.
 */
public record SeedData(List<String> header, List<List<String>> rows) {

    public SeedData {
        header = header == null ? List.of() : List.copyOf(header);
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = List.copyOf(copy);
    }

    public boolean isEmpty() {
        return header.isEmpty() || rows.isEmpty();
    }

    /**
     * @return The cell, or an empty string past the end of a short row
     */
    public String cell(int row, int column) {
        List<String> values = rows.get(row);
        if (column >= values.size() || values.get(column) == null) {
            return "";
        }
        return values.get(column);
    }
}
