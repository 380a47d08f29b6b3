package org.snowlite.engine.project;

import java.util.List;
import java.util.Objects;

/**
 * A table declared under a source.
 *
 * @param identifier Physical table name when it differs from {@code name}, else null
 * @param freshness  Table-level override of the source's policy, else null
 */
public record SourceTable(
        String name,
        String identifier,
        String description,
        List<ColumnDoc> columns,
        FreshnessPolicy freshness) {

    public SourceTable {
        Objects.requireNonNull(name, "Table name cannot be null");
        description = description == null ? "" : description;
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static SourceTable of(String name) {
        return new SourceTable(name, null, "", List.of(), null);
    }

    public String physicalName() {
        return identifier != null && !identifier.isBlank() ? identifier : name;
    }
}
