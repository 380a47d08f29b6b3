package org.snowlite.engine.project;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An external data source: a set of tables loaded outside the project.
 */
public record Source(
        String name,
        String database,
        String schema,
        List<SourceTable> tables,
        String description,
        String loader,
        FreshnessPolicy freshness,
        Map<String, Object> meta) {

    public Source {
        Objects.requireNonNull(name, "Source name cannot be null");
        Objects.requireNonNull(database, "Source database cannot be null");
        Objects.requireNonNull(schema, "Source schema cannot be null");
        tables = tables == null ? List.of() : List.copyOf(tables);
        description = description == null ? "" : description;
        loader = loader == null ? "" : loader;
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static Source of(String name, String database, String schema, List<SourceTable> tables) {
        return new Source(name, database, schema, tables, "", "", null, Map.of());
    }

    /**
     * Finds a declared table, ignoring case.
     */
    public Optional<SourceTable> table(String tableName) {
        return tables.stream()
                .filter(t -> t.name().equalsIgnoreCase(tableName))
                .findFirst();
    }

    /**
     * @return The table's own freshness policy, else the source's, else null
     */
    public FreshnessPolicy freshnessFor(SourceTable table) {
        return table.freshness() != null ? table.freshness() : freshness;
    }
}
