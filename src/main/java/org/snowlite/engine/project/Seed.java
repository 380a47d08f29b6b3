package org.snowlite.engine.project;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A CSV file loaded verbatim into a table.
 *
 * @param columns    Column types inferred by the last load
 * @param rowsLoaded Rows inserted by the last load
 * @param loadedAt   When the last load finished, else null
 */
public record Seed(
        String name,
        String database,
        String schema,
        String filePath,
        List<SeedColumn> columns,
        long rowsLoaded,
        Instant loadedAt) {

    public Seed {
        Objects.requireNonNull(name, "Seed name cannot be null");
        Objects.requireNonNull(database, "Seed database cannot be null");
        Objects.requireNonNull(schema, "Seed schema cannot be null");
        filePath = filePath == null ? "" : filePath;
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static Seed of(String name, String database, String schema, String filePath) {
        return new Seed(name, database, schema, filePath, List.of(), 0, null);
    }

    public Seed withLoad(List<SeedColumn> inferred, long rows, Instant at) {
        return new Seed(name, database, schema, filePath, inferred, rows, at);
    }
}
