package org.snowlite.engine.project;

import java.util.List;
import java.util.Objects;

/**
 * A Type-2 slowly changing dimension over a source query.
 *
 * @param uniqueKey             Column identifying a row across versions
 * @param updatedAt             Change-tracking column (timestamp strategy)
 * @param checkCols             Compared columns (check strategy); {@code *} compares nothing
 * @param invalidateHardDeletes Close open versions whose key left the source
 */
public record Snapshot(
        String name,
        String database,
        String schema,
        SnapshotStrategy strategy,
        String uniqueKey,
        String updatedAt,
        List<String> checkCols,
        String sql,
        String compiledSql,
        boolean invalidateHardDeletes) {

    public Snapshot {
        Objects.requireNonNull(name, "Snapshot name cannot be null");
        Objects.requireNonNull(database, "Snapshot database cannot be null");
        Objects.requireNonNull(schema, "Snapshot schema cannot be null");
        strategy = strategy == null ? SnapshotStrategy.TIMESTAMP : strategy;
        uniqueKey = uniqueKey == null || uniqueKey.isBlank() ? "id" : uniqueKey;
        checkCols = checkCols == null ? List.of() : List.copyOf(checkCols);
        sql = sql == null ? "" : sql;
        compiledSql = compiledSql == null ? "" : compiledSql;
    }

    public Snapshot withCompiledSql(String compiled) {
        return new Snapshot(name, database, schema, strategy, uniqueKey, updatedAt, checkCols, sql,
                compiled, invalidateHardDeletes);
    }

    /**
     * Compare columns with {@code *} and blanks removed.
     */
    public List<String> explicitCheckCols() {
        return checkCols.stream()
                .map(String::trim)
                .filter(c -> !c.isEmpty() && !c.equals("*"))
                .toList();
    }
}
