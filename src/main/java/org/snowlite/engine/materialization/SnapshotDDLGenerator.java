package org.snowlite.engine.materialization;

import org.snowlite.engine.project.RelationNames;
import org.snowlite.engine.project.Snapshot;
import org.snowlite.engine.project.SnapshotStrategy;
import org.snowlite.engine.sql.ArgumentSplitter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the SCD Type 2 statements of a snapshot.
 *
 * <p>The snapshot table holds the source columns plus {@code dbt_scd_id},
 * {@code dbt_updated_at}, {@code dbt_valid_from} and {@code dbt_valid_to}. The open
 * version of a key has {@code dbt_valid_to IS NULL}.
 *
 * <p>The version timestamp is the source's {@code updated_at} column under the
 * timestamp strategy and the current time under the check strategy.
 */
public final class SnapshotDDLGenerator {

    static final String NOW = "CAST(CURRENT_TIMESTAMP AS TIMESTAMP)";

    private final RelationNames names;

    public SnapshotDDLGenerator() {
        this(RelationNames.DUCKDB);
    }

    public SnapshotDDLGenerator(RelationNames names) {
        this.names = names;
    }

    /**
     * The table does not exist yet: every source row becomes an open version.
     */
    public String firstRun(Snapshot snapshot, String compiledSql) {
        return "CREATE TABLE " + names.of(snapshot) + " AS SELECT " + versionColumns(snapshot)
                + " FROM " + ArgumentSplitter.parenthesize(compiledSql) + " src";
    }

    /**
     * Closes the open versions that changed (and, with hard-delete invalidation,
     * those whose key left the source), then inserts an open version for every key
     * without one.
     *
     * @param checkCols Compared columns for the check strategy, {@code *} already expanded
     */
    public List<String> subsequentRun(Snapshot snapshot, String compiledSql, List<String> checkCols) {
        String target = names.of(snapshot);
        String key = snapshot.uniqueKey();
        List<String> statements = new ArrayList<>();

        statements.add("UPDATE " + target + " SET dbt_valid_to = " + NOW
                + " WHERE dbt_valid_to IS NULL AND " + key + " IN ("
                + "SELECT src." + key + " FROM " + ArgumentSplitter.parenthesize(compiledSql) + " src"
                + " JOIN " + target + " tgt ON src." + key + " = tgt." + key + " AND tgt.dbt_valid_to IS NULL"
                + " WHERE " + changed(snapshot, checkCols) + ")");

        if (snapshot.invalidateHardDeletes()) {
            statements.add("UPDATE " + target + " SET dbt_valid_to = " + NOW
                    + " WHERE dbt_valid_to IS NULL AND " + key + " NOT IN ("
                    + "SELECT src." + key + " FROM " + ArgumentSplitter.parenthesize(compiledSql) + " src WHERE src." + key + " IS NOT NULL)");
        }

        statements.add("INSERT INTO " + target + " SELECT " + versionColumns(snapshot)
                + " FROM " + ArgumentSplitter.parenthesize(compiledSql) + " src"
                + " LEFT JOIN " + target + " tgt ON src." + key + " = tgt." + key + " AND tgt.dbt_valid_to IS NULL"
                + " WHERE tgt." + key + " IS NULL");
        return statements;
    }

    /**
     * The predicate, over {@code src} and {@code tgt}, of an open version that is out of date.
     */
    static String changed(Snapshot snapshot, List<String> checkCols) {
        if (snapshot.strategy() == SnapshotStrategy.TIMESTAMP) {
            return versionTimestamp(snapshot) + " > tgt.dbt_updated_at";
        }
        if (checkCols.isEmpty()) {
            return "FALSE";
        }
        return checkCols.stream()
                .map(c -> "src." + c + " IS DISTINCT FROM tgt." + c)
                .collect(Collectors.joining(" OR ", "(", ")"));
    }

    private static String versionColumns(Snapshot snapshot) {
        String ts = versionTimestamp(snapshot);
        return "src.*, MD5(CAST(src." + snapshot.uniqueKey() + " AS VARCHAR) || '-' || CAST(" + ts + " AS VARCHAR))"
                + " AS dbt_scd_id, "
                + ts + " AS dbt_updated_at, "
                + ts + " AS dbt_valid_from, "
                + "CAST(NULL AS TIMESTAMP) AS dbt_valid_to";
    }

    private static String versionTimestamp(Snapshot snapshot) {
        if (snapshot.strategy() == SnapshotStrategy.TIMESTAMP && snapshot.updatedAt() != null
                && !snapshot.updatedAt().isBlank()) {
            return "CAST(src." + snapshot.updatedAt() + " AS TIMESTAMP)";
        }
        return NOW;
    }
}
