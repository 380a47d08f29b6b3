package org.snowlite.engine.materialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.project.Snapshot;
import org.snowlite.engine.project.SnapshotStrategy;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Snapshot DDL Tests")
class SnapshotDDLGeneratorTest {

    private static final String QUERY = "SELECT * FROM raw_orders";

    private final SnapshotDDLGenerator generator = new SnapshotDDLGenerator();

    private static Snapshot snapshot(SnapshotStrategy strategy, List<String> checkCols, boolean hardDeletes) {
        return new Snapshot("orders_snapshot", "SNOWLITE", "SNAPSHOTS", strategy, "order_id", "updated_at",
                checkCols, QUERY, QUERY, hardDeletes);
    }

    @Test
    @DisplayName("First run opens a version per source row")
    void testFirstRun() {
        String sql = generator.firstRun(snapshot(SnapshotStrategy.TIMESTAMP, List.of(), false), QUERY);

        assertTrue(sql.startsWith("CREATE TABLE snowlite_snapshots.ORDERS_SNAPSHOT AS SELECT src.*, "));
        assertTrue(sql.contains("CAST(src.updated_at AS TIMESTAMP) AS dbt_valid_from"));
        assertTrue(sql.contains("CAST(NULL AS TIMESTAMP) AS dbt_valid_to"));
        assertTrue(sql.contains("AS dbt_scd_id"));
        assertTrue(sql.endsWith("FROM (\n" + QUERY + "\n) src"));
    }

    @Test
    @DisplayName("Timestamp strategy closes versions whose updated_at moved forward")
    void testTimestampSubsequentRun() {
        List<String> statements = generator.subsequentRun(
                snapshot(SnapshotStrategy.TIMESTAMP, List.of(), false), QUERY, List.of());

        assertEquals(2, statements.size());
        assertTrue(statements.get(0).startsWith(
                "UPDATE snowlite_snapshots.ORDERS_SNAPSHOT SET dbt_valid_to = CAST(CURRENT_TIMESTAMP AS TIMESTAMP)"));
        assertTrue(statements.get(0).endsWith("WHERE CAST(src.updated_at AS TIMESTAMP) > tgt.dbt_updated_at)"));
        assertTrue(statements.get(1).startsWith("INSERT INTO snowlite_snapshots.ORDERS_SNAPSHOT SELECT src.*"));
        assertTrue(statements.get(1).endsWith("WHERE tgt.order_id IS NULL"));
    }

    @Test
    @DisplayName("Hard-delete invalidation adds a NOT IN close")
    void testHardDeletes() {
        List<String> statements = generator.subsequentRun(
                snapshot(SnapshotStrategy.TIMESTAMP, List.of(), true), QUERY, List.of());

        assertEquals(3, statements.size());
        assertTrue(statements.get(1).contains("order_id NOT IN (SELECT src.order_id FROM (\n" + QUERY + "\n) src"));
    }

    @Test
    @DisplayName("Check strategy compares columns null-safely")
    void testCheckPredicate() {
        Snapshot check = snapshot(SnapshotStrategy.CHECK, List.of("status", "amount"), false);

        assertEquals("(src.status IS DISTINCT FROM tgt.status OR src.amount IS DISTINCT FROM tgt.amount)",
                SnapshotDDLGenerator.changed(check, check.checkCols()));
        assertEquals("FALSE", SnapshotDDLGenerator.changed(check, List.of()));
    }

    @Test
    @DisplayName("Check strategy versions with the current time")
    void testCheckVersionTimestamp() {
        String sql = generator.firstRun(snapshot(SnapshotStrategy.CHECK, List.of("status"), false), QUERY);

        assertTrue(sql.contains(SnapshotDDLGenerator.NOW + " AS dbt_valid_from"));
        assertFalse(sql.contains("src.updated_at"));
    }
}
