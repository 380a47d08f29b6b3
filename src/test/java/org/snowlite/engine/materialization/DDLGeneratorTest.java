package org.snowlite.engine.materialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.project.MaterializationKind;
import org.snowlite.engine.project.Model;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Materialization DDL Tests")
class DDLGeneratorTest {

    private static final String QUERY = "SELECT id, amount FROM snowlite_public.STG_ORDERS";

    private final DDLGenerator generator = new DDLGenerator();

    private static Model model(MaterializationKind kind) {
        return Model.builder("fct_orders").materialization(kind).build();
    }

    @Test
    @DisplayName("Views are created or replaced")
    void testView() {
        assertEquals(List.of("CREATE OR REPLACE VIEW snowlite_public.FCT_ORDERS AS " + QUERY),
                generator.generate(model(MaterializationKind.VIEW), QUERY, false, false));
    }

    @Test
    @DisplayName("Tables are dropped then created")
    void testTable() {
        List<String> ddl = generator.generate(model(MaterializationKind.TABLE), QUERY, false, true);

        assertEquals(List.of(
                "DROP TABLE IF EXISTS snowlite_public.FCT_ORDERS",
                "CREATE TABLE snowlite_public.FCT_ORDERS AS " + QUERY), ddl);
    }

    @Test
    @DisplayName("Incremental models build as tables the first time and on full refresh")
    void testIncrementalRebuild() {
        Model model = model(MaterializationKind.INCREMENTAL);

        assertInstanceOf(MaterializationStrategy.Table.class, generator.strategyFor(model, false, false));
        assertInstanceOf(MaterializationStrategy.Table.class, generator.strategyFor(model, true, true));
        assertEquals(generator.generate(model(MaterializationKind.TABLE), QUERY, false, true),
                generator.generate(model, QUERY, true, true));
    }

    @Test
    @DisplayName("Incremental without a unique key appends")
    void testIncrementalAppend() {
        assertEquals(List.of("INSERT INTO snowlite_public.FCT_ORDERS " + QUERY),
                generator.generate(model(MaterializationKind.INCREMENTAL), QUERY, false, true));
    }

    @Test
    @DisplayName("Incremental with a unique key deletes matching keys before inserting")
    void testIncrementalMerge() {
        Model model = model(MaterializationKind.INCREMENTAL).toBuilder().putMeta("unique_key", "id").build();

        List<String> statements = generator.strategyFor(model, false, true)
                .statements("snowlite_public.FCT_ORDERS", QUERY);

        assertEquals(List.of(
                "DELETE FROM snowlite_public.FCT_ORDERS WHERE id IN (SELECT id FROM (\n" + QUERY + "\n) src)",
                "INSERT INTO snowlite_public.FCT_ORDERS " + QUERY), statements);
    }

    @Test
    @DisplayName("A composite unique key becomes a row value")
    void testCompositeKey() {
        Model model = model(MaterializationKind.INCREMENTAL).toBuilder()
                .putMeta("unique_key", List.of("id", "day"))
                .build();

        MaterializationStrategy strategy = generator.strategyFor(model, false, true);

        assertEquals(new MaterializationStrategy.Incremental(List.of("id", "day")), strategy);
        assertEquals("DELETE FROM snowlite_public.FCT_ORDERS AS tgt WHERE EXISTS (SELECT 1 FROM (\n" + QUERY
                        + "\n) src WHERE tgt.id = src.id AND tgt.day = src.day)",
                strategy.statements("snowlite_public.FCT_ORDERS", QUERY).get(0));
    }

    @Test
    @DisplayName("A comma-separated unique key is split into columns")
    void testCommaSeparatedKey() {
        Model model = model(MaterializationKind.INCREMENTAL).toBuilder().putMeta("unique_key", "id, day").build();

        assertEquals(new MaterializationStrategy.Incremental(List.of("id", "day")),
                generator.strategyFor(model, false, true));
    }

    @Test
    @DisplayName("A trailing line comment in the query stays inside its subquery")
    void testTrailingLineComment() {
        String query = QUERY + " -- latest rows";
        Model model = model(MaterializationKind.INCREMENTAL).toBuilder().putMeta("unique_key", "id").build();

        List<String> statements = generator.generate(model, query, false, true);

        assertEquals(2, statements.size());
        assertTrue(statements.get(0).endsWith("-- latest rows\n) src)"));
        assertTrue(statements.get(1).startsWith("INSERT INTO snowlite_public.FCT_ORDERS "));
    }

    @Test
    @DisplayName("Ephemeral models render nothing and never execute")
    void testEphemeral() {
        MaterializationStrategy strategy = generator.strategyFor(model(MaterializationKind.EPHEMERAL), false, false);

        assertFalse(strategy.executes());
        assertEquals(List.of(), generator.generate(model(MaterializationKind.EPHEMERAL), QUERY, false, false));
    }

    @Test
    @DisplayName("Alias and schema shape the target name")
    void testTargetName() {
        Model model = Model.builder("fct_orders").schema("MARTS").alias("orders").build();

        assertTrue(generator.generate(model, QUERY, false, false).get(0)
                .startsWith("CREATE OR REPLACE VIEW snowlite_marts.ORDERS AS"));
    }
}
