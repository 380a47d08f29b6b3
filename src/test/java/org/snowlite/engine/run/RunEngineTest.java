package org.snowlite.engine.run;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.execution.CatalogCollaborator;
import org.snowlite.engine.execution.ExecutionException;
import org.snowlite.engine.materialization.DDLGenerator;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.MaterializationKind;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.ProjectConfig;
import org.snowlite.engine.project.RunStatus;
import org.snowlite.engine.template.TemplateCompiler;
import org.snowlite.engine.template.TemplateContext;
import org.snowlite.engine.transpiler.DialectTranslator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Run engine tests against a recording backend: ordering, materialization
 * statements, failure isolation and skipping.
 */
@DisplayName("Run Engine Tests")
class RunEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private RecordingBackend backend;
    private FakeCatalog catalog;
    private CompileContext ctx;
    private TemplateContext tctx;

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
        catalog = new FakeCatalog();
        ProjectConfig config = ProjectConfig.defaults();
        ctx = CompileContext.empty(config);
        tctx = TemplateContext.of(config, Clock.fixed(NOW, ZoneOffset.UTC), Map.<String, String>of()::get);
    }

    private RunEngine engine(CatalogCollaborator catalog) {
        return new RunEngine(backend, catalog, new TemplateCompiler(), new DialectTranslator(), new DDLGenerator(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void register(String name, String sql) {
        ctx = ctx.withModel(Model.builder(name).sql(sql).build());
    }

    private static List<RunResult.Status> statuses(RunOutcome outcome) {
        return outcome.results().stream().map(RunResult::status).toList();
    }

    // ==================== Ordering and DDL ====================

    @Test
    @DisplayName("Models build in dependency order with their materialization DDL")
    void testBuildOrderAndDdl() {
        register("fct_orders", "{{ config(materialized='table') }} SELECT * FROM {{ ref('stg_orders') }}");
        register("stg_orders", "SELECT 1 AS id");

        RunOutcome outcome = engine(catalog).run(ctx, tctx, RunOptions.defaults());

        assertEquals(List.of(
                "CREATE OR REPLACE VIEW snowlite_public.STG_ORDERS AS SELECT 1 AS id",
                "DROP TABLE IF EXISTS snowlite_public.FCT_ORDERS",
                "CREATE TABLE snowlite_public.FCT_ORDERS AS SELECT * FROM snowlite_public.STG_ORDERS"),
                backend.statements);
        assertEquals(List.of("stg_orders", "fct_orders"), outcome.results().stream().map(RunResult::node).toList());
        assertEquals("Created view stg_orders", outcome.results().get(0).message());
        assertEquals("Created table fct_orders", outcome.results().get(1).message());
        assertEquals(List.of("SNOWLITE.PUBLIC", "SNOWLITE.PUBLIC"), catalog.ensuredSchemas);
    }

    @Test
    @DisplayName("Compiled SQL is translated before it runs")
    void testTranslation() {
        register("flags", "SELECT IFF(amount > 0, 'pos', 'neg') AS sign FROM {{ source('raw', 'payments') }}");

        engine(catalog).run(ctx, tctx, RunOptions.defaults());

        assertEquals("CREATE OR REPLACE VIEW snowlite_public.FLAGS AS "
                + "SELECT CASE WHEN amount > 0 THEN 'pos' ELSE 'neg' END AS sign FROM snowlite_raw.PAYMENTS",
                backend.statements.get(0));
    }

    @Test
    @DisplayName("The run records status and compiled SQL on each model")
    void testModelStateRecorded() {
        register("stg_orders", "SELECT 1 AS id");

        RunOutcome outcome = engine(catalog).run(ctx, tctx, RunOptions.defaults());

        Model model = outcome.context().model("stg_orders").orElseThrow();
        assertEquals(RunStatus.SUCCESS, model.status());
        assertEquals("SELECT 1 AS id", model.compiledSql());
        assertEquals(NOW, model.lastRunAt());
        assertEquals(1, model.rowsAffected());
    }

    // ==================== Incremental ====================

    @Test
    @DisplayName("An existing incremental model deletes and inserts its new rows")
    void testIncrementalRun() {
        register("events", """
                {{ config(materialized='incremental', unique_key='id') }}
                SELECT * FROM src{% if is_incremental() %} WHERE id > (SELECT MAX(id) FROM {{ this }}){% endif %}""");
        catalog.withTable("SNOWLITE", "PUBLIC", "events");

        engine(catalog).run(ctx, tctx, RunOptions.defaults());

        String query = "SELECT * FROM src WHERE id > (SELECT MAX(id) FROM snowlite_public.EVENTS)";
        assertEquals(List.of(
                "DELETE FROM snowlite_public.EVENTS WHERE id IN (SELECT id FROM (\n" + query + "\n) src)",
                "INSERT INTO snowlite_public.EVENTS " + query), backend.statements);
    }

    @Test
    @DisplayName("Full refresh rebuilds an incremental model without the incremental filter")
    void testIncrementalFullRefresh() {
        register("events", """
                {{ config(materialized='incremental', unique_key='id') }}
                SELECT * FROM src{% if is_incremental() %} WHERE id > (SELECT MAX(id) FROM {{ this }}){% endif %}""");
        catalog.withTable("SNOWLITE", "PUBLIC", "events");

        engine(catalog).run(ctx, tctx, RunOptions.defaults().withFullRefresh(true));

        assertEquals(List.of(
                "DROP TABLE IF EXISTS snowlite_public.EVENTS",
                "CREATE TABLE snowlite_public.EVENTS AS SELECT * FROM src"), backend.statements);
    }

    // ==================== Ephemeral and selection ====================

    @Test
    @DisplayName("Ephemeral models succeed without statements and are inlined downstream")
    void testEphemeral() {
        register("base", "{{ config(materialized='ephemeral') }} SELECT 1 AS id");
        register("report", "SELECT id FROM {{ ref('base') }}");

        RunOutcome outcome = engine(catalog).run(ctx, tctx, RunOptions.defaults());

        assertEquals(List.of(RunResult.Status.SUCCESS, RunResult.Status.SUCCESS), statuses(outcome));
        assertEquals("Ephemeral model base is inlined into its dependents", outcome.results().get(0).message());
        assertEquals(List.of("CREATE OR REPLACE VIEW snowlite_public.REPORT AS SELECT id FROM (\nSELECT 1 AS id\n)"),
                backend.statements);
    }

    @Test
    @DisplayName("Selection and exclusion limit what is built")
    void testSelection() {
        register("a", "SELECT 1 AS id");
        register("b", "SELECT * FROM {{ ref('a') }}");
        register("c", "SELECT * FROM {{ ref('b') }}");
        register("other", "SELECT 2 AS id");

        RunOutcome outcome = engine(catalog).run(ctx, tctx, RunOptions.select("+c").withExclude("a"));

        assertEquals(List.of("b", "c"), outcome.results().stream().map(RunResult::node).toList());
        assertEquals(2, backend.statements.size());
    }

    // ==================== Failures ====================

    @Test
    @DisplayName("A failing model is recorded and the run continues")
    void testFailureIsolation() {
        backend.failWhen("BROKEN", "Catalog Error: Table with name BROKEN does not exist!");
        register("bad", "SELECT * FROM BROKEN");
        register("good", "SELECT 1 AS id");
        register("child", "SELECT * FROM {{ ref('bad') }}");

        RunOutcome outcome = engine(catalog).run(ctx, tctx, RunOptions.defaults());

        assertEquals(List.of(RunResult.Status.ERROR, RunResult.Status.SUCCESS, RunResult.Status.SUCCESS),
                statuses(outcome));
        RunResult bad = outcome.results().get(0);
        assertEquals("model.bad", bad.uniqueId());
        assertTrue(bad.message().contains("BROKEN does not exist"));

        Model recorded = outcome.context().model("bad").orElseThrow();
        assertEquals(RunStatus.ERROR, recorded.status());
        assertEquals(bad.message(), recorded.error());
        assertTrue(outcome.summary().hasErrors());
    }

    @Test
    @DisplayName("Dependents of a failed model can be skipped transitively")
    void testSkipDependents() {
        backend.failWhen("BROKEN", "boom");
        register("bad", "SELECT * FROM BROKEN");
        register("child", "SELECT * FROM {{ ref('bad') }}");
        register("grandchild", "SELECT * FROM {{ ref('child') }}");
        register("good", "SELECT 1 AS id");

        RunOutcome outcome = engine(catalog).run(ctx, tctx, RunOptions.defaults().withSkipDependentsOfFailed(true));

        assertEquals(List.of("bad", "good", "child", "grandchild"),
                outcome.results().stream().map(RunResult::node).toList());
        assertEquals(List.of(RunResult.Status.ERROR, RunResult.Status.SUCCESS,
                RunResult.Status.SKIPPED, RunResult.Status.SKIPPED), statuses(outcome));
        assertEquals("Done. PASS=1 WARN=0 ERROR=1 SKIP=2 TOTAL=4", outcome.summary().toString());
    }

    @Test
    @DisplayName("A catalog failure fails only that model")
    void testCatalogFailure() {
        CatalogCollaborator broken = new CatalogCollaborator() {
            @Override
            public boolean tableExists(String database, String schema, String table) {
                if (table.equals("flaky")) {
                    throw new ExecutionException("catalog unavailable", null);
                }
                return false;
            }

            @Override
            public void ensureSchemaExists(String database, String schema) {
            }
        };
        register("flaky", "SELECT 1 AS id");
        register("steady", "SELECT 2 AS id");

        RunOutcome outcome = engine(broken).run(ctx, tctx, RunOptions.defaults());

        assertEquals(List.of(RunResult.Status.ERROR, RunResult.Status.SUCCESS), statuses(outcome));
        assertEquals("catalog unavailable", outcome.results().get(0).message());
    }
}
