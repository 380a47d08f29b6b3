package org.snowlite.engine.run;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.DataTest;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.ProjectConfig;
import org.snowlite.engine.project.Severity;
import org.snowlite.engine.project.TestKind;
import org.snowlite.engine.project.TestStatus;
import org.snowlite.engine.template.TemplateContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Test Engine Tests")
class TestEngineTest {

    private RecordingBackend backend;
    private CompileContext ctx;
    private TemplateContext tctx;

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
        ProjectConfig config = ProjectConfig.defaults();
        ctx = CompileContext.empty(config)
                .withModel(Model.builder("orders").sql("SELECT 1 AS id").build());
        tctx = TemplateContext.of(config);
    }

    private static DataTest test(String name, String sql, Severity severity) {
        return new DataTest(name, "test.snowlite_project." + name, "orders", "id",
                TestKind.SCHEMA, sql, severity, null, 0);
    }

    // ==================== Classification ====================

    @Test
    @DisplayName("No violating rows passes")
    void testPass() {
        ctx = ctx.withTest(test("not_null_orders_id", "SELECT * FROM {{ ref('orders') }} WHERE id IS NULL",
                Severity.ERROR));

        RunOutcome outcome = new TestEngine(backend).run(ctx, tctx, null);

        RunResult result = outcome.results().get(0);
        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals("PASS", result.message());
        assertEquals(List.of("SELECT * FROM snowlite_public.ORDERS WHERE id IS NULL"), backend.statements);
        assertEquals(TestStatus.PASS, outcome.context().test("not_null_orders_id").orElseThrow().status());
    }

    @Test
    @DisplayName("Violating rows fail an error-severity test")
    void testFail() {
        backend.answer("WHERE id IS NULL", "id", null, null, null);
        ctx = ctx.withTest(test("not_null_orders_id", "SELECT * FROM {{ ref('orders') }} WHERE id IS NULL",
                Severity.ERROR));

        RunOutcome outcome = new TestEngine(backend).run(ctx, tctx, "");

        RunResult result = outcome.results().get(0);
        assertEquals(RunResult.Status.ERROR, result.status());
        assertEquals("FAIL 3", result.message());
        assertEquals(3, result.failures());
        DataTest recorded = outcome.context().test("not_null_orders_id").orElseThrow();
        assertEquals(TestStatus.FAIL, recorded.status());
        assertEquals(3, recorded.failures());
    }

    @Test
    @DisplayName("Violating rows only warn for a warn-severity test")
    void testWarn() {
        backend.answer("amount < 0", "id", 7);
        ctx = ctx.withTest(test("positive_amount", "SELECT id FROM {{ ref('orders') }} WHERE amount < 0",
                Severity.WARN));

        RunOutcome outcome = new TestEngine(backend).run(ctx, tctx, null);

        RunResult result = outcome.results().get(0);
        assertEquals(RunResult.Status.WARN, result.status());
        assertEquals("WARN 1", result.message());
        assertEquals(TestStatus.WARN, outcome.context().test("positive_amount").orElseThrow().status());
        assertFalse(outcome.summary().hasErrors());
    }

    @Test
    @DisplayName("A query the backend rejects is an error, not a failure")
    void testExecutionError() {
        backend.failWhen("missing_column", "Binder Error: Referenced column missing_column not found");
        ctx = ctx.withTest(test("broken", "SELECT missing_column FROM {{ ref('orders') }}", Severity.WARN));

        RunOutcome outcome = new TestEngine(backend).run(ctx, tctx, null);

        RunResult result = outcome.results().get(0);
        assertEquals(RunResult.Status.ERROR, result.status());
        assertTrue(result.message().startsWith("Binder Error"));
        assertEquals(TestStatus.ERROR, outcome.context().test("broken").orElseThrow().status());
    }

    // ==================== Selection ====================

    @Test
    @DisplayName("Only tests whose name contains a selected fragment run")
    void testSelection() {
        ctx = ctx.withTest(test("not_null_orders_id", "SELECT 1 WHERE FALSE", Severity.ERROR))
                .withTest(test("unique_orders_id", "SELECT 2 WHERE FALSE", Severity.ERROR))
                .withTest(test("accepted_values_orders_status", "SELECT 3 WHERE FALSE", Severity.ERROR));

        RunOutcome outcome = new TestEngine(backend).run(ctx, tctx, "unique  accepted");

        assertEquals(List.of("unique_orders_id", "accepted_values_orders_status"),
                outcome.results().stream().map(RunResult::node).toList());
        assertEquals(TestStatus.PENDING, outcome.context().test("not_null_orders_id").orElseThrow().status());
    }
}
