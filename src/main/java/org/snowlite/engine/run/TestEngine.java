package org.snowlite.engine.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.execution.StatementResult;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.DataTest;
import org.snowlite.engine.project.Severity;
import org.snowlite.engine.project.TestStatus;
import org.snowlite.engine.template.TemplateCompiler;
import org.snowlite.engine.template.TemplateContext;
import org.snowlite.engine.transpiler.DialectTranslator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs data tests. A test's query selects the violating rows: none means pass;
 * otherwise the test fails, or only warns when its severity is {@code warn}.
 */
public class TestEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TestEngine.class);

    private final TemplateCompiler compiler;
    private final DialectTranslator translator;
    private final StatementRunner runner;

    public TestEngine(ExecutionBackend backend) {
        this(backend, new TemplateCompiler(), new DialectTranslator());
    }

    public TestEngine(ExecutionBackend backend, TemplateCompiler compiler, DialectTranslator translator) {
        this.compiler = compiler;
        this.translator = translator;
        this.runner = new StatementRunner(backend);
    }

    /**
     * @param select Whitespace-separated fragments; a test runs when its name contains
     *               any of them. Blank runs every test.
     */
    public RunOutcome run(CompileContext context, TemplateContext templateContext, String select) {
        CompileContext ctx = context;
        List<RunResult> results = new ArrayList<>();
        for (DataTest test : context.tests().values()) {
            if (!selected(test, select)) {
                continue;
            }
            TestOutcome outcome = execute(test, ctx, templateContext);
            ctx = ctx.withTest(outcome.test());
            results.add(outcome.result());
        }
        LOG.info("Ran {} tests: {}", results.size(), RunSummary.of(results));
        return new RunOutcome(ctx, results);
    }

    public TestOutcome execute(DataTest test, CompileContext ctx, TemplateContext templateContext) {
        long start = System.nanoTime();
        StatementResult result;
        try {
            String sql = translator.translate(compiler.compile(test.sql(), ctx, templateContext));
            result = runner.query(sql);
        } catch (RuntimeException e) {
            result = StatementResult.failure(e.getMessage());
        }
        double elapsed = SnapshotEngine.elapsed(start);

        if (!result.success()) {
            LOG.error("Test {} failed to execute: {}", test.name(), result.error());
            return new TestOutcome(test.withOutcome(TestStatus.ERROR, 0),
                    new RunResult(test.uniqueId(), test.name(), RunResult.Status.ERROR, result.error(), elapsed, 0));
        }

        long failures = result.rowCount();
        if (failures == 0) {
            return new TestOutcome(test.withOutcome(TestStatus.PASS, 0),
                    new RunResult(test.uniqueId(), test.name(), RunResult.Status.SUCCESS, "PASS", elapsed, 0));
        }
        if (test.severity() == Severity.WARN) {
            return new TestOutcome(test.withOutcome(TestStatus.WARN, failures),
                    new RunResult(test.uniqueId(), test.name(), RunResult.Status.WARN,
                            "WARN " + failures, elapsed, failures));
        }
        return new TestOutcome(test.withOutcome(TestStatus.FAIL, failures),
                new RunResult(test.uniqueId(), test.name(), RunResult.Status.ERROR,
                        "FAIL " + failures, elapsed, failures));
    }

    private static boolean selected(DataTest test, String select) {
        if (select == null || select.isBlank()) {
            return true;
        }
        return Arrays.stream(select.trim().split("\\s+")).anyMatch(test.name()::contains);
    }
}
