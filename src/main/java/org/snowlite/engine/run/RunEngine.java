package org.snowlite.engine.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.execution.CatalogCollaborator;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.graph.DependencyGraph;
import org.snowlite.engine.graph.NodeSelector;
import org.snowlite.engine.graph.ScheduleResult;
import org.snowlite.engine.graph.TopologicalScheduler;
import org.snowlite.engine.materialization.DDLGenerator;
import org.snowlite.engine.materialization.MaterializationStrategy;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.RunStatus;
import org.snowlite.engine.template.TemplateCompiler;
import org.snowlite.engine.template.TemplateContext;
import org.snowlite.engine.transpiler.DialectTranslator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the selected models in dependency order.
 *
 * <p>Per model: recompile from raw SQL with the current variables and target,
 * translate to the engine dialect, pick a materialization, then execute its
 * statements one by one. A failing statement ends that model but never the run;
 * every scheduled model gets exactly one {@link RunResult}. Effects of models that
 * succeeded are kept when a later one fails.
 */
public class RunEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RunEngine.class);

    private final CatalogCollaborator catalog;
    private final TemplateCompiler compiler;
    private final DialectTranslator translator;
    private final DDLGenerator ddlGenerator;
    private final StatementRunner runner;
    private final Clock clock;

    public RunEngine(ExecutionBackend backend, CatalogCollaborator catalog) {
        this(backend, catalog, new TemplateCompiler(), new DialectTranslator(), new DDLGenerator(), Clock.systemUTC());
    }

    public RunEngine(ExecutionBackend backend, CatalogCollaborator catalog, TemplateCompiler compiler,
                     DialectTranslator translator, DDLGenerator ddlGenerator, Clock clock) {
        this.catalog = catalog;
        this.compiler = compiler;
        this.translator = translator;
        this.ddlGenerator = ddlGenerator;
        this.runner = new StatementRunner(backend);
        this.clock = clock;
    }

    public RunOutcome run(CompileContext context, TemplateContext templateContext, RunOptions options) {
        CompileContext ctx = refreshConfig(context);
        DependencyGraph graph = DependencyGraph.of(ctx.models());
        Set<String> selected = new NodeSelector(graph).select(options.select(), options.exclude());
        ScheduleResult schedule = new TopologicalScheduler(graph).schedule(selected);

        LOG.info("Running {} of {} models", schedule.order().size(), graph.nodes().size());

        List<RunResult> results = new ArrayList<>();
        Set<String> failed = new HashSet<>();
        for (String name : schedule.order()) {
            Model model = ctx.models().get(name);
            if (options.skipDependentsOfFailed() && dependsOnFailed(graph, name, failed)) {
                failed.add(name);
                results.add(RunResult.skipped(model.uniqueId(), name, "Skipped: an upstream model failed"));
                continue;
            }
            BuildResult build = build(model, ctx, templateContext, options.fullRefresh());
            ctx = ctx.withModel(build.model());
            results.add(build.result());
            if (!build.result().isSuccess()) {
                failed.add(name);
            }
        }

        RunSummary summary = RunSummary.of(results);
        LOG.info("Finished running {} models: {} succeeded, {} failed, {} skipped",
                summary.total(), summary.success(), summary.error(), summary.skipped());
        return new RunOutcome(ctx, results);
    }

    private record BuildResult(Model model, RunResult result) {}

    private BuildResult build(Model model, CompileContext ctx, TemplateContext templateContext, boolean fullRefresh) {
        long start = System.nanoTime();
        Model current = model;
        try {
            boolean exists = catalog.tableExists(model.database(), model.schema(), model.relationName());
            TemplateContext tctx = templateContext.withIncrementalRun(exists && !fullRefresh);
            current = compiler.prepare(model, ctx, tctx);
            String translated = translator.translate(current.compiledSql());

            MaterializationStrategy strategy = ddlGenerator.strategyFor(current, fullRefresh, exists);
            if (!strategy.executes()) {
                Model done = finish(current, RunStatus.SUCCESS, null, start, 0);
                return new BuildResult(done, RunResult.success(done.uniqueId(), done.name(),
                        "Ephemeral model " + done.name() + " is inlined into its dependents", done.executionTimeMs()));
            }

            catalog.ensureSchemaExists(current.database(), current.schema());
            List<String> ddl = ddlGenerator.generate(current, translated, fullRefresh, exists);
            StatementRunner.Outcome outcome = runner.run(ddl);
            if (!outcome.success()) {
                return failure(current, outcome.error(), start);
            }
            Model done = finish(current, RunStatus.SUCCESS, null, start, outcome.rowsAffected());
            return new BuildResult(done, RunResult.success(done.uniqueId(), done.name(),
                    "Created " + done.materialization().value() + " " + done.name(), done.executionTimeMs()));
        } catch (RuntimeException e) {
            return failure(current, e.getMessage(), start);
        }
    }

    private BuildResult failure(Model model, String error, long start) {
        LOG.error("Model {} failed: {}", model.name(), error);
        Model done = finish(model, RunStatus.ERROR, error, start, 0);
        return new BuildResult(done, RunResult.error(done.uniqueId(), done.name(), error, done.executionTimeMs()));
    }

    private Model finish(Model model, RunStatus status, String error, long start, long rows) {
        return model.toBuilder()
                .status(status)
                .error(error)
                .lastRunAt(Instant.now(clock))
                .executionTimeMs((System.nanoTime() - start) / 1_000_000.0)
                .rowsAffected(rows)
                .build();
    }

    /**
     * Applies every model's {@code config()} and re-derives its {@code depends_on},
     * so selection, ordering and refs see the current configuration even for models
     * outside the selection.
     */
    private CompileContext refreshConfig(CompileContext context) {
        CompileContext ctx = context;
        for (Model model : context.models().values()) {
            ctx = ctx.withModel(compiler.configure(model));
        }
        return ctx;
    }

    private static boolean dependsOnFailed(DependencyGraph graph, String name, Set<String> failed) {
        return graph.dependenciesOf(name).stream().anyMatch(failed::contains);
    }
}
