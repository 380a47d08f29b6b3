package org.snowlite.engine.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.execution.CatalogCollaborator;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.execution.StatementResult;
import org.snowlite.engine.materialization.SnapshotDDLGenerator;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.Snapshot;
import org.snowlite.engine.project.SnapshotStrategy;
import org.snowlite.engine.sql.ArgumentSplitter;
import org.snowlite.engine.template.TemplateCompiler;
import org.snowlite.engine.template.TemplateContext;
import org.snowlite.engine.transpiler.DialectTranslator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs snapshots: creates the history table on the first run, then closes changed
 * versions and inserts new ones on every later run.
 */
public class SnapshotEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotEngine.class);

    private final CatalogCollaborator catalog;
    private final TemplateCompiler compiler;
    private final DialectTranslator translator;
    private final SnapshotDDLGenerator ddlGenerator;
    private final StatementRunner runner;

    public SnapshotEngine(ExecutionBackend backend, CatalogCollaborator catalog) {
        this(backend, catalog, new TemplateCompiler(), new DialectTranslator(), new SnapshotDDLGenerator());
    }

    public SnapshotEngine(ExecutionBackend backend, CatalogCollaborator catalog, TemplateCompiler compiler,
                          DialectTranslator translator, SnapshotDDLGenerator ddlGenerator) {
        this.catalog = catalog;
        this.compiler = compiler;
        this.translator = translator;
        this.ddlGenerator = ddlGenerator;
        this.runner = new StatementRunner(backend);
    }

    /**
     * @param select Snapshot names to run; null or empty runs all of them
     */
    public RunOutcome run(CompileContext context, TemplateContext templateContext, Collection<String> select) {
        CompileContext ctx = context;
        List<RunResult> results = new ArrayList<>();
        for (Snapshot snapshot : context.snapshots().values()) {
            if (select != null && !select.isEmpty() && !select.contains(snapshot.name())) {
                continue;
            }
            long start = System.nanoTime();
            Snapshot compiled = snapshot;
            RunResult result;
            try {
                String sql = translator.translate(compiler.compile(snapshot.sql(), ctx, templateContext));
                compiled = snapshot.withCompiledSql(sql);
                result = runSnapshot(compiled, uniqueId(ctx, snapshot), start);
            } catch (RuntimeException e) {
                result = RunResult.error(uniqueId(ctx, snapshot), snapshot.name(), e.getMessage(), elapsed(start));
            }
            if (!result.isSuccess()) {
                LOG.error("Snapshot {} failed: {}", snapshot.name(), result.message());
            }
            ctx = ctx.withSnapshot(compiled);
            results.add(result);
        }
        return new RunOutcome(ctx, results);
    }

    private RunResult runSnapshot(Snapshot snapshot, String uniqueId, long start) {
        catalog.ensureSchemaExists(snapshot.database(), snapshot.schema());
        String sql = snapshot.compiledSql();

        if (!catalog.tableExists(snapshot.database(), snapshot.schema(), snapshot.name())) {
            StatementRunner.Outcome outcome = runner.run(List.of(ddlGenerator.firstRun(snapshot, sql)));
            return outcome.success()
                    ? RunResult.success(uniqueId, snapshot.name(), "Created snapshot " + snapshot.name(), elapsed(start))
                    : RunResult.error(uniqueId, snapshot.name(), outcome.error(), elapsed(start));
        }

        List<String> checkCols = snapshot.explicitCheckCols();
        if (snapshot.strategy() == SnapshotStrategy.CHECK && checkCols.isEmpty()) {
            StatementResult columns = runner.query("SELECT * FROM " + ArgumentSplitter.parenthesize(sql) + " src LIMIT 0");
            if (!columns.success()) {
                return RunResult.error(uniqueId, snapshot.name(), columns.error(), elapsed(start));
            }
            checkCols = columns.columns().stream()
                    .filter(c -> !c.equalsIgnoreCase(snapshot.uniqueKey()))
                    .toList();
        }

        StatementRunner.Outcome outcome = runner.run(ddlGenerator.subsequentRun(snapshot, sql, checkCols));
        return outcome.success()
                ? RunResult.success(uniqueId, snapshot.name(), "Updated snapshot " + snapshot.name(), elapsed(start))
                : RunResult.error(uniqueId, snapshot.name(), outcome.error(), elapsed(start));
    }

    private static String uniqueId(CompileContext ctx, Snapshot snapshot) {
        return "snapshot." + ctx.config().projectName() + "." + snapshot.name();
    }

    static double elapsed(long start) {
        return (System.nanoTime() - start) / 1_000_000.0;
    }
}
