package org.snowlite.engine.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.execution.CatalogCollaborator;
import org.snowlite.engine.execution.ConnectionResolver;
import org.snowlite.engine.execution.ExecutionBackend;
import org.snowlite.engine.execution.JdbcCatalog;
import org.snowlite.engine.execution.JdbcExecutionBackend;
import org.snowlite.engine.graph.DependencyGraph;
import org.snowlite.engine.graph.Lineage;
import org.snowlite.engine.materialization.DDLGenerator;
import org.snowlite.engine.materialization.GenericTestGenerator;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.DataTest;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.ProjectConfig;
import org.snowlite.engine.project.RelationNames;
import org.snowlite.engine.project.Seed;
import org.snowlite.engine.project.Snapshot;
import org.snowlite.engine.project.Source;
import org.snowlite.engine.run.FreshnessChecker;
import org.snowlite.engine.run.FreshnessResult;
import org.snowlite.engine.run.RunEngine;
import org.snowlite.engine.run.RunOptions;
import org.snowlite.engine.run.RunOutcome;
import org.snowlite.engine.run.RunResult;
import org.snowlite.engine.run.SeedData;
import org.snowlite.engine.run.SeedLoader;
import org.snowlite.engine.run.SnapshotEngine;
import org.snowlite.engine.run.TestEngine;
import org.snowlite.engine.template.SnapshotBlockParser;
import org.snowlite.engine.template.TemplateCompiler;
import org.snowlite.engine.template.TemplateContext;
import org.snowlite.engine.transpiler.DialectTranslator;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Entry point for a project: registration, compile preview, runs, tests,
 * snapshots, seeds, freshness, lineage and docs.
 *
 * <p>The registry is an immutable {@link CompileContext} swapped atomically on every
 * registration. Invocations (run, test, snapshot, seed) are serialized; each one
 * works on the context as it was when it started and copies its run state back
 * onto the nodes that are still registered unchanged when it ends.
 */
public class ProjectService {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectService.class);

    private final AtomicReference<CompileContext> context;
    private final Map<String, SeedData> seedData = new ConcurrentHashMap<>();
    private final AtomicReference<List<RunResult>> lastResults = new AtomicReference<>(List.of());

    private final TemplateCompiler compiler = new TemplateCompiler();
    private final DialectTranslator translator = new DialectTranslator();
    private final RunEngine runEngine;
    private final SnapshotEngine snapshotEngine;
    private final TestEngine testEngine;
    private final SeedLoader seedLoader;
    private final FreshnessChecker freshnessChecker;
    private final ManifestGenerator manifestGenerator = new ManifestGenerator();
    private final CatalogCollaborator catalog;
    private final Clock clock;
    private final Function<String, String> environment;

    public ProjectService(ProjectConfig config, ExecutionBackend backend, CatalogCollaborator catalog) {
        this(config, backend, catalog, Clock.systemUTC(), System::getenv);
    }

    public ProjectService(ProjectConfig config, ExecutionBackend backend, CatalogCollaborator catalog,
                          Clock clock, Function<String, String> environment) {
        this.context = new AtomicReference<>(CompileContext.empty(config));
        this.catalog = catalog;
        this.clock = clock;
        this.environment = environment;
        this.runEngine = new RunEngine(backend, catalog, compiler, translator,
                new DDLGenerator(), clock);
        this.snapshotEngine = new SnapshotEngine(backend, catalog);
        this.testEngine = new TestEngine(backend, compiler, translator);
        this.seedLoader = new SeedLoader(backend, catalog, RelationNames.DUCKDB, clock);
        this.freshnessChecker = new FreshnessChecker(backend, RelationNames.DUCKDB, clock);
    }

    /**
     * Opens a service over the JDBC URL in {@code config}.
     */
    public static ProjectService open(ProjectConfig config) {
        Connection connection = new ConnectionResolver().resolve(config.jdbcUrl());
        return new ProjectService(config, new JdbcExecutionBackend(connection), new JdbcCatalog(connection));
    }

    public CompileContext context() {
        return context.get();
    }

    public ProjectConfig config() {
        return context.get().config();
    }

    public void configure(ProjectConfig config) {
        context.updateAndGet(ctx -> ctx.withConfig(config));
    }

    // ==================== Registration ====================

    /**
     * Registers a model, applying its {@code config()} blocks, deriving
     * {@code depends_on} and registering the tests declared on its columns.
     */
    public Model registerModel(Model model) {
        Model configured = compiler.configure(withProjectId(model));
        List<DataTest> tests = GenericTestGenerator.generate(configured);
        context.updateAndGet(ctx -> {
            CompileContext next = ctx.withModel(configured);
            for (DataTest test : tests) {
                next = next.withTest(test);
            }
            return next;
        });
        LOG.debug("Registered model {} depending on {}", configured.name(), configured.dependsOn());
        return configured;
    }

    public Model registerModel(String name, String sql) {
        ProjectConfig config = config();
        return registerModel(Model.builder(name).database(config.database()).schema(config.schema()).sql(sql).build());
    }

    public boolean removeModel(String name) {
        boolean present = context.get().model(name).isPresent();
        context.updateAndGet(ctx -> ctx.withoutModel(name));
        return present;
    }

    public void registerSource(Source source) {
        context.updateAndGet(ctx -> ctx.withSource(source));
    }

    public void registerSeed(Seed seed, SeedData data) {
        if (data == null) {
            seedData.remove(seed.name());
        } else {
            seedData.put(seed.name(), data);
        }
        context.updateAndGet(ctx -> ctx.withSeed(seed));
    }

    public void registerTest(DataTest test) {
        context.updateAndGet(ctx -> ctx.withTest(test));
    }

    public DataTest registerSingularTest(String name, String sql) {
        DataTest test = DataTest.singular(config().projectName(), name, sql);
        registerTest(test);
        return test;
    }

    public void registerSnapshot(Snapshot snapshot) {
        context.updateAndGet(ctx -> ctx.withSnapshot(snapshot));
    }

    /**
     * Registers every {@code {% snapshot %}} block in {@code text}.
     */
    public List<Snapshot> registerSnapshots(String text) {
        List<Snapshot> snapshots = SnapshotBlockParser.parse(text, config());
        snapshots.forEach(this::registerSnapshot);
        return snapshots;
    }

    // ==================== Compile ====================

    /**
     * Compiles and translates SQL without executing it.
     */
    public String compileSql(String rawSql) {
        CompileContext ctx = context.get();
        return translator.translate(compiler.compile(rawSql, ctx, templateContext(ctx)));
    }

    /**
     * Compiles a registered model as the next run would, without executing it.
     * {@code is_incremental()} holds only when the model's table already exists and
     * the project is not set to full refresh.
     */
    public Optional<String> compileModel(String name) {
        CompileContext ctx = context.get();
        return ctx.model(name).map(model -> {
            boolean incremental = !ctx.config().fullRefresh()
                    && catalog.tableExists(model.database(), model.schema(), model.relationName());
            TemplateContext tctx = templateContext(ctx).withIncrementalRun(incremental);
            return translator.translate(compiler.prepare(model, ctx, tctx).compiledSql());
        });
    }

    // ==================== Invocations ====================

    public synchronized List<RunResult> run(RunOptions options) {
        return run(options, Map.of());
    }

    public synchronized List<RunResult> run(RunOptions options, Map<String, Object> vars) {
        CompileContext ctx = context.get();
        RunOptions effective = ctx.config().fullRefresh() ? options.withFullRefresh(true) : options;
        RunOutcome outcome = runEngine.run(ctx, templateContext(ctx).withVars(vars), effective);
        context.updateAndGet(current -> mergeModels(current, outcome.context()));
        return remember(outcome.results());
    }

    public synchronized List<RunResult> test(String select) {
        CompileContext ctx = context.get();
        RunOutcome outcome = testEngine.run(ctx, templateContext(ctx), select);
        context.updateAndGet(current -> {
            CompileContext next = current;
            for (DataTest ran : outcome.context().tests().values()) {
                Optional<DataTest> registered = current.test(ran.name()).filter(t -> t.sql().equals(ran.sql()));
                if (registered.isPresent()) {
                    next = next.withTest(registered.get().withOutcome(ran.status(), ran.failures()));
                }
            }
            return next;
        });
        return remember(outcome.results());
    }

    public synchronized List<RunResult> snapshot(Collection<String> select) {
        CompileContext ctx = context.get();
        RunOutcome outcome = snapshotEngine.run(ctx, templateContext(ctx), select);
        context.updateAndGet(current -> {
            CompileContext next = current;
            for (Snapshot ran : outcome.context().snapshots().values()) {
                Optional<Snapshot> registered = current.snapshot(ran.name()).filter(s -> s.sql().equals(ran.sql()));
                if (registered.isPresent()) {
                    next = next.withSnapshot(registered.get().withCompiledSql(ran.compiledSql()));
                }
            }
            return next;
        });
        return remember(outcome.results());
    }

    /**
     * @param select Seed names to load; null or empty loads all of them
     */
    public synchronized List<RunResult> seed(Collection<String> select, boolean fullRefresh) {
        CompileContext ctx = context.get();
        boolean refresh = fullRefresh || ctx.config().fullRefresh();
        List<RunResult> results = new ArrayList<>();
        for (Seed seed : ctx.seeds().values()) {
            if (select != null && !select.isEmpty() && !select.contains(seed.name())) {
                continue;
            }
            String uniqueId = "seed." + ctx.config().projectName() + "." + seed.name();
            SeedLoader.Loaded loaded = seedLoader.load(seed, uniqueId, seedData.get(seed.name()), refresh);
            Seed result = loaded.seed();
            context.updateAndGet(current -> current.seed(seed.name()).filter(seed::equals).isPresent()
                    ? current.withSeed(seed.withLoad(result.columns(), result.rowsLoaded(), result.loadedAt()))
                    : current);
            results.add(loaded.result());
        }
        return remember(results);
    }

    public List<FreshnessResult> freshness(Collection<String> sources) {
        return freshnessChecker.check(context.get(), sources);
    }

    // ==================== Introspection ====================

    public Optional<Lineage> lineage(String model) {
        CompileContext ctx = context.get();
        if (ctx.model(model).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(DependencyGraph.of(ctx.models()).lineage(model));
    }

    public Map<String, Object> docs() {
        return manifestGenerator.generate(context.get(), Instant.now(clock));
    }

    public String docsJson() {
        return ManifestJson.toJson(docs());
    }

    public List<RunResult> lastResults() {
        return lastResults.get();
    }

    // ==================== Helpers ====================

    private TemplateContext templateContext(CompileContext ctx) {
        return TemplateContext.of(ctx.config(), clock, environment);
    }

    private Model withProjectId(Model model) {
        if (!model.uniqueId().equals("model." + model.name())) {
            return model;
        }
        return model.toBuilder().uniqueId("model." + config().projectName() + "." + model.name()).build();
    }

    /**
     * Copies run state onto the registered models. A model removed or re-registered
     * with different SQL while the run was in flight keeps its registration.
     */
    private static CompileContext mergeModels(CompileContext current, CompileContext ran) {
        CompileContext next = current;
        for (Model built : ran.models().values()) {
            Optional<Model> registered = current.model(built.name()).filter(m -> m.sql().equals(built.sql()));
            if (registered.isPresent()) {
                next = next.withModel(registered.get().toBuilder()
                        .compiledSql(built.compiledSql())
                        .status(built.status())
                        .error(built.error())
                        .lastRunAt(built.lastRunAt())
                        .executionTimeMs(built.executionTimeMs())
                        .rowsAffected(built.rowsAffected())
                        .build());
            }
        }
        return next;
    }

    private List<RunResult> remember(List<RunResult> results) {
        lastResults.set(List.copyOf(results));
        return results;
    }
}
