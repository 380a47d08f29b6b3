package org.snowlite.engine.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.MaterializationKind;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.RelationNames;
import org.snowlite.engine.project.Source;
import org.snowlite.engine.project.SourceTable;
import org.snowlite.engine.sql.ArgumentSplitter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles dbt-style template SQL into plain warehouse SQL.
 *
 * <p>Directives are resolved in a fixed order, each step rewriting only text
 * inside {@code {{ }}} or {@code {% %}} delimiters:
 * <ol>
 *   <li>{@code config(...)} blocks are stripped and applied to the current model</li>
 *   <li>{@code this}</li>
 *   <li>{@code ref(name)} and {@code ref(project, name)}</li>
 *   <li>{@code source(source, table)}</li>
 *   <li>{@code var(name[, default])}</li>
 *   <li>{@code target.<field>}</li>
 *   <li>{@code env_var(name[, default])}</li>
 *   <li>{@code if / elif / else / endif} blocks</li>
 *   <li>built-in macros: {@code star}, {@code adapter.dispatch}, {@code run_started_at},
 *       {@code invocation_id}, {@code log}, {@code return}, {@code is_incremental()}</li>
 *   <li>whatever is left in {@code {{ }}}, {@code {% %}} or {@code {# #}} is removed</li>
 * </ol>
 *
 * <p>Compilation never fails. A malformed or unresolvable directive degrades to a
 * best-guess identifier or an inline {@code /* ... *}{@code /} diagnostic.
 */
public final class TemplateCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateCompiler.class);

    private static final Pattern THIS = expression("this");
    private static final Pattern REF = call("ref");
    private static final Pattern SOURCE = call("source");
    private static final Pattern VAR = call("var");
    private static final Pattern ENV_VAR = call("env_var");
    private static final Pattern TARGET = Pattern.compile("\\{\\{-?\\s*target\\.(\\w+)\\s*-?}}");

    private static final Pattern STAR = Pattern.compile("\\{\\{-?\\s*(?:\\w+\\.)?star\\s*\\(.*?\\)\\s*-?}}", Pattern.DOTALL);
    private static final Pattern DISPATCH = Pattern.compile(
            "\\{\\{-?\\s*adapter\\.dispatch\\s*\\(.*?\\)\\s*(?:\\(.*?\\))?\\s*-?}}", Pattern.DOTALL);
    private static final Pattern RUN_STARTED_AT = expression("run_started_at");
    private static final Pattern INVOCATION_ID = expression("invocation_id");
    private static final Pattern LOG_CALL = Pattern.compile("\\{\\{-?\\s*log\\s*\\(.*?\\)\\s*-?}}", Pattern.DOTALL);
    private static final Pattern RETURN = Pattern.compile("\\{\\{-?\\s*return\\s*\\((.*?)\\)\\s*-?}}", Pattern.DOTALL);
    private static final Pattern IS_INCREMENTAL = Pattern.compile(
            "\\{\\{-?\\s*is_incremental\\s*\\(\\s*\\)\\s*-?}}", Pattern.CASE_INSENSITIVE);

    private static final Pattern BLOCK_TAG = Pattern.compile(
            "\\{%-?\\s*(if|elif|else|endif)\\b(.*?)-?%}", Pattern.DOTALL);

    private static final Pattern LEFTOVER_EXPRESSION = Pattern.compile("\\{\\{.*?}}", Pattern.DOTALL);
    private static final Pattern COMMENT = Pattern.compile("\\{#.*?#}", Pattern.DOTALL);
    private static final Pattern STATEMENT_TAG = Pattern.compile("\\{%.*?%}", Pattern.DOTALL);

    private final RelationNames names;

    public TemplateCompiler() {
        this(RelationNames.DUCKDB);
    }

    public TemplateCompiler(RelationNames names) {
        this.names = names;
    }

    /**
     * Compiles SQL that belongs to no model, as in a compile preview or a test.
     */
    public String compile(String sql, CompileContext ctx, TemplateContext tctx) {
        return compile(sql, null, ctx, tctx).sql();
    }

    /**
     * Compiles a model's raw SQL, returning the model with its compiled SQL and
     * its refreshed {@code depends_on}.
     */
    public Model prepare(Model model, CompileContext ctx, TemplateContext tctx) {
        CompiledSql compiled = compile(model.sql(), model, ctx, tctx);
        return compiled.model().toBuilder()
                .compiledSql(compiled.sql())
                .dependsOn(extractRefs(model.sql()))
                .build();
    }

    /**
     * Applies the model's {@code config()} blocks and re-derives {@code depends_on}
     * without compiling anything else.
     */
    public Model configure(Model model) {
        Map<String, Object> config = ConfigBlockParser.extract(model.sql()).config();
        Model configured = config.isEmpty() ? model : applyConfig(model, config);
        return configured.toBuilder().dependsOn(extractRefs(model.sql())).build();
    }

    public CompiledSql compile(String sql, Model currentModel, CompileContext ctx, TemplateContext tctx) {
        return compile(sql, currentModel, ctx, tctx, new ArrayDeque<>());
    }

    private CompiledSql compile(String sql, Model currentModel, CompileContext ctx, TemplateContext tctx,
                                Deque<String> inlining) {
        String compiled = sql == null ? "" : sql;

        ConfigBlockParser.Extraction extraction = ConfigBlockParser.extract(compiled);
        compiled = extraction.sql();
        Model model = currentModel;
        if (model != null && !extraction.config().isEmpty()) {
            model = applyConfig(model, extraction.config());
        }

        if (model != null) {
            String self = names.of(model);
            compiled = replace(THIS, compiled, m -> self);
        }

        compiled = resolveRefs(compiled, ctx, tctx, inlining);
        compiled = resolveSources(compiled, ctx);
        compiled = replace(VAR, compiled, m -> resolveVar(m.group(1), tctx.vars()));
        compiled = replace(TARGET, compiled, m -> tctx.target().field(m.group(1)));
        compiled = replace(ENV_VAR, compiled, m -> resolveEnvVar(m.group(1), tctx.environment()));

        boolean incremental = isIncremental(model, tctx);
        ConditionEvaluator evaluator = new ConditionEvaluator(tctx.vars(), tctx.target(), tctx.environment(), incremental);
        compiled = renderBlocks(compiled, evaluator);

        compiled = expandBuiltins(compiled, tctx, incremental);
        compiled = stripLeftovers(compiled);

        return new CompiledSql(compiled.strip(), model, extraction.config());
    }

    /**
     * Model names referenced through {@code ref()}, in first-seen order. For
     * {@code ref(project, name)} the last argument is the model name.
     */
    public static List<String> extractRefs(String sql) {
        Set<String> refs = new LinkedHashSet<>();
        if (sql == null) {
            return List.of();
        }
        Matcher m = REF.matcher(sql);
        while (m.find()) {
            List<String> args = ArgumentSplitter.split(m.group(1));
            if (!args.isEmpty() && !args.get(args.size() - 1).isEmpty()) {
                refs.add(ArgumentSplitter.unquote(args.get(args.size() - 1)));
            }
        }
        return new ArrayList<>(refs);
    }

    // ==================== config() ====================

    private Model applyConfig(Model model, Map<String, Object> config) {
        Model.Builder builder = model.toBuilder();
        Object materialized = config.get("materialized");
        if (materialized != null) {
            Optional<MaterializationKind> kind = MaterializationKind.fromValue(String.valueOf(materialized));
            if (kind.isPresent()) {
                builder.materialization(kind.get());
            } else {
                LOG.warn("Unknown materialization '{}' on model {}, keeping {}",
                        materialized, model.name(), model.materialization().value());
            }
        }
        if (config.get("schema") != null) {
            builder.schema(String.valueOf(config.get("schema")).toUpperCase(Locale.ROOT));
        }
        if (config.get("alias") != null) {
            builder.alias(String.valueOf(config.get("alias")));
        }
        Object tags = config.get("tags");
        if (tags instanceof Collection<?> list) {
            builder.tags(list.stream().map(String::valueOf).toList());
        } else if (tags != null) {
            builder.tags(List.of(String.valueOf(tags)));
        }
        config.forEach(builder::putMeta);
        return builder.build();
    }

    // ==================== ref() / source() ====================

    private String resolveRefs(String sql, CompileContext ctx, TemplateContext tctx, Deque<String> inlining) {
        return replace(REF, sql, m -> {
            try {
                return resolveRef(m.group(1), ctx, tctx, inlining);
            } catch (CompileException e) {
                LOG.warn(e.getMessage());
                return "/* " + e.getMessage() + " */";
            }
        });
    }

    private String resolveRef(String argsText, CompileContext ctx, TemplateContext tctx, Deque<String> inlining) {
        List<String> args = ArgumentSplitter.split(argsText);
        if (args.isEmpty() || args.size() > 2 || args.get(args.size() - 1).isEmpty()) {
            throw new CompileException("Invalid ref()", argsText);
        }
        String modelName = ArgumentSplitter.unquote(args.get(args.size() - 1));
        Optional<Model> target = ctx.model(modelName);
        if (target.isEmpty()) {
            if (ctx.seed(modelName).isPresent()) {
                return names.of(ctx.seed(modelName).get());
            }
            if (ctx.snapshot(modelName).isPresent()) {
                return names.of(ctx.snapshot(modelName).get());
            }
            return names.of(ctx.config().database(), ctx.config().schema(), modelName.toUpperCase(Locale.ROOT));
        }
        Model model = target.get();
        if (model.materialization() != MaterializationKind.EPHEMERAL) {
            return names.of(model);
        }
        if (inlining.contains(model.name())) {
            LOG.warn("Ephemeral model {} references itself through {}, not inlining", model.name(), inlining);
            return names.of(model);
        }
        inlining.push(model.name());
        try {
            return ArgumentSplitter.parenthesize(compile(model.sql(), model, ctx, tctx, inlining).sql());
        } finally {
            inlining.pop();
        }
    }

    private String resolveSources(String sql, CompileContext ctx) {
        return replace(SOURCE, sql, m -> {
            List<String> args = ArgumentSplitter.split(m.group(1));
            if (args.size() != 2) {
                return m.group();
            }
            String sourceName = ArgumentSplitter.unquote(args.get(0));
            String tableName = ArgumentSplitter.unquote(args.get(1));
            Optional<Source> source = ctx.source(sourceName);
            if (source.isEmpty()) {
                return names.of(ctx.config().database(), "RAW", tableName);
            }
            String physical = source.get().table(tableName)
                    .map(SourceTable::physicalName)
                    .orElse(tableName);
            return names.of(source.get().database(), source.get().schema(), physical);
        });
    }

    // ==================== var() / env_var() ====================

    private static String resolveVar(String argsText, Map<String, Object> vars) {
        List<String> args = ArgumentSplitter.split(argsText);
        String name = args.isEmpty() ? "" : ArgumentSplitter.unquote(args.get(0));
        Object value = vars.get(name);
        if (value == null && args.size() > 1) {
            value = ConfigBlockParser.parseValue(args.get(1));
        }
        if (value == null) {
            LOG.warn("Variable '{}' not found and no default provided", name);
            return "NULL /* missing var: " + name + " */";
        }
        return literal(value);
    }

    private static String literal(Object value) {
        if (value instanceof Collection<?> list) {
            return list.stream().map(TemplateCompiler::literal).collect(Collectors.joining(", "));
        }
        if (value instanceof String s && !s.matches("\\d+")) {
            return "'" + s.replace("'", "''") + "'";
        }
        return String.valueOf(value);
    }

    private static String resolveEnvVar(String argsText, Function<String, String> environment) {
        List<String> args = ArgumentSplitter.split(argsText);
        String name = args.isEmpty() ? "" : ArgumentSplitter.unquote(args.get(0));
        String value = environment.apply(name);
        if (value == null && args.size() > 1) {
            value = ArgumentSplitter.unquote(args.get(1));
        }
        if (value == null) {
            return "NULL /* missing env_var: " + name + " */";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    // ==================== if / elif / else ====================

    private record Branch(String condition, int bodyStart, int bodyEnd) {}

    /**
     * Renders the first complete if-block in {@code text} and recurses into the
     * chosen branch and the remainder. An if without a matching endif is left for
     * the final strip.
     */
    private static String renderBlocks(String text, ConditionEvaluator evaluator) {
        Matcher m = BLOCK_TAG.matcher(text);
        int ifStart = -1;
        String condition = null;
        int bodyStart = -1;
        int depth = 0;
        List<Branch> branches = new ArrayList<>();
        while (m.find()) {
            String tag = m.group(1);
            if (ifStart < 0) {
                if (tag.equals("if")) {
                    ifStart = m.start();
                    condition = m.group(2).trim();
                    bodyStart = m.end();
                }
                continue;
            }
            if (tag.equals("if")) {
                depth++;
            } else if (tag.equals("endif") && depth > 0) {
                depth--;
            } else if (depth == 0) {
                branches.add(new Branch(condition, bodyStart, m.start()));
                if (tag.equals("endif")) {
                    String chosen = choose(text, branches, evaluator);
                    return text.substring(0, ifStart)
                            + renderBlocks(chosen, evaluator)
                            + renderBlocks(text.substring(m.end()), evaluator);
                }
                condition = tag.equals("else") ? null : m.group(2).trim();
                bodyStart = m.end();
            }
        }
        return text;
    }

    private static String choose(String text, List<Branch> branches, ConditionEvaluator evaluator) {
        try {
            for (Branch branch : branches) {
                if (branch.condition() == null || evaluator.evaluate(branch.condition())) {
                    return text.substring(branch.bodyStart(), branch.bodyEnd());
                }
            }
            return "";
        } catch (ConditionEvaluator.EvaluationException e) {
            Branch first = branches.get(0);
            LOG.warn("Could not evaluate '{}', including the if branch: {}", first.condition(), e.getMessage());
            return text.substring(first.bodyStart(), first.bodyEnd());
        }
    }

    // ==================== Built-ins ====================

    private static boolean isIncremental(Model model, TemplateContext tctx) {
        return model != null
                && model.materialization() == MaterializationKind.INCREMENTAL
                && tctx.incrementalRun();
    }

    private static String expandBuiltins(String sql, TemplateContext tctx, boolean incremental) {
        String out = replace(STAR, sql, m -> "*");
        out = replace(DISPATCH, out, m -> "");
        out = replace(RUN_STARTED_AT, out, m -> "'" + tctx.runStartedAt() + "'");
        out = replace(INVOCATION_ID, out, m -> "'" + tctx.invocationId() + "'");
        out = replace(LOG_CALL, out, m -> "");
        out = replace(RETURN, out, m -> m.group(1).trim());
        return replace(IS_INCREMENTAL, out, m -> incremental ? "true" : "false");
    }

    private static String stripLeftovers(String sql) {
        Matcher m = LEFTOVER_EXPRESSION.matcher(sql);
        while (m.find()) {
            LOG.warn("Removing unprocessed template expression: {}", m.group());
        }
        String out = m.replaceAll("");
        out = COMMENT.matcher(out).replaceAll("");
        return STATEMENT_TAG.matcher(out).replaceAll("");
    }

    // ==================== Helpers ====================

    private static Pattern expression(String name) {
        return Pattern.compile("\\{\\{-?\\s*" + name + "\\s*-?}}");
    }

    private static Pattern call(String name) {
        return Pattern.compile("\\{\\{-?\\s*" + name + "\\s*\\(([^)]*)\\)\\s*-?}}");
    }

    private static String replace(Pattern pattern, String text, Function<MatchResult, String> replacement) {
        return pattern.matcher(text).replaceAll(m -> Matcher.quoteReplacement(replacement.apply(m)));
    }
}
