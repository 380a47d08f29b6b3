package org.snowlite.engine.materialization;

import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.RelationNames;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Picks the materialization strategy for a model build and renders its DDL.
 */
public final class DDLGenerator {

    private final RelationNames names;

    public DDLGenerator() {
        this(RelationNames.DUCKDB);
    }

    public DDLGenerator(RelationNames names) {
        this.names = names;
    }

    /**
     * @param fullRefresh  Rebuild incremental models from scratch
     * @param targetExists Whether the model's relation already exists
     */
    public MaterializationStrategy strategyFor(Model model, boolean fullRefresh, boolean targetExists) {
        return switch (model.materialization()) {
            case VIEW -> new MaterializationStrategy.View();
            case TABLE -> new MaterializationStrategy.Table();
            case INCREMENTAL -> fullRefresh || !targetExists
                    ? new MaterializationStrategy.Table()
                    : new MaterializationStrategy.Incremental(uniqueKey(model));
            case EPHEMERAL -> new MaterializationStrategy.Ephemeral();
            // Not buildable as models; they get a plain table.
            case SNAPSHOT, SEED, TEST -> new MaterializationStrategy.Table();
        };
    }

    /**
     * Renders the build's statements in execution order. Empty for ephemeral models.
     */
    public List<String> generate(Model model, String compiledSql, boolean fullRefresh, boolean targetExists) {
        MaterializationStrategy strategy = strategyFor(model, fullRefresh, targetExists);
        return strategy.statements(names.of(model), MaterializationStrategy.requireSql(compiledSql));
    }

    private static List<String> uniqueKey(Model model) {
        Object key = model.metaValue("unique_key");
        if (key instanceof Collection<?> columns) {
            return columns.stream().map(String::valueOf).toList();
        }
        if (key == null || String.valueOf(key).isBlank()) {
            return List.of();
        }
        return Arrays.stream(String.valueOf(key).split(","))
                .map(String::trim)
                .filter(c -> !c.isEmpty())
                .toList();
    }
}
