package org.snowlite.engine.project;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable snapshot of everything a compile or run can see: the project
 * settings and the registered models, sources, seeds, tests and snapshots.
 *
 * Registration never mutates; each {@code with*} call returns a new context that
 * shares nothing mutable with the old one. Maps keep registration order.
 */
public record CompileContext(
        ProjectConfig config,
        Map<String, Model> models,
        Map<String, Source> sources,
        Map<String, Seed> seeds,
        Map<String, DataTest> tests,
        Map<String, Snapshot> snapshots) {

    public CompileContext {
        Objects.requireNonNull(config, "Project config cannot be null");
        models = frozen(models);
        sources = frozen(sources);
        seeds = frozen(seeds);
        tests = frozen(tests);
        snapshots = frozen(snapshots);
    }

    public static CompileContext empty(ProjectConfig config) {
        return new CompileContext(config, Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    // ==================== Lookup ====================

    public Optional<Model> model(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public Optional<Source> source(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public Optional<Seed> seed(String name) {
        return Optional.ofNullable(seeds.get(name));
    }

    public Optional<DataTest> test(String name) {
        return Optional.ofNullable(tests.get(name));
    }

    public Optional<Snapshot> snapshot(String name) {
        return Optional.ofNullable(snapshots.get(name));
    }

    // ==================== Registration ====================

    public CompileContext withConfig(ProjectConfig newConfig) {
        return new CompileContext(newConfig, models, sources, seeds, tests, snapshots);
    }

    public CompileContext withModel(Model model) {
        return new CompileContext(config, put(models, model.name(), model), sources, seeds, tests, snapshots);
    }

    public CompileContext withoutModel(String name) {
        Map<String, Model> copy = new LinkedHashMap<>(models);
        copy.remove(name);
        return new CompileContext(config, copy, sources, seeds, tests, snapshots);
    }

    public CompileContext withSource(Source source) {
        return new CompileContext(config, models, put(sources, source.name(), source), seeds, tests, snapshots);
    }

    public CompileContext withSeed(Seed seed) {
        return new CompileContext(config, models, sources, put(seeds, seed.name(), seed), tests, snapshots);
    }

    public CompileContext withTest(DataTest test) {
        return new CompileContext(config, models, sources, seeds, put(tests, test.name(), test), snapshots);
    }

    public CompileContext withSnapshot(Snapshot snapshot) {
        return new CompileContext(config, models, sources, seeds, tests, put(snapshots, snapshot.name(), snapshot));
    }

    private static <V> Map<String, V> put(Map<String, V> map, String key, V value) {
        Map<String, V> copy = new LinkedHashMap<>(map);
        copy.put(key, value);
        return copy;
    }

    private static <V> Map<String, V> frozen(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
