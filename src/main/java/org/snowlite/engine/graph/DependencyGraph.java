package org.snowlite.engine.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.project.Model;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The {@code depends_on} edges between registered models, in both directions.
 *
 * Edges to names that are not registered are dropped: such refs compile to a
 * best-guess relation and take no part in ordering. Closures are computed with
 * an explicit work list and visited set, so cyclic input terminates.
 */
public final class DependencyGraph {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraph.class);

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();
    private final Map<String, Model> models = new LinkedHashMap<>();

    private DependencyGraph(Collection<Model> models) {
        for (Model model : models) {
            this.models.put(model.name(), model);
            dependencies.put(model.name(), new LinkedHashSet<>());
            dependents.put(model.name(), new LinkedHashSet<>());
        }
        for (Model model : models) {
            for (String upstream : model.dependsOn()) {
                if (this.models.containsKey(upstream)) {
                    dependencies.get(model.name()).add(upstream);
                    dependents.get(upstream).add(model.name());
                }
            }
        }
    }

    public static DependencyGraph of(Collection<Model> models) {
        return new DependencyGraph(models);
    }

    public static DependencyGraph of(Map<String, Model> models) {
        return new DependencyGraph(models.values());
    }

    /**
     * @return Model names in registration order
     */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(models.keySet());
    }

    public boolean contains(String name) {
        return models.containsKey(name);
    }

    public Model model(String name) {
        return models.get(name);
    }

    public Set<String> dependenciesOf(String name) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(name, Set.of()));
    }

    public Set<String> dependentsOf(String name) {
        return Collections.unmodifiableSet(dependents.getOrDefault(name, Set.of()));
    }

    public List<Model> modelsTagged(String tag) {
        return models.values().stream().filter(m -> m.hasTag(tag)).toList();
    }

    /**
     * @return Every model {@code name} depends on, directly or transitively, excluding itself
     */
    public Set<String> upstream(String name) {
        return closure(name, dependencies);
    }

    /**
     * @return Every model depending on {@code name}, directly or transitively, excluding itself
     */
    public Set<String> downstream(String name) {
        return closure(name, dependents);
    }

    public Lineage lineage(String name) {
        return new Lineage(name, List.copyOf(upstream(name)), List.copyOf(downstream(name)));
    }

    private Set<String> closure(String start, Map<String, Set<String>> edges) {
        Set<String> visited = new LinkedHashSet<>();
        if (!models.containsKey(start)) {
            LOG.warn("Model '{}' is not registered", start);
            return visited;
        }
        Deque<String> work = new ArrayDeque<>(edges.get(start));
        while (!work.isEmpty()) {
            String next = work.poll();
            if (next.equals(start) || !visited.add(next)) {
                continue;
            }
            work.addAll(edges.get(next));
        }
        return visited;
    }
}
