package org.snowlite.engine.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.project.Model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The node selection language.
 *
 * <pre>
 *   name        exactly that model
 *   tag:T       every model tagged T
 *   +name       name and everything upstream of it
 *   name+       name and everything downstream of it
 *   +name+      both closures
 * </pre>
 * Tokens are whitespace separated and their selections are unioned. Exclude
 * tokens use the same grammar and are subtracted after the union. A blank
 * selection selects every model.
 */
public final class NodeSelector {

    private static final Logger LOG = LoggerFactory.getLogger(NodeSelector.class);

    private final DependencyGraph graph;

    public NodeSelector(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * @return Selected model names, in registration order
     */
    public Set<String> select(String selection, String exclusion) {
        Set<String> selected = selection == null || selection.isBlank()
                ? new LinkedHashSet<>(graph.nodes())
                : resolve(selection);
        if (exclusion != null && !exclusion.isBlank()) {
            selected.removeAll(resolve(exclusion));
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String node : graph.nodes()) {
            if (selected.contains(node)) {
                ordered.add(node);
            }
        }
        return ordered;
    }

    public Set<String> select(String selection) {
        return select(selection, null);
    }

    private Set<String> resolve(String expression) {
        Set<String> result = new LinkedHashSet<>();
        for (String token : expression.trim().split("\\s+")) {
            result.addAll(resolveToken(token));
        }
        return result;
    }

    private Set<String> resolveToken(String token) {
        Set<String> result = new LinkedHashSet<>();
        if (token.startsWith("tag:")) {
            String tag = token.substring(4);
            graph.modelsTagged(tag).stream().map(Model::name).forEach(result::add);
            return result;
        }

        boolean withUpstream = token.startsWith("+");
        boolean withDownstream = token.endsWith("+") && token.length() > 1;
        String name = token.substring(withUpstream ? 1 : 0, token.length() - (withDownstream ? 1 : 0));
        if (!graph.contains(name)) {
            LOG.warn("Selector '{}' matches no model", token);
            return result;
        }
        result.add(name);
        if (withUpstream) {
            result.addAll(graph.upstream(name));
        }
        if (withDownstream) {
            result.addAll(graph.downstream(name));
        }
        return result;
    }
}
