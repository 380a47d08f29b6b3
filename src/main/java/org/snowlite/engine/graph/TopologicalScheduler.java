package org.snowlite.engine.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders a selection with Kahn's algorithm over the selected subgraph.
 *
 * Ties are broken by registration order, so the same graph always yields the same
 * schedule. Nodes on a cycle never reach in-degree zero; they are appended by name
 * and a warning is logged instead of failing.
 */
public final class TopologicalScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(TopologicalScheduler.class);

    private final DependencyGraph graph;

    public TopologicalScheduler(DependencyGraph graph) {
        this.graph = graph;
    }

    public ScheduleResult schedule(Collection<String> selected) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String node : graph.nodes()) {
            if (selected.contains(node)) {
                inDegree.put(node, 0);
            }
        }
        for (String node : inDegree.keySet()) {
            for (String upstream : graph.dependenciesOf(node)) {
                if (inDegree.containsKey(upstream)) {
                    inDegree.merge(node, 1, Integer::sum);
                }
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                ready.add(node);
            }
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String dependent : graph.dependentsOf(node)) {
                Integer degree = inDegree.get(dependent);
                if (degree == null) {
                    continue;
                }
                inDegree.put(dependent, degree - 1);
                if (degree - 1 == 0) {
                    ready.add(dependent);
                }
            }
        }

        List<String> cyclic = new ArrayList<>();
        if (order.size() < inDegree.size()) {
            for (String node : inDegree.keySet()) {
                if (!order.contains(node)) {
                    cyclic.add(node);
                }
            }
            cyclic.sort(null);
            LOG.warn("Dependency cycle detected among {}; appending them by name", cyclic);
            order.addAll(cyclic);
        }
        return new ScheduleResult(order, cyclic);
    }
}
