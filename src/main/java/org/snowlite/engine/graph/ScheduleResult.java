package org.snowlite.engine.graph;

import java.util.List;

/**
 * A build order.
 *
 * @param order    Every scheduled node; dependencies first, then any nodes left on a cycle
 * @param cyclic   The nodes Kahn's algorithm could not order, sorted by name
 */
public record ScheduleResult(List<String> order, List<String> cyclic) {

    public ScheduleResult {
        order = List.copyOf(order);
        cyclic = List.copyOf(cyclic);
    }

    public boolean hasCycle() {
        return !cyclic.isEmpty();
    }
}
