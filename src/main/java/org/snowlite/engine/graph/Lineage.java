package org.snowlite.engine.graph;

import java.util.List;

/**
 * The models a model reads from and the models reading from it, transitively.
 */
public record Lineage(String model, List<String> upstream, List<String> downstream) {

    public Lineage {
        upstream = List.copyOf(upstream);
        downstream = List.copyOf(downstream);
    }
}
