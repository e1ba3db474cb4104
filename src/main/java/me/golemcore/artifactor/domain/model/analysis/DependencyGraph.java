package me.golemcore.artifactor.domain.model.analysis;

import java.util.List;

/**
 * Import edges from a source file to the module it depends on.
 */
public record DependencyGraph(List<Edge> edges) {

    public record Edge(String sourceFile, String target, boolean internal) {
    }

    public DependencyGraph {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(List.of());
    }
}
