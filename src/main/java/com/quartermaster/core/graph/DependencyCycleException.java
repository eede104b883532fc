package com.quartermaster.core.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a query that needs an acyclic graph meets a dependency cycle.
 */
public class DependencyCycleException extends RuntimeException {

    private final List<List<String>> cycles;

    public DependencyCycleException(List<List<String>> cycles) {
        super("Dependency cycle detected: " + cycles.stream()
                .map(c -> String.join(" -> ", c))
                .collect(Collectors.joining("; ")));
        this.cycles = List.copyOf(cycles);
    }

    public List<List<String>> getCycles() {
        return cycles;
    }
}
