package com.agentflow.fgc.engine;

import java.util.List;

/**
 * Result of {@link IRGraphAnalyzer#topologicalSort}. {@code sorted} is empty
 * whenever {@code cycles} is not.
 */
public record TopologicalSortResult(List<String> sorted, List<List<String>> cycles, boolean isAcyclic) {

    public TopologicalSortResult {
        sorted = List.copyOf(sorted);
        cycles = cycles.stream().map(List::copyOf).toList();
    }
}
