package com.agentflow.fgc.engine;

import java.util.List;
import java.util.Map;

/**
 * Aggregated structural statistics of an IR graph.
 */
public record GraphStats(
        int nodeCount,
        int connectionCount,
        double averageDegree,
        int maxDepth,
        Complexity complexity,
        Map<String, Integer> nodeTypes,
        Map<String, Integer> categories,
        List<String> entryPoints,
        List<String> exitPoints,
        List<String> isolatedNodes,
        List<List<String>> parallelizableChains,
        List<String> bottlenecks,
        List<String> criticalPath) {
}
