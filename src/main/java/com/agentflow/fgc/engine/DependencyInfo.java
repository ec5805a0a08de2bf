package com.agentflow.fgc.engine;

import java.util.List;

/**
 * Per-node dependency summary.
 *
 * @param level          length of the longest upstream chain; entry points are 0
 * @param critical       whether the node lies on the critical path
 * @param parallelizable whether other nodes share its level
 */
public record DependencyInfo(String nodeId, List<String> dependencies, List<String> dependents, int level,
        boolean critical, boolean parallelizable) {
}
