package com.agentflow.fgc.engine;

import java.util.List;

/**
 * Nodes grouped into phases that may run once every earlier phase finished.
 */
public record ExecutionPlan(List<Phase> phases, List<String> criticalPath, double parallelizationFactor) {

    public int totalPhases() {
        return phases.size();
    }

    /** One level of the plan; nodes inside a phase are independent of each other. */
    public record Phase(String id, int level, List<String> nodes) {

        public boolean canParallelize() {
            return nodes.size() > 1;
        }
    }
}
