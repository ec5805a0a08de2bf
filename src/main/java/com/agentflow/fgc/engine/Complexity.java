package com.agentflow.fgc.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse size/branching classification of a graph. */
public enum Complexity {
    SIMPLE, MEDIUM, COMPLEX;

    /**
     * Classifies by node count and cyclomatic complexity {@code E - N + 2}.
     */
    public static Complexity classify(int nodeCount, int connectionCount) {
        int cyclomatic = connectionCount - nodeCount + 2;
        if (nodeCount <= 5 && cyclomatic <= 3)
            return SIMPLE;
        if (nodeCount <= 20 && cyclomatic <= 10)
            return MEDIUM;
        return COMPLEX;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
