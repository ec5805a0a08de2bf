package com.agentflow.fgc.engine;

import java.util.List;

import com.agentflow.fgc.ir.IRGraph;

/**
 * Induced subgraph plus the ids of nodes outside it that feed into it.
 * {@code externalDependencies} is empty when upstream closure was requested.
 */
public record Subgraph(IRGraph graph, String extractedFrom, List<String> externalDependencies) {

    public Subgraph {
        externalDependencies = List.copyOf(externalDependencies);
    }
}
