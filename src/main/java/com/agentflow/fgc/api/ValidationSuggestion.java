package com.agentflow.fgc.api;

import java.util.List;

/** Non-blocking improvement hint attached to a validation result. */
public record ValidationSuggestion(String type, String message, List<String> nodeIds, String impact) {

    public ValidationSuggestion {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }
}
