package com.agentflow.fgc.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

/** A single validation or conversion problem. Optional fields are null when not applicable. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationIssue {
    IssueType type;
    String message;
    String nodeId;
    String connectionId;
    String parameterName;
    Severity severity;
    String fixSuggestion;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(type.code()).append("] ").append(message);
        if (fixSuggestion != null)
            sb.append(" (").append(fixSuggestion).append(')');
        return sb.toString();
    }
}
