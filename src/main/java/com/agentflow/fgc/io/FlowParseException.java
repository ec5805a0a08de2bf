package com.agentflow.fgc.io;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a flow cannot be lifted into a {@link FlowDefinition}. Carries
 * every structural issue found, not just the first.
 */
public class FlowParseException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final List<ParseIssue> issues;

    public FlowParseException(List<ParseIssue> issues) {
        this(issues, null);
    }

    public FlowParseException(List<ParseIssue> issues, Throwable cause) {
        super(summarize(issues), cause);
        this.issues = List.copyOf(issues);
    }

    public List<ParseIssue> issues() {
        return issues;
    }

    private static String summarize(List<ParseIssue> issues) {
        return "Invalid flow (" + issues.size() + (issues.size() == 1 ? " issue): " : " issues): ")
                + issues.stream().map(ParseIssue::toString).collect(Collectors.joining("; "));
    }
}
