package com.agentflow.fgc.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Taxonomy of problems reported by validation and conversion.
 */
public enum IssueType {
    STRUCTURAL,
    MISSING_NODE,
    DUPLICATE_NODE,
    CIRCULAR_DEPENDENCY,
    MISSING_PARAMETER,
    UNSUPPORTED_TYPE,
    CONVERSION_FAILED,
    UNRESOLVED_REFERENCE,
    ISOLATED_NODE;

    /** Issues that make the graph unsound for ordered conversion. */
    public boolean isFatalForConversion() {
        return this == STRUCTURAL || this == MISSING_NODE || this == DUPLICATE_NODE
                || this == CIRCULAR_DEPENDENCY;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
