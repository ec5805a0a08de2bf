package com.agentflow.fgc.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a generated code chunk. Emission order follows {@link #priority()}.
 */
public enum FragmentKind {
    IMPORT(0),
    DECLARATION(1),
    INITIALIZATION(2),
    EXECUTION(3);

    private final int priority;

    FragmentKind(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
