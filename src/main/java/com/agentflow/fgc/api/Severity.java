package com.agentflow.fgc.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
