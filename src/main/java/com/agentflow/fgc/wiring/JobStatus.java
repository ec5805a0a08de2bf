package com.agentflow.fgc.wiring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
    QUEUED, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
