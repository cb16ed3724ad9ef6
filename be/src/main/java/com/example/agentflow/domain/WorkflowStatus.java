package com.example.agentflow.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a workflow run. A run starts {@link #RUNNING} and moves to exactly one terminal status.
 */
public enum WorkflowStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    PARTIAL_SUCCESS("partial_success");

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
