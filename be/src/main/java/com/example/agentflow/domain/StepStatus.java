package com.example.agentflow.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single workflow step: {@code pending -> running -> success | error}, or {@code pending -> skipped}.
 */
public enum StepStatus {
    PENDING("pending"),
    RUNNING("running"),
    SUCCESS("success"),
    ERROR("error"),
    SKIPPED("skipped");

    private final String value;

    StepStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == SKIPPED;
    }
}
