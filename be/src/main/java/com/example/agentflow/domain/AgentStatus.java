package com.example.agentflow.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operational status of a registered agent. Only {@link #ACTIVE} agents may take part in a workflow.
 */
public enum AgentStatus {
    CREATING("creating"),
    ACTIVE("active"),
    ERROR("error"),
    PAUSED("paused"),
    DELETED("deleted");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AgentStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Agent status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + value);
    }
}
