package com.example.agentflow.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when an agent does not exist or belongs to another user. Mapped to HTTP 404.
 */
@Getter
public class AgentNotFoundException extends RuntimeException {

    private final UUID agentId;

    public AgentNotFoundException(UUID agentId) {
        super("Agent not found: " + agentId);
        this.agentId = agentId;
    }
}
