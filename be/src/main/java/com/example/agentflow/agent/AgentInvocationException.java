package com.example.agentflow.agent;

import lombok.Getter;

/**
 * Failure of a single agent call. Recorded on the step as {@code error}; never aborts a workflow.
 */
@Getter
public class AgentInvocationException extends RuntimeException {

    private final String agentId;

    public AgentInvocationException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public AgentInvocationException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }
}
