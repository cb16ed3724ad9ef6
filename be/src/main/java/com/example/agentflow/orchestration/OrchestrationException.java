package com.example.agentflow.orchestration;

import lombok.Getter;

import java.util.UUID;

/**
 * Unexpected failure while running a workflow (persistence failure, broken scheduling invariant).
 * Fatal to the run: the workflow is marked failed and the error reaches the caller.
 */
@Getter
public class OrchestrationException extends RuntimeException {

    private final UUID workflowId;

    public OrchestrationException(String message) {
        this(null, message, null);
    }

    public OrchestrationException(UUID workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
    }
}
