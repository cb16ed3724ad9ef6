package com.example.agentflow.api.v1.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * One step of a workflow request. {@code stepName} defaults to {@code step_<position>} when absent;
 * {@code passResultTo} is advisory and only stored.
 */
public record WorkflowStepRequest(
        @NotBlank String agentId,
        String message,
        String stepName,
        List<String> dependsOn,
        List<String> passResultTo
) {
    public WorkflowStepRequest {
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        passResultTo = passResultTo != null ? List.copyOf(passResultTo) : List.of();
    }

    public WorkflowStepRequest(String agentId, String message, String stepName, List<String> dependsOn) {
        this(agentId, message, stepName, dependsOn, List.of());
    }
}
