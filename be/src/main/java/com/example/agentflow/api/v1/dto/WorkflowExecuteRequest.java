package com.example.agentflow.api.v1.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request body for executing a workflow: name, ordered steps and the scheduling mode.
 */
public record WorkflowExecuteRequest(
        @NotBlank String name,
        String description,
        @NotNull @Valid List<WorkflowStepRequest> steps,
        boolean parallel
) {
    public WorkflowExecuteRequest(String name, List<WorkflowStepRequest> steps, boolean parallel) {
        this(name, null, steps, parallel);
    }
}
