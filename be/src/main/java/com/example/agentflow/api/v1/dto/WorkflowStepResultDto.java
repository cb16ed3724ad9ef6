package com.example.agentflow.api.v1.dto;

import com.example.agentflow.domain.StepStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one step as returned to callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStepResultDto(
        String stepName,
        String agentId,
        String message,
        String response,
        List<String> toolsUsed,
        double executionTime,
        StepStatus status,
        String error,
        Instant timestamp
) {}
