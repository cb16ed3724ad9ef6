package com.example.agentflow.api.v1.dto;

import com.example.agentflow.domain.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Workflow summary: identity, per-step results in execution order, aggregate status and total time (seconds).
 */
public record WorkflowResponse(
        UUID workflowId,
        String workflowName,
        String conversationId,
        List<WorkflowStepResultDto> steps,
        double totalExecutionTime,
        WorkflowStatus status,
        Instant timestamp
) {}
