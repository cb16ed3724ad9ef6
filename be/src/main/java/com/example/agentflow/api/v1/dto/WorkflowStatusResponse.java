package com.example.agentflow.api.v1.dto;

import com.example.agentflow.domain.WorkflowStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Progress snapshot of a workflow run. Counts reflect persisted step statuses at read time.
 */
public record WorkflowStatusResponse(
        UUID workflowId,
        WorkflowStatus status,
        Double totalExecutionTime,
        long stepCount,
        long completedSteps,
        long failedSteps,
        long skippedSteps,
        Instant timestamp
) {}
