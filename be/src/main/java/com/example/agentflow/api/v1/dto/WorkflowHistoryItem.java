package com.example.agentflow.api.v1.dto;

import com.example.agentflow.domain.WorkflowStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of the workflow history list.
 */
public record WorkflowHistoryItem(
        UUID workflowId,
        String name,
        WorkflowStatus status,
        Double totalExecutionTime,
        long stepCount,
        Instant createdAt,
        String conversationId
) {}
