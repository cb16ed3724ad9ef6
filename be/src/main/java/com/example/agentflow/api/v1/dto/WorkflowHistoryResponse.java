package com.example.agentflow.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/workflows/history.
 */
public record WorkflowHistoryResponse(List<WorkflowHistoryItem> workflows) {}
