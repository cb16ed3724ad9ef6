package com.example.agentflow.api.v1.dto;

import java.util.UUID;

/**
 * Response for POST /api/v1/workflows/{id}/cancel. {@code cancelled} is false when the run was not in flight.
 */
public record CancelWorkflowResponse(UUID workflowId, boolean cancelled) {}
