package com.example.agentflow.api.v1.dto;

import java.util.List;

/**
 * Request body for chaining several agents on the same message.
 */
public record SimpleChainRequest(
        List<String> agentIds,
        String message,
        String workflowName,
        boolean parallel
) {}
