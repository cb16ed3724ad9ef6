package com.example.agentflow.api.v1.dto;

import java.util.Map;

/**
 * Request body for running a workflow template: template parameters and an optional run name.
 */
public record TemplateExecuteRequest(
        Map<String, String> params,
        String workflowName
) {
    public TemplateExecuteRequest {
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}
