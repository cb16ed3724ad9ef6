package com.example.agentflow.api.v1.dto;

import java.util.List;

/**
 * A workflow template as listed to callers: its key, the parameters it needs and its step names in order.
 */
public record WorkflowTemplateDto(
        String key,
        String name,
        String description,
        List<String> requiredParams,
        List<String> stepNames
) {}
