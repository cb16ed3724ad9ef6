package com.example.agentflow.api.v1.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Request body for registering an agent.
 */
public record AgentCreateRequest(
        @NotBlank String name,
        String instructions,
        String modelName,
        List<String> toolIds
) {}
