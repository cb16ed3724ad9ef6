package com.example.agentflow.api.v1.dto;

import com.example.agentflow.domain.AgentStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AgentResponse(
        UUID id,
        String name,
        String instructions,
        String modelName,
        List<String> toolIds,
        AgentStatus status,
        long totalConversations,
        Instant lastConversationAt,
        Instant createdAt,
        Instant updatedAt
) {}
