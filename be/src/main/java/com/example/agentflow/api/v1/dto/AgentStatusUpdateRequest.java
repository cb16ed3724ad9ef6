package com.example.agentflow.api.v1.dto;

import com.example.agentflow.domain.AgentStatus;

import jakarta.validation.constraints.NotNull;

public record AgentStatusUpdateRequest(@NotNull AgentStatus status) {}
