package com.example.agentflow.api.v1.dto;

import java.util.List;

public record AgentListResponse(List<AgentResponse> agents) {}
