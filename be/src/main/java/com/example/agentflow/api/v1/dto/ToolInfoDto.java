package com.example.agentflow.api.v1.dto;

/**
 * API response for one tool agents can be given (id and description).
 */
public record ToolInfoDto(String id, String description) {}
