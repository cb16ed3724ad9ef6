package com.example.agentflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for a conversational agent owned by one user.
 */
@Entity
@Table(name = "agent")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Agent {

    @Id
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(columnDefinition = "CLOB")
    private String instructions;

    @Column(name = "model_name", length = 255)
    private String modelName;

    @Convert(converter = StringListConverter.class)
    @Column(name = "tool_ids", columnDefinition = "CLOB")
    private List<String> toolIds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private AgentStatus status;

    @Column(name = "total_conversations", nullable = false)
    private long totalConversations;

    @Column(name = "last_conversation_at")
    private Instant lastConversationAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Agent(UUID id, UUID ownerId, String name, String instructions, String modelName, List<String> toolIds,
                 AgentStatus status, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.name = Objects.requireNonNull(name, "name");
        this.instructions = instructions;
        this.modelName = modelName;
        this.toolIds = toolIds != null ? List.copyOf(toolIds) : List.of();
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public void changeStatus(AgentStatus newStatus, Instant now) {
        this.status = Objects.requireNonNull(newStatus, "newStatus");
        this.updatedAt = Objects.requireNonNull(now, "now");
    }

    public void recordConversation(Instant now) {
        this.totalConversations++;
        this.lastConversationAt = Objects.requireNonNull(now, "now");
        this.updatedAt = now;
    }
}
