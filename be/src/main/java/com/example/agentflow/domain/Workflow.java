package com.example.agentflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for one workflow run.
 * <p>
 * Created in {@link WorkflowStatus#RUNNING} when orchestration starts and finished exactly once with a
 * terminal status and the total wall-clock time in seconds. Steps reference the run by {@code workflow_id}.
 * </p>
 */
@Entity
@Table(name = "workflow", indexes = {
        @Index(name = "idx_workflow_owner_created", columnList = "owner_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Workflow {

    @Id
    private UUID id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(columnDefinition = "CLOB")
    private String description;

    @Column(name = "conversation_id", nullable = false, length = 255)
    private String conversationId;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private WorkflowStatus status;

    @Column(name = "total_execution_time")
    private Double totalExecutionTime;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Workflow(UUID id, String name, String description, UUID ownerId, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.conversationId = conversationIdFor(id);
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.status = WorkflowStatus.RUNNING;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    /**
     * Externally visible conversation id, derived from the workflow id.
     */
    public static String conversationIdFor(UUID workflowId) {
        return "workflow_" + workflowId;
    }

    public void finish(WorkflowStatus terminalStatus, double totalSeconds, Instant now) {
        Objects.requireNonNull(terminalStatus, "terminalStatus");
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Workflow can only finish with a terminal status, got " + terminalStatus);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Workflow " + id + " already finished with status " + status.value());
        }
        this.status = terminalStatus;
        this.totalExecutionTime = totalSeconds;
        this.updatedAt = Objects.requireNonNull(now, "now");
    }
}
