package com.example.agentflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for one step of a workflow run.
 * <p>
 * Created {@link StepStatus#PENDING} together with its workflow and updated in place while it runs.
 * {@code message} is the message as submitted; the message actually sent to the agent (with dependency
 * context) only lives in the run's in-memory results.
 * </p>
 */
@Entity
@Table(name = "workflow_step", indexes = {
        @Index(name = "idx_workflow_step_workflow", columnList = "workflow_id, position")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowStep {

    @Id
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(nullable = false)
    private int position;

    @Column(name = "step_name", nullable = false, length = 255)
    private String stepName;

    @Column(name = "agent_id", nullable = false, length = 64)
    private String agentId;

    @Column(nullable = false, columnDefinition = "CLOB")
    private String message;

    @Column(columnDefinition = "CLOB")
    private String response;

    @Convert(converter = StringListConverter.class)
    @Column(name = "tools_used", columnDefinition = "CLOB")
    private List<String> toolsUsed;

    @Column(name = "execution_time")
    private Double executionTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private StepStatus status;

    @Column(name = "error_message", columnDefinition = "CLOB")
    private String errorMessage;

    @Convert(converter = StringListConverter.class)
    @Column(name = "depends_on", columnDefinition = "CLOB")
    private List<String> dependsOn;

    @Convert(converter = StringListConverter.class)
    @Column(name = "pass_result_to", columnDefinition = "CLOB")
    private List<String> passResultTo;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WorkflowStep(UUID id, UUID workflowId, int position, String stepName, String agentId, String message,
                        List<String> dependsOn, List<String> passResultTo, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        this.position = position;
        this.stepName = Objects.requireNonNull(stepName, "stepName");
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.message = Objects.requireNonNull(message, "message");
        this.dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        this.passResultTo = passResultTo != null ? List.copyOf(passResultTo) : List.of();
        this.toolsUsed = List.of();
        this.status = StepStatus.PENDING;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public void markRunning(Instant now) {
        this.status = StepStatus.RUNNING;
        this.updatedAt = Objects.requireNonNull(now, "now");
    }

    public void recordOutcome(StepStatus terminalStatus, String response, List<String> toolsUsed,
                              double executionTime, String errorMessage, Instant now) {
        Objects.requireNonNull(terminalStatus, "terminalStatus");
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Step outcome must be terminal, got " + terminalStatus);
        }
        this.status = terminalStatus;
        this.response = response;
        this.toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
        this.executionTime = executionTime;
        this.errorMessage = errorMessage;
        this.updatedAt = Objects.requireNonNull(now, "now");
    }
}
