package com.example.agentflow.orchestration;

import com.example.agentflow.domain.WorkflowStep;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable view of a persisted step handed to the schedulers. Workers refer to the persisted
 * record by {@link #stepId()} only and never share the entity.
 */
public record ScheduledStep(
        UUID stepId,
        int position,
        String stepName,
        String agentId,
        String message,
        List<String> dependsOn
) {
    public ScheduledStep {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(stepName, "stepName");
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    public static ScheduledStep of(WorkflowStep step) {
        return new ScheduledStep(step.getId(), step.getPosition(), step.getStepName(), step.getAgentId(),
                step.getMessage(), step.getDependsOn());
    }
}
