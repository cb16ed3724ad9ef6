package com.example.agentflow.orchestration;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything a scheduler needs for one run: identity, caller, steps in declaration order and the cancellation token.
 */
public record WorkflowRun(
        UUID workflowId,
        UUID ownerId,
        String conversationId,
        List<ScheduledStep> steps,
        CancellationToken cancellation
) {
    public WorkflowRun {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(ownerId, "ownerId");
        steps = List.copyOf(steps);
        cancellation = cancellation != null ? cancellation : new CancellationToken();
    }
}
