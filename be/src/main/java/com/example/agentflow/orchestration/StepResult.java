package com.example.agentflow.orchestration;

import com.example.agentflow.agent.AgentReply;
import com.example.agentflow.domain.StepStatus;

import java.time.Instant;
import java.util.List;

/**
 * In-memory outcome of one step. {@code message} is the message actually sent, including dependency context.
 */
public record StepResult(
        String stepName,
        String agentId,
        String message,
        String response,
        List<String> toolsUsed,
        double executionTime,
        StepStatus status,
        String error,
        Instant timestamp
) {
    public StepResult {
        response = response != null ? response : "";
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
    }

    static StepResult success(ScheduledStep step, String message, AgentReply reply, double seconds) {
        return new StepResult(step.stepName(), step.agentId(), message, reply.response(), reply.toolsUsed(),
                seconds, StepStatus.SUCCESS, null, Instant.now());
    }

    static StepResult error(ScheduledStep step, String message, String error, double seconds) {
        return new StepResult(step.stepName(), step.agentId(), message, "", List.of(),
                seconds, StepStatus.ERROR, error, Instant.now());
    }

    static StepResult skipped(ScheduledStep step, String reason) {
        return new StepResult(step.stepName(), step.agentId(), step.message(), "", List.of(),
                0.0, StepStatus.SKIPPED, reason, Instant.now());
    }

    public boolean succeeded() {
        return status == StepStatus.SUCCESS;
    }
}
