package com.example.agentflow.orchestration;

import java.util.UUID;

/**
 * Persists step progress as it happens so status queries see live progress.
 * Implementations must be safe to call from concurrent workers for different steps.
 */
public interface StepProgressRecorder {

    void markRunning(UUID stepId);

    void recordOutcome(UUID stepId, StepResult result);
}
