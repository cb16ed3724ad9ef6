package com.example.agentflow.orchestration;

import java.util.List;

/**
 * Runs all steps of a workflow and returns their results in execution order.
 * Per-step agent failures are part of the results; anything thrown is an {@link OrchestrationException}
 * or another unexpected failure the orchestrator treats as fatal.
 */
public interface WorkflowScheduler {

    List<StepResult> run(WorkflowRun run);
}
