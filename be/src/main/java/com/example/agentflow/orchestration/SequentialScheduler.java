package com.example.agentflow.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs steps one at a time in declaration order.
 * <p>
 * A step runs only if every dependency already has a successful result; otherwise it is recorded as skipped
 * with the unmet dependencies and the run moves on. Skipped results are visible to later steps, so a failure
 * propagates down its chain as skips. After cancellation all remaining steps are skipped.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class SequentialScheduler implements WorkflowScheduler {

    static final String CANCELLED_REASON = "Workflow cancelled";

    private final StepExecutor stepExecutor;

    @Override
    public List<StepResult> run(WorkflowRun run) {
        log.info("Running workflow sequentially workflowId={} steps={}", run.workflowId(), run.steps().size());
        Map<String, StepResult> completed = new HashMap<>();
        List<StepResult> results = new ArrayList<>(run.steps().size());
        for (ScheduledStep step : run.steps()) {
            StepResult result;
            if (run.cancellation().isCancelled()) {
                result = stepExecutor.skip(step, CANCELLED_REASON, run);
            } else {
                List<String> unmet = unmetDependencies(step, completed);
                if (unmet.isEmpty()) {
                    String message = DependencyContext.enhance(step.message(), step.dependsOn(), completed);
                    result = stepExecutor.execute(step, message, run);
                } else {
                    result = stepExecutor.skip(step, "Dependencies not met: " + unmet, run);
                }
            }
            completed.put(step.stepName(), result);
            results.add(result);
        }
        return results;
    }

    private static List<String> unmetDependencies(ScheduledStep step, Map<String, StepResult> completed) {
        return step.dependsOn().stream()
                .filter(dependency -> {
                    StepResult result = completed.get(dependency);
                    return result == null || !result.succeeded();
                })
                .toList();
    }
}
