package com.example.agentflow.orchestration;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs steps level by level: all steps of a dependency level run concurrently, and the next level starts only
 * after every step of the current one has finished.
 * <p>
 * Workers read an immutable snapshot of the results of earlier levels; the scheduler thread alone merges a
 * level's results once the level is done. Failed dependencies do not block a step here: the step runs with a
 * warning block in its message instead.
 * </p>
 */
@Slf4j
public class LevelParallelScheduler implements WorkflowScheduler {

    private final StepExecutor stepExecutor;
    private final Executor workerExecutor;

    public LevelParallelScheduler(StepExecutor stepExecutor, Executor workerExecutor) {
        this.stepExecutor = Objects.requireNonNull(stepExecutor, "stepExecutor");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
    }

    @Override
    public List<StepResult> run(WorkflowRun run) {
        List<List<ScheduledStep>> levels = DependencyLevels.group(run.steps());
        log.info("Running workflow in parallel workflowId={} steps={} levels={}",
                run.workflowId(), run.steps().size(), levels.size());

        Map<String, StepResult> completed = new HashMap<>();
        List<StepResult> results = new ArrayList<>(run.steps().size());
        for (int i = 0; i < levels.size(); i++) {
            List<ScheduledStep> level = levels.get(i);
            log.info("Starting level {} workflowId={} steps={}", i, run.workflowId(),
                    level.stream().map(ScheduledStep::stepName).toList());
            Map<String, StepResult> snapshot = Map.copyOf(completed);
            List<CompletableFuture<StepResult>> workers = level.stream()
                    .map(step -> CompletableFuture.supplyAsync(() -> runStep(step, snapshot, run), workerExecutor))
                    .toList();
            for (StepResult result : awaitLevel(workers, i, run)) {
                completed.put(result.stepName(), result);
                results.add(result);
            }
        }
        return results;
    }

    private StepResult runStep(ScheduledStep step, Map<String, StepResult> earlierLevels, WorkflowRun run) {
        if (run.cancellation().isCancelled()) {
            return stepExecutor.skip(step, SequentialScheduler.CANCELLED_REASON, run);
        }
        String message = DependencyContext.enhance(step.message(), step.dependsOn(), earlierLevels);
        return stepExecutor.execute(step, message, run);
    }

    private static List<StepResult> awaitLevel(List<CompletableFuture<StepResult>> workers, int level, WorkflowRun run) {
        try {
            CompletableFuture.allOf(workers.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new OrchestrationException(run.workflowId(),
                    "Level " + level + " of workflow " + run.workflowId() + " failed: " + cause.getMessage(), cause);
        }
        return workers.stream().map(CompletableFuture::join).toList();
    }
}
