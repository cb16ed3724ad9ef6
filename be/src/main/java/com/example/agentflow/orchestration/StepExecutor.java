package com.example.agentflow.orchestration;

import com.example.agentflow.agent.AgentInvocationException;
import com.example.agentflow.agent.AgentInvocationService;
import com.example.agentflow.agent.AgentReply;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one step: marks it running, calls its agent once with the already enhanced message, persists the outcome.
 * <p>
 * Agent failures, timeouts and cancellation become an {@code error} result and never propagate.
 * Persistence failures do propagate and are fatal to the run.
 * </p>
 */
@Slf4j
public class StepExecutor {

    private static final long START_POLL_MILLIS = 50;

    private final AgentInvocationService invocationService;
    private final StepProgressRecorder recorder;
    private final ExecutorService agentCallExecutor;
    private final Duration stepTimeout;

    public StepExecutor(AgentInvocationService invocationService, StepProgressRecorder recorder,
                        ExecutorService agentCallExecutor, Duration stepTimeout) {
        this.invocationService = Objects.requireNonNull(invocationService, "invocationService");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.agentCallExecutor = Objects.requireNonNull(agentCallExecutor, "agentCallExecutor");
        this.stepTimeout = Objects.requireNonNull(stepTimeout, "stepTimeout");
    }

    public StepResult execute(ScheduledStep step, String message, WorkflowRun run) {
        recorder.markRunning(step.stepId());
        long started = System.nanoTime();
        StepResult result;
        try {
            AgentReply reply = callAgent(step, message, run);
            result = StepResult.success(step, message, reply, elapsedSeconds(started));
            log.debug("Step succeeded workflowId={} step={} agentId={} tools={}",
                    run.workflowId(), step.stepName(), step.agentId(), reply.toolsUsed());
        } catch (AgentInvocationException e) {
            result = StepResult.error(step, message, e.getMessage(), elapsedSeconds(started));
            log.warn("Step failed workflowId={} step={} agentId={}: {}",
                    run.workflowId(), step.stepName(), step.agentId(), e.getMessage());
        }
        recorder.recordOutcome(step.stepId(), result);
        return result;
    }

    /**
     * Records the step as skipped without calling its agent.
     */
    public StepResult skip(ScheduledStep step, String reason, WorkflowRun run) {
        StepResult result = StepResult.skipped(step, reason);
        recorder.recordOutcome(step.stepId(), result);
        log.info("Step skipped workflowId={} step={}: {}", run.workflowId(), step.stepName(), reason);
        return result;
    }

    private AgentReply callAgent(ScheduledStep step, String message, WorkflowRun run) {
        CancellationToken cancellation = run.cancellation();
        if (cancellation.isCancelled()) {
            throw new AgentInvocationException(step.agentId(), "Step cancelled");
        }
        CompletableFuture<Long> started = new CompletableFuture<>();
        Future<AgentReply> call = agentCallExecutor.submit(() -> {
            started.complete(System.nanoTime());
            return invocationService.invoke(step.agentId(), message, run.ownerId(), null);
        });
        cancellation.track(call);
        try {
            long deadline = awaitStart(call, started) + stepTimeout.toNanos();
            return call.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new AgentInvocationException(step.agentId(), "Step timed out after " + describe(stepTimeout));
        } catch (CancellationException e) {
            throw new AgentInvocationException(step.agentId(), "Step cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new AgentInvocationException(step.agentId(), "Step interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AgentInvocationException invocationFailure) {
                throw invocationFailure;
            }
            String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new AgentInvocationException(step.agentId(), detail, cause);
        } finally {
            cancellation.untrack(call);
        }
    }

    /**
     * Waits until the agent call has left the executor queue and returns its start time. The step deadline is
     * counted from there. Returns early once the call is done without having started, i.e. cancelled while queued.
     */
    private static long awaitStart(Future<AgentReply> call, CompletableFuture<Long> started)
            throws InterruptedException, ExecutionException {
        while (true) {
            try {
                return started.get(START_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (call.isDone() && !started.isDone()) {
                    return System.nanoTime();
                }
            }
        }
    }

    private static String describe(Duration timeout) {
        return timeout.toMillis() % 1000 == 0 ? timeout.toSeconds() + "s" : timeout.toMillis() + "ms";
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
