package com.example.agentflow.service;

import com.example.agentflow.api.TemplateNotFoundException;
import com.example.agentflow.api.v1.dto.SimpleChainRequest;
import com.example.agentflow.api.v1.dto.TemplateExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowResponse;
import com.example.agentflow.api.v1.dto.WorkflowStepRequest;
import com.example.agentflow.api.v1.dto.WorkflowStepResultDto;
import com.example.agentflow.config.WorkflowExecutionProperties;
import com.example.agentflow.domain.AgentStatus;
import com.example.agentflow.domain.Workflow;
import com.example.agentflow.domain.WorkflowStatus;
import com.example.agentflow.orchestration.CancellationToken;
import com.example.agentflow.orchestration.LevelParallelScheduler;
import com.example.agentflow.orchestration.OrchestrationException;
import com.example.agentflow.orchestration.RunningWorkflowRegistry;
import com.example.agentflow.orchestration.SequentialScheduler;
import com.example.agentflow.orchestration.StepResult;
import com.example.agentflow.orchestration.WorkflowRun;
import com.example.agentflow.orchestration.WorkflowScheduler;
import com.example.agentflow.orchestration.WorkflowStatusAggregator;
import com.example.agentflow.validation.ValidationError;
import com.example.agentflow.validation.WorkflowDefinitionValidator;
import com.example.agentflow.validation.WorkflowValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.IntStream;

/**
 * Entry point for running workflows.
 * <p>
 * A run is validated first (nothing is persisted for an invalid definition), then written as a workflow in
 * {@code running} with all steps {@code pending}, scheduled sequentially or level by level, and finally given
 * its aggregate status. Per-step agent failures end up in the step results. Anything else thrown while
 * scheduling marks the workflow {@code failed} and is rethrown as {@link OrchestrationException}.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowOrchestrator {

    private final AgentDirectoryService agentDirectory;
    private final WorkflowRecordStore recordStore;
    private final SequentialScheduler sequentialScheduler;
    private final LevelParallelScheduler levelParallelScheduler;
    private final RunningWorkflowRegistry runningWorkflows;
    private final WorkflowTemplateCatalog templateCatalog;
    private final WorkflowExecutionProperties properties;

    public WorkflowResponse executeWorkflow(WorkflowExecuteRequest request, UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        List<String> agentIds = request != null && request.steps() != null
                ? request.steps().stream().filter(Objects::nonNull).map(WorkflowStepRequest::agentId).toList()
                : List.of();
        Map<String, AgentStatus> ownedAgents = agentDirectory.resolveStatuses(ownerId, agentIds);
        WorkflowDefinitionValidator.validate(request, ownedAgents, properties.getMaxSteps());

        long started = System.nanoTime();
        WorkflowRecordStore.WorkflowSkeleton skeleton = recordStore.createSkeleton(request, ownerId);
        Workflow workflow = skeleton.workflow();
        UUID workflowId = workflow.getId();
        CancellationToken cancellation = runningWorkflows.register(workflowId, ownerId);
        WorkflowRun run = new WorkflowRun(workflowId, ownerId, workflow.getConversationId(), skeleton.steps(), cancellation);
        log.info("Workflow started id={} name={} steps={} parallel={}",
                workflowId, workflow.getName(), skeleton.steps().size(), request.parallel());

        List<StepResult> results;
        double totalSeconds;
        WorkflowStatus status;
        try {
            results = schedulerFor(request.parallel()).run(run);
            totalSeconds = elapsedSeconds(started);
            status = WorkflowStatusAggregator.aggregate(results);
            workflow = recordStore.finish(workflowId, status, totalSeconds);
        } catch (RuntimeException e) {
            throw abort(workflowId, elapsedSeconds(started), e);
        } finally {
            runningWorkflows.unregister(workflowId);
        }
        log.info("Workflow finished id={} status={} totalExecutionTime={}s", workflowId, status.value(),
                String.format("%.3f", totalSeconds));
        return new WorkflowResponse(
                workflowId,
                workflow.getName(),
                workflow.getConversationId(),
                results.stream().map(WorkflowOrchestrator::toDto).toList(),
                totalSeconds,
                status,
                Instant.now()
        );
    }

    /**
     * Runs the same message through several agents. Sequentially each step depends on all earlier steps;
     * in parallel mode the steps are independent.
     */
    public WorkflowResponse executeSimpleChain(SimpleChainRequest request, UUID ownerId) {
        List<String> agentIds = request.agentIds() != null ? request.agentIds() : List.of();
        List<ValidationError> errors = new ArrayList<>();
        if (agentIds.isEmpty()) {
            errors.add(new ValidationError("agentIds", "agentIds are required"));
        }
        if (request.message() == null || request.message().isBlank()) {
            errors.add(new ValidationError("message", "message is required"));
        }
        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }
        List<WorkflowStepRequest> steps = IntStream.range(0, agentIds.size())
                .mapToObj(i -> new WorkflowStepRequest(
                        agentIds.get(i),
                        request.message(),
                        "step_" + (i + 1),
                        request.parallel()
                                ? List.of()
                                : IntStream.range(0, i).mapToObj(j -> "step_" + (j + 1)).toList()))
                .toList();
        String name = request.workflowName() != null && !request.workflowName().isBlank()
                ? request.workflowName()
                : "Simple Chain - " + agentIds.size() + " agents";
        return executeWorkflow(new WorkflowExecuteRequest(name, steps, request.parallel()), ownerId);
    }

    public WorkflowResponse executeTemplate(String templateKey, TemplateExecuteRequest request, UUID ownerId) {
        WorkflowTemplate template = templateCatalog.find(templateKey)
                .orElseThrow(() -> new TemplateNotFoundException(templateKey, templateCatalog.keys()));
        List<String> missing = template.missingParams(request.params());
        if (!missing.isEmpty()) {
            throw new WorkflowValidationException("params", "Missing required parameters: " + missing);
        }
        log.debug("Executing template {} for owner={}", templateKey, ownerId);
        return executeWorkflow(template.toRequest(request.params(), request.workflowName()), ownerId);
    }

    public List<WorkflowTemplate> listTemplates() {
        return templateCatalog.list();
    }

    /**
     * @return true if the workflow was running here and is now cancelled
     */
    public boolean cancelWorkflow(UUID workflowId, UUID ownerId) {
        return runningWorkflows.cancel(workflowId, ownerId);
    }

    private WorkflowScheduler schedulerFor(boolean parallel) {
        return parallel ? levelParallelScheduler : sequentialScheduler;
    }

    private OrchestrationException abort(UUID workflowId, double elapsedSeconds, RuntimeException failure) {
        log.error("Workflow failed id={} after {}s: {}", workflowId, String.format("%.3f", elapsedSeconds),
                failure.getMessage(), failure);
        try {
            recordStore.markFailed(workflowId, elapsedSeconds);
        } catch (RuntimeException e) {
            log.error("Could not mark workflow {} failed: {}", workflowId, e.getMessage());
            failure.addSuppressed(e);
        }
        if (failure instanceof OrchestrationException orchestrationFailure) {
            return orchestrationFailure;
        }
        return new OrchestrationException(workflowId, "Workflow " + workflowId + " failed: " + failure.getMessage(), failure);
    }

    private static WorkflowStepResultDto toDto(StepResult result) {
        return new WorkflowStepResultDto(
                result.stepName(),
                result.agentId(),
                result.message(),
                result.response(),
                result.toolsUsed(),
                result.executionTime(),
                result.status(),
                result.error(),
                result.timestamp()
        );
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
