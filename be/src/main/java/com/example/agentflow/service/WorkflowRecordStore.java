package com.example.agentflow.service;

import com.example.agentflow.api.v1.dto.WorkflowExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowStepRequest;
import com.example.agentflow.domain.Workflow;
import com.example.agentflow.domain.WorkflowStatus;
import com.example.agentflow.domain.WorkflowStep;
import com.example.agentflow.orchestration.OrchestrationException;
import com.example.agentflow.orchestration.ScheduledStep;
import com.example.agentflow.repository.WorkflowRepository;
import com.example.agentflow.repository.WorkflowStepRepository;
import com.example.agentflow.validation.WorkflowDefinitionValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Workflow-level writes of a run: the skeleton written before scheduling and the terminal update after it.
 * Step progress in between goes through {@link com.example.agentflow.orchestration.StepProgressRecorder}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowRecordStore {

    /**
     * Persisted workflow with its steps, ready for scheduling.
     */
    public record WorkflowSkeleton(Workflow workflow, List<ScheduledStep> steps) {
    }

    private final WorkflowRepository workflowRepository;
    private final WorkflowStepRepository stepRepository;

    /**
     * Creates the workflow in {@code running} and all of its steps in {@code pending}, in one transaction.
     * The request must already be validated.
     */
    @Transactional
    public WorkflowSkeleton createSkeleton(WorkflowExecuteRequest request, UUID ownerId) {
        Instant now = Instant.now();
        UUID workflowId = UUID.randomUUID();
        Workflow workflow = workflowRepository.save(
                new Workflow(workflowId, request.name().trim(), request.description(), ownerId, now));

        List<WorkflowStepRequest> steps = request.steps();
        List<WorkflowStep> entities = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStepRequest step = steps.get(i);
            entities.add(new WorkflowStep(
                    UUID.randomUUID(),
                    workflowId,
                    i,
                    WorkflowDefinitionValidator.resolveStepName(step, i),
                    step.agentId().trim(),
                    step.message(),
                    step.dependsOn(),
                    step.passResultTo(),
                    now));
        }
        stepRepository.saveAll(entities);
        log.debug("Persisted workflow skeleton id={} steps={}", workflowId, entities.size());
        return new WorkflowSkeleton(workflow, entities.stream().map(ScheduledStep::of).toList());
    }

    @Transactional
    public Workflow finish(UUID workflowId, WorkflowStatus status, double totalSeconds) {
        Workflow workflow = workflowRepository.findById(workflowId)
                .orElseThrow(() -> new OrchestrationException(workflowId, "Workflow record vanished: " + workflowId, null));
        workflow.finish(status, totalSeconds, Instant.now());
        return workflow;
    }

    /**
     * Marks a run failed in its own transaction, independent of whatever transaction the failure happened in.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID workflowId, double totalSeconds) {
        workflowRepository.findById(workflowId).ifPresent(workflow -> {
            if (workflow.getStatus() == WorkflowStatus.RUNNING) {
                workflow.finish(WorkflowStatus.FAILED, totalSeconds, Instant.now());
            }
        });
    }
}
