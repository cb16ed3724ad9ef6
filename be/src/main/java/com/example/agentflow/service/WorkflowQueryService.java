package com.example.agentflow.service;

import com.example.agentflow.api.WorkflowNotFoundException;
import com.example.agentflow.api.v1.dto.WorkflowHistoryItem;
import com.example.agentflow.api.v1.dto.WorkflowHistoryResponse;
import com.example.agentflow.api.v1.dto.WorkflowResponse;
import com.example.agentflow.api.v1.dto.WorkflowStatusResponse;
import com.example.agentflow.api.v1.dto.WorkflowStepResultDto;
import com.example.agentflow.config.WorkflowExecutionProperties;
import com.example.agentflow.domain.StepStatus;
import com.example.agentflow.domain.Workflow;
import com.example.agentflow.domain.WorkflowStep;
import com.example.agentflow.orchestration.RunningWorkflowRegistry;
import com.example.agentflow.repository.WorkflowRepository;
import com.example.agentflow.repository.WorkflowStepRepository;
import com.example.agentflow.validation.WorkflowValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Owner-scoped reads of workflow runs (details, history, live status) and deletion of finished runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowQueryService {

    private final WorkflowRepository workflowRepository;
    private final WorkflowStepRepository stepRepository;
    private final RunningWorkflowRegistry runningWorkflows;
    private final WorkflowExecutionProperties properties;

    @Transactional(readOnly = true)
    public WorkflowResponse getWorkflowDetails(UUID workflowId, UUID ownerId) {
        Workflow workflow = load(workflowId, ownerId);
        List<WorkflowStepResultDto> steps = stepRepository.findByWorkflowIdOrderByPositionAsc(workflowId).stream()
                .map(WorkflowQueryService::toDto)
                .toList();
        return new WorkflowResponse(
                workflow.getId(),
                workflow.getName(),
                workflow.getConversationId(),
                steps,
                workflow.getTotalExecutionTime() != null ? workflow.getTotalExecutionTime() : 0.0,
                workflow.getStatus(),
                workflow.getUpdatedAt()
        );
    }

    /**
     * Most recent runs first. {@code limit} is clamped to the configured maximum; {@code null} means the default.
     */
    @Transactional(readOnly = true)
    public WorkflowHistoryResponse getWorkflowHistory(UUID ownerId, Integer limit) {
        int pageSize = properties.resolveHistoryLimit(limit);
        List<WorkflowHistoryItem> items = workflowRepository
                .findByOwnerIdOrderByCreatedAtDesc(ownerId, PageRequest.of(0, pageSize)).stream()
                .map(workflow -> new WorkflowHistoryItem(
                        workflow.getId(),
                        workflow.getName(),
                        workflow.getStatus(),
                        workflow.getTotalExecutionTime(),
                        stepRepository.countByWorkflowId(workflow.getId()),
                        workflow.getCreatedAt(),
                        workflow.getConversationId()))
                .toList();
        log.debug("History owner={} limit={} returned {}", ownerId, pageSize, items.size());
        return new WorkflowHistoryResponse(items);
    }

    @Transactional(readOnly = true)
    public WorkflowStatusResponse getWorkflowStatus(UUID workflowId, UUID ownerId) {
        Workflow workflow = load(workflowId, ownerId);
        return new WorkflowStatusResponse(
                workflow.getId(),
                workflow.getStatus(),
                workflow.getTotalExecutionTime(),
                stepRepository.countByWorkflowId(workflowId),
                stepRepository.countByWorkflowIdAndStatus(workflowId, StepStatus.SUCCESS),
                stepRepository.countByWorkflowIdAndStatus(workflowId, StepStatus.ERROR),
                stepRepository.countByWorkflowIdAndStatus(workflowId, StepStatus.SKIPPED),
                workflow.getUpdatedAt()
        );
    }

    /**
     * Deletes a run together with its steps. Refused while the run is still in flight.
     */
    @Transactional
    public void deleteWorkflow(UUID workflowId, UUID ownerId) {
        Workflow workflow = load(workflowId, ownerId);
        if (runningWorkflows.isRunning(workflowId)) {
            throw new WorkflowValidationException("workflowId", "Workflow " + workflowId + " is still running");
        }
        stepRepository.deleteByWorkflowId(workflowId);
        workflowRepository.delete(workflow);
        log.info("Deleted workflow id={}", workflowId);
    }

    private Workflow load(UUID workflowId, UUID ownerId) {
        return workflowRepository.findByIdAndOwnerId(workflowId, ownerId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private static WorkflowStepResultDto toDto(WorkflowStep step) {
        return new WorkflowStepResultDto(
                step.getStepName(),
                step.getAgentId(),
                step.getMessage(),
                step.getResponse(),
                step.getToolsUsed(),
                step.getExecutionTime() != null ? step.getExecutionTime() : 0.0,
                step.getStatus(),
                step.getErrorMessage(),
                step.getUpdatedAt()
        );
    }
}
