package com.example.agentflow.repository;

import com.example.agentflow.domain.StepStatus;
import com.example.agentflow.domain.WorkflowStep;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowStepRepository extends JpaRepository<WorkflowStep, UUID> {

    List<WorkflowStep> findByWorkflowIdOrderByPositionAsc(UUID workflowId);

    long countByWorkflowId(UUID workflowId);

    long countByWorkflowIdAndStatus(UUID workflowId, StepStatus status);

    void deleteByWorkflowId(UUID workflowId);
}
