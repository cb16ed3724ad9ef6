package com.example.agentflow.orchestration;

import com.example.agentflow.domain.WorkflowStep;
import com.example.agentflow.repository.WorkflowStepRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.UUID;

/**
 * {@link StepProgressRecorder} writing through Spring Data JPA.
 * <p>
 * Every write runs in its own {@code REQUIRES_NEW} transaction on the calling thread, so each worker checks
 * out its own connection and persistence context for the write and returns them when it commits or rolls back.
 * The entity is loaded by id inside that transaction; nothing is shared between workers.
 * </p>
 */
@Component
public class JpaStepProgressRecorder implements StepProgressRecorder {

    private final WorkflowStepRepository stepRepository;
    private final TransactionTemplate stepTx;

    public JpaStepProgressRecorder(WorkflowStepRepository stepRepository, PlatformTransactionManager transactionManager) {
        this.stepRepository = stepRepository;
        this.stepTx = new TransactionTemplate(transactionManager);
        this.stepTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void markRunning(UUID stepId) {
        stepTx.executeWithoutResult(status -> load(stepId).markRunning(Instant.now()));
    }

    @Override
    public void recordOutcome(UUID stepId, StepResult result) {
        stepTx.executeWithoutResult(status -> load(stepId).recordOutcome(
                result.status(),
                result.response(),
                result.toolsUsed(),
                result.executionTime(),
                result.error(),
                Instant.now()));
    }

    private WorkflowStep load(UUID stepId) {
        return stepRepository.findById(stepId)
                .orElseThrow(() -> new OrchestrationException(null, "Workflow step record vanished: " + stepId, null));
    }
}
