package com.example.agentflow.orchestration;

import com.example.agentflow.domain.StepStatus;
import com.example.agentflow.domain.WorkflowStatus;

import java.util.Collection;
import java.util.List;

/**
 * Derives the workflow status from the multiset of step statuses.
 * <ul>
 *   <li>no steps, or every step errored: {@code failed}</li>
 *   <li>at least one error among other statuses: {@code partial_success}</li>
 *   <li>every step succeeded: {@code completed}</li>
 *   <li>anything else (skipped steps without errors): {@code partial_success}</li>
 * </ul>
 */
public final class WorkflowStatusAggregator {

    private WorkflowStatusAggregator() {
    }

    public static WorkflowStatus aggregate(List<StepResult> results) {
        return aggregateStatuses(results.stream().map(StepResult::status).toList());
    }

    public static WorkflowStatus aggregateStatuses(Collection<StepStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return WorkflowStatus.FAILED;
        }
        long errors = statuses.stream().filter(s -> s == StepStatus.ERROR).count();
        long successes = statuses.stream().filter(s -> s == StepStatus.SUCCESS).count();
        if (errors == statuses.size()) {
            return WorkflowStatus.FAILED;
        }
        if (errors > 0) {
            return WorkflowStatus.PARTIAL_SUCCESS;
        }
        if (successes == statuses.size()) {
            return WorkflowStatus.COMPLETED;
        }
        return WorkflowStatus.PARTIAL_SUCCESS;
    }
}
