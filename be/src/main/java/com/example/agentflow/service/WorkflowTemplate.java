package com.example.agentflow.service;

import com.example.agentflow.api.v1.dto.WorkflowExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowStepRequest;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Predefined workflow whose agents are supplied as named parameters at execution time.
 * Templates always run sequentially.
 */
public record WorkflowTemplate(
        String key,
        String name,
        String description,
        List<String> requiredParams,
        List<StepBlueprint> steps
) {
    public WorkflowTemplate {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(name, "name");
        requiredParams = requiredParams != null ? List.copyOf(requiredParams) : List.of();
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    /**
     * One templated step; {@code agentParam} names the parameter holding the agent id.
     */
    public record StepBlueprint(String stepName, String agentParam, String message, List<String> dependsOn) {
        public StepBlueprint {
            dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        }
    }

    public List<String> missingParams(Map<String, String> params) {
        return requiredParams.stream()
                .filter(param -> params.get(param) == null || params.get(param).isBlank())
                .toList();
    }

    public WorkflowExecuteRequest toRequest(Map<String, String> params, String workflowName) {
        List<WorkflowStepRequest> requests = steps.stream()
                .map(step -> new WorkflowStepRequest(params.get(step.agentParam()), step.message(),
                        step.stepName(), step.dependsOn()))
                .toList();
        String runName = workflowName != null && !workflowName.isBlank() ? workflowName : name;
        return new WorkflowExecuteRequest(runName, description, requests, false);
    }
}
