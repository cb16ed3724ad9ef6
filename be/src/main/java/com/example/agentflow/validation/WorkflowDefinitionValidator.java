package com.example.agentflow.validation;

import com.example.agentflow.api.v1.dto.WorkflowExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowStepRequest;
import com.example.agentflow.domain.AgentStatus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a workflow definition before anything is persisted: step count, agent ownership and status,
 * messages, step-name uniqueness, dependency references and cycles.
 * <p>
 * Missing step names are defaulted positionally ({@code step_1}, {@code step_2}, ...) before the
 * uniqueness and dependency checks, so dependencies may refer to defaulted names.
 * </p>
 */
public final class WorkflowDefinitionValidator {

    private WorkflowDefinitionValidator() {
    }

    /**
     * Validates the definition. Throws {@link WorkflowValidationException} with all errors if invalid.
     *
     * @param ownedAgents status of every agent the caller owns among those referenced (agent id -> status);
     *                    unknown or foreign agent ids are simply absent
     */
    public static void validate(WorkflowExecuteRequest request, Map<String, AgentStatus> ownedAgents, int maxSteps) {
        List<WorkflowStepRequest> steps = request != null ? request.steps() : null;
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("steps", "Workflow must have at least one step");
        }
        if (steps.size() > maxSteps) {
            throw new WorkflowValidationException("steps", "Workflow cannot have more than " + maxSteps + " steps");
        }
        Map<String, AgentStatus> agents = ownedAgents != null ? ownedAgents : Map.of();

        List<ValidationError> errors = new ArrayList<>();
        if (request.name() == null || request.name().isBlank()) {
            errors.add(new ValidationError("name", "Workflow name cannot be empty"));
        }
        for (int i = 0; i < steps.size(); i++) {
            validateStep(i, steps.get(i), agents, errors);
        }
        if (steps.stream().anyMatch(Objects::isNull)) {
            throw new WorkflowValidationException(errors);
        }

        List<String> names = resolveStepNames(steps);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < names.size(); i++) {
            if (!seen.add(names.get(i))) {
                errors.add(new ValidationError("steps[" + i + "].stepName",
                        "Step names must be unique: '" + names.get(i) + "' is used more than once"));
            }
        }

        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            String name = names.get(i);
            List<String> dependsOn = steps.get(i).dependsOn();
            for (String dep : dependsOn) {
                if (dep == null || !seen.contains(dep)) {
                    errors.add(new ValidationError("steps[" + i + "].dependsOn",
                            "Dependency '" + dep + "' not found in workflow steps"));
                } else if (dep.equals(name)) {
                    errors.add(new ValidationError("steps[" + i + "].dependsOn",
                            "Step '" + name + "' cannot depend on itself"));
                }
            }
            graph.putIfAbsent(name, dependsOn);
        }

        if (errors.isEmpty()) {
            Optional<List<String>> cycle = DependencyCycleDetector.findCycle(graph);
            cycle.ifPresent(path -> errors.add(new ValidationError("steps",
                    "Circular dependencies detected in workflow: " + String.join(" -> ", path))));
        }

        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }
    }

    /**
     * Step names after positional defaulting, in declaration order.
     */
    public static List<String> resolveStepNames(List<WorkflowStepRequest> steps) {
        List<String> names = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            names.add(resolveStepName(steps.get(i), i));
        }
        return names;
    }

    public static String resolveStepName(WorkflowStepRequest step, int index) {
        String name = step.stepName();
        return name != null && !name.isBlank() ? name.trim() : "step_" + (index + 1);
    }

    private static void validateStep(int index, WorkflowStepRequest step, Map<String, AgentStatus> agents,
                                     List<ValidationError> errors) {
        String prefix = "steps[" + index + "]";
        if (step == null) {
            errors.add(new ValidationError(prefix, "step is required"));
            return;
        }
        String agentId = step.agentId();
        AgentStatus status = agentId != null ? agents.get(agentId.trim()) : null;
        if (status == null) {
            errors.add(new ValidationError(prefix + ".agentId", "Agent " + agentId + " not found or not accessible"));
        } else if (status != AgentStatus.ACTIVE) {
            errors.add(new ValidationError(prefix + ".agentId",
                    "Agent " + agentId + " is not active (status: " + status.value() + ")"));
        }
        if (step.message() == null || step.message().isBlank()) {
            errors.add(new ValidationError(prefix + ".message", "Step message cannot be empty for agent " + agentId));
        }
    }
}
