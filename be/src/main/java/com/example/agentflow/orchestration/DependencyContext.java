package com.example.agentflow.orchestration;

import java.util.List;
import java.util.Map;

/**
 * Builds the message actually sent to a step's agent from its original message and the results of its dependencies.
 * <p>
 * For every dependency, in {@code dependsOn} order: a successful one appends its response as a context block,
 * any other outcome appends a warning naming the dependency and its status. Dependencies without a result
 * are left out. Steps without dependencies keep their message unchanged.
 * </p>
 */
public final class DependencyContext {

    private DependencyContext() {
    }

    public static String enhance(String message, List<String> dependsOn, Map<String, StepResult> completed) {
        if (dependsOn == null || dependsOn.isEmpty()) {
            return message;
        }
        StringBuilder enhanced = new StringBuilder(message);
        for (String dependency : dependsOn) {
            StepResult result = completed.get(dependency);
            if (result == null) {
                continue;
            }
            if (result.succeeded()) {
                enhanced.append("\n\nContext from ").append(dependency).append(": ").append(result.response());
            } else {
                enhanced.append("\n\nWarning: ").append(dependency)
                        .append(" failed with status ").append(result.status().value());
            }
        }
        return enhanced.toString();
    }
}
