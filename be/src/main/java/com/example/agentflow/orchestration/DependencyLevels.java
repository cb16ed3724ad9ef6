package com.example.agentflow.orchestration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups steps into topological generations: level 0 holds steps without dependencies, level k the steps
 * whose dependencies all sit in levels below k. Declaration order is kept inside each level.
 */
public final class DependencyLevels {

    private DependencyLevels() {
    }

    /**
     * @throws OrchestrationException if some steps can never be placed (cycle or dangling dependency)
     */
    public static List<List<ScheduledStep>> group(List<ScheduledStep> steps) {
        List<List<ScheduledStep>> levels = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<ScheduledStep> remaining = new ArrayList<>(steps);
        while (!remaining.isEmpty()) {
            List<ScheduledStep> level = remaining.stream()
                    .filter(step -> placed.containsAll(step.dependsOn()))
                    .toList();
            if (level.isEmpty()) {
                List<String> stuck = remaining.stream().map(ScheduledStep::stepName).toList();
                throw new OrchestrationException("Cannot order steps " + stuck + ": unresolved or circular dependencies");
            }
            level.forEach(step -> placed.add(step.stepName()));
            remaining.removeAll(level);
            levels.add(level);
        }
        return levels;
    }
}
