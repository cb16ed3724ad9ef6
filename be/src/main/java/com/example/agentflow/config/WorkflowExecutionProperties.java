package com.example.agentflow.config;

import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Limits and tuning for workflow runs ({@code agentflow.workflow.*}).
 */
@Validated
@ConfigurationProperties(prefix = "agentflow.workflow")
public class WorkflowExecutionProperties {

    @Min(1)
    private int maxSteps = 50;

    private Duration stepTimeout = Duration.ofSeconds(120);

    @Min(1)
    private int parallelism = 8;

    @Min(1)
    private int historyDefaultLimit = 50;

    @Min(1)
    private int historyMaxLimit = 200;

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = Math.max(1, maxSteps);
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public void setStepTimeout(Duration stepTimeout) {
        if (stepTimeout != null && !stepTimeout.isNegative() && !stepTimeout.isZero()) {
            this.stepTimeout = stepTimeout;
        }
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = Math.max(1, parallelism);
    }

    public int getHistoryDefaultLimit() {
        return Math.min(historyDefaultLimit, getHistoryMaxLimit());
    }

    public void setHistoryDefaultLimit(int historyDefaultLimit) {
        this.historyDefaultLimit = Math.max(1, historyDefaultLimit);
    }

    public int getHistoryMaxLimit() {
        return historyMaxLimit;
    }

    public void setHistoryMaxLimit(int historyMaxLimit) {
        this.historyMaxLimit = Math.max(1, historyMaxLimit);
    }

    /**
     * Clamps a requested history page size to {@code [1, historyMaxLimit]}; {@code null} means the default.
     */
    public int resolveHistoryLimit(Integer requested) {
        if (requested == null) {
            return getHistoryDefaultLimit();
        }
        return Math.max(1, Math.min(requested, historyMaxLimit));
    }
}
