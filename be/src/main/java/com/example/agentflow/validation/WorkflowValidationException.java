package com.example.agentflow.validation;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a workflow definition is rejected before anything is persisted.
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.agentflow.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowValidationException(List<ValidationError> errors) {
        super(describe(errors));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public WorkflowValidationException(String field, String message) {
        this(List.of(new ValidationError(field, message)));
    }

    private static String describe(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Workflow validation failed";
        }
        return "Workflow validation failed: " + errors.stream()
                .map(ValidationError::message)
                .collect(Collectors.joining("; "));
    }
}
