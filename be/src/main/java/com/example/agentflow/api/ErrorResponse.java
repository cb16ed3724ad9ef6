package com.example.agentflow.api;

import com.example.agentflow.validation.ValidationError;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body for 4xx/5xx responses: message and, for validation failures, the individual field errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationError> errors) {

    public ErrorResponse(String message) {
        this(message, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null);
    }
}
