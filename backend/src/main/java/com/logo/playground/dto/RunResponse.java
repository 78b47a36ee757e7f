package com.logo.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.logo.playground.exception.LogoException;
import com.logo.playground.model.ExecutionResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        boolean success,
        ExecutionResult result,
        String error,
        String errorKind,
        Long executionTimeMs,
        String resultType
) {

    public static RunResponse success(ExecutionResult result, long executionTimeMs) {
        return new RunResponse(
                true,
                result,
                null,
                null,
                executionTimeMs,
                "success");
    }

    public static RunResponse scriptError(LogoException error, long executionTimeMs) {
        return new RunResponse(
                false,
                null,
                error.getMessage(),
                error.getKind().name(),
                executionTimeMs,
                "script_error");
    }

    public static RunResponse validationError(String error) {
        return new RunResponse(
                false,
                null,
                error,
                null,
                null,
                "validation_error");
    }

    public static RunResponse timeout(String message) {
        return new RunResponse(
                false,
                null,
                message,
                null,
                null,
                "timeout");
    }

    public static RunResponse internalError(String message) {
        return new RunResponse(
                false,
                null,
                message,
                null,
                null,
                "internal_error");
    }
}
