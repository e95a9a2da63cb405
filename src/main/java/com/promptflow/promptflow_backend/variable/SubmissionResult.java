package com.promptflow.promptflow_backend.variable;

import com.promptflow.promptflow_backend.engine.ExecutionResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of {@link ExecutionVariableBinder#submit()}.
 * Only DISPATCHED carries the typed variables and the pending execution.
 */
public record SubmissionResult(
        Status status,
        Map<String, String> errors,
        Map<String, Object> variables,
        CompletableFuture<ExecutionResult> execution
) {

    public enum Status { INVALID, BUSY, DISPATCHED }

    public static SubmissionResult invalid(Map<String, String> errors) {
        return new SubmissionResult(Status.INVALID, errors, Map.of(), null);
    }

    public static SubmissionResult busy() {
        return new SubmissionResult(Status.BUSY, Map.of(), Map.of(), null);
    }

    public static SubmissionResult dispatched(Map<String, Object> variables, CompletableFuture<ExecutionResult> execution) {
        return new SubmissionResult(Status.DISPATCHED, Map.of(), variables, execution);
    }
}
