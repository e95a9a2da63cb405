package com.promptflow.promptflow_backend.validation;

import java.util.List;

/** A flow is valid when it has no errors; warnings never block execution. */
public record FlowValidationResult(boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public FlowValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static FlowValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new FlowValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }
}
