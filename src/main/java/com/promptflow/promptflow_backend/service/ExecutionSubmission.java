package com.promptflow.promptflow_backend.service;

import com.promptflow.promptflow_backend.validation.FlowValidationResult;
import com.promptflow.promptflow_backend.variable.SubmissionResult;

/**
 * Result of asking to run a flow. When the flow itself is not runnable {@code submission} is null
 * and {@code validation} says why; otherwise the binder's answer is in {@code submission}.
 */
public record ExecutionSubmission(FlowValidationResult validation, SubmissionResult submission) {

    public boolean flowInvalid() {
        return submission == null;
    }
}
