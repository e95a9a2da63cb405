package com.promptflow.promptflow_backend.engine;

import java.util.Map;

/** What the execution back end reports for a finished run. Opaque beyond these fields. */
public record ExecutionResult(String executionId, String status, Map<String, Object> output) {

    public ExecutionResult {
        output = output != null ? output : Map.of();
    }
}
