package com.promptflow.promptflow_backend.engine;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a flow once its variables are bound. Implementations may complete the future on any thread;
 * a failed run completes it exceptionally.
 */
public interface FlowExecutionClient {

    CompletableFuture<ExecutionResult> execute(String flowId, Map<String, Object> variables);
}
