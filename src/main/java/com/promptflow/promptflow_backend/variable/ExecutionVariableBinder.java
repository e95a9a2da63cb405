package com.promptflow.promptflow_backend.variable;

import com.promptflow.promptflow_backend.engine.ExecutionResult;
import com.promptflow.promptflow_backend.engine.FlowExecutionClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Collects the values of a flow's variables, validates and types them, and hands them to the
 * execution back end.
 *
 * <pre>
 * IDLE -> VALIDATING -> INVALID -> IDLE            (field errors kept until the field is edited)
 *                    -> EXECUTING -> COMPLETED | FAILED
 * </pre>
 *
 * Submitting again while EXECUTING is refused. {@link #close()} does not abort a running execution;
 * its outcome is discarded when it arrives.
 */
@Slf4j
public class ExecutionVariableBinder {

    private final String flowId;
    private final FlowExecutionClient executionClient;
    private final VariableCoercer coercer;
    private final BinderStateListener listener;

    private List<FlowVariable> variables;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> errors = new LinkedHashMap<>();

    private BinderState state = BinderState.IDLE;
    // Bumped on every dispatch and on close; a completion from an older generation is stale
    private long generation;
    private boolean closed;

    public ExecutionVariableBinder(String flowId,
                                   List<FlowVariable> variables,
                                   FlowExecutionClient executionClient,
                                   VariableCoercer coercer,
                                   BinderStateListener listener) {
        this.flowId = flowId;
        this.executionClient = executionClient;
        this.coercer = coercer;
        this.listener = listener != null ? listener : BinderStateListener.NOOP;
        this.variables = List.copyOf(variables);
        for (FlowVariable variable : this.variables) {
            values.put(variable.name(), coercer.initialValue(variable));
        }
    }

    public synchronized List<VariableInput> inputs() {
        List<VariableInput> inputs = new ArrayList<>(variables.size());
        for (FlowVariable variable : variables) {
            inputs.add(new VariableInput(
                    variable.name(),
                    variable.type(),
                    InputKind.forType(variable.type()),
                    values.get(variable.name()),
                    variable.required(),
                    variable.description(),
                    errors.get(variable.name())));
        }
        return inputs;
    }

    /** Edits one field and clears its error. Returns false for a name the flow does not use. */
    public synchronized boolean setValue(String name, Object value) {
        if (!values.containsKey(name)) {
            return false;
        }
        values.put(name, value);
        errors.remove(name);
        return true;
    }

    /**
     * Picks up a re-resolved variable list after the flow changed. Values of variables that are
     * still present are kept. Ignored while an execution is running.
     */
    public synchronized void refresh(List<FlowVariable> resolved) {
        if (state == BinderState.EXECUTING) {
            return;
        }
        Map<String, Object> previous = new LinkedHashMap<>(values);
        variables = List.copyOf(resolved);
        values.clear();
        for (FlowVariable variable : variables) {
            values.put(variable.name(), previous.containsKey(variable.name())
                    ? previous.get(variable.name())
                    : coercer.initialValue(variable));
        }
        errors.keySet().retainAll(values.keySet());
    }

    public SubmissionResult submit() {
        Map<String, Object> typed;
        long dispatchGeneration;
        synchronized (this) {
            if (state == BinderState.EXECUTING) {
                log.warn("Flow {}: submit ignored, an execution is already running", flowId);
                return SubmissionResult.busy();
            }
            transition(BinderState.VALIDATING);

            errors.clear();
            for (FlowVariable variable : variables) {
                coercer.validate(variable, values.get(variable.name()))
                        .ifPresent(message -> errors.put(variable.name(), message));
            }
            if (!errors.isEmpty()) {
                Map<String, String> reported = errorSnapshot();
                transition(BinderState.INVALID);
                transition(BinderState.IDLE);
                log.info("Flow {}: {} variable(s) failed validation", flowId, reported.size());
                return SubmissionResult.invalid(reported);
            }

            typed = new LinkedHashMap<>();
            for (FlowVariable variable : variables) {
                typed.put(variable.name(), coercer.coerce(variable, values.get(variable.name())));
            }
            typed = Collections.unmodifiableMap(typed);
            closed = false;
            dispatchGeneration = ++generation;
            transition(BinderState.EXECUTING);
        }

        log.info("Flow {}: dispatching execution with {} variable(s)", flowId, typed.size());
        CompletableFuture<ExecutionResult> pending;
        try {
            pending = executionClient.execute(flowId, typed);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        if (pending == null) {
            pending = CompletableFuture.failedFuture(new IllegalStateException("execution client returned no result"));
        }
        CompletableFuture<ExecutionResult> execution =
                pending.whenComplete((result, error) -> finish(dispatchGeneration, error));
        return SubmissionResult.dispatched(typed, execution);
    }

    /** Soft cancel: whatever is in flight keeps running but its outcome will be ignored. */
    public synchronized void close() {
        closed = true;
        generation++;
        errors.clear();
        if (state != BinderState.IDLE) {
            log.info("Flow {}: execution dialog closed in state {}", flowId, state);
        }
        state = BinderState.IDLE;
    }

    public synchronized BinderState getState() {
        return state;
    }

    public synchronized Map<String, String> getErrors() {
        return errorSnapshot();
    }

    public synchronized Map<String, Object> getValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public synchronized List<FlowVariable> getVariables() {
        return variables;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String getFlowId() {
        return flowId;
    }

    private synchronized void finish(long dispatchGeneration, Throwable error) {
        if (dispatchGeneration != generation) {
            log.warn("Flow {}: discarding result of a closed execution", flowId);
            return;
        }
        if (error != null) {
            log.error("Flow {}: execution failed", flowId, error);
            transition(BinderState.FAILED);
        } else {
            log.info("Flow {}: execution completed", flowId);
            transition(BinderState.COMPLETED);
        }
    }

    private void transition(BinderState next) {
        state = next;
        listener.onStateChange(flowId, next, errorSnapshot());
    }

    private Map<String, String> errorSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }
}
