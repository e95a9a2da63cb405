package com.promptflow.promptflow_backend.variable;

import java.util.Map;

@FunctionalInterface
public interface BinderStateListener {

    BinderStateListener NOOP = (flowId, state, errors) -> { };

    void onStateChange(String flowId, BinderState state, Map<String, String> errors);
}
