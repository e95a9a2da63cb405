package com.promptflow.promptflow_backend.model.dto;

import com.promptflow.promptflow_backend.variable.BinderState;
import com.promptflow.promptflow_backend.variable.VariableInput;

import java.util.List;
import java.util.Map;

/** What the execution dialog shows: binder state, one input per variable, and field errors. */
public record ExecutionView(BinderState state, List<VariableInput> inputs, Map<String, String> errors) {}
