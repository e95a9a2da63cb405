package com.promptflow.promptflow_backend.variable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptflow.promptflow_backend.model.node.VariableDataType;

/** One rendered field of the execution dialog: the variable, its current value and any error. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableInput(
        String name,
        VariableDataType type,
        InputKind kind,
        Object value,
        boolean required,
        String description,
        String error
) {}
