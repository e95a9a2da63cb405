package com.promptflow.promptflow_backend.variable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptflow.promptflow_backend.model.node.VariableDataType;

/** A value the flow needs before it can run. Derived on demand, never stored. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowVariable(
        String name,
        VariableDataType type,
        String defaultValue,
        boolean required,
        String description,
        VariableProvenance provenance
) {

    public boolean hasDefaultValue() {
        return defaultValue != null && !defaultValue.isEmpty();
    }
}
