package com.promptflow.promptflow_backend.variable;

/** Where the resolver first found a variable. */
public enum VariableProvenance {
    VARIABLE_NODE,
    PROMPT_REFERENCE,
    TEMPLATE_PLACEHOLDER
}
