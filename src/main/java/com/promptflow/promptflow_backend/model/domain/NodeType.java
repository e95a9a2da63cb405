package com.promptflow.promptflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeType {
    PROMPT("prompt", "Prompt"),
    VARIABLE("variable", "Variable"),
    CONDITIONAL("conditional", "Conditional"),
    TRANSFORM("transform", "Transform"),
    OUTPUT("output", "Output"),
    FOR_EACH("for_each", "For Each"),
    TEMPLATE("template", "Template"),
    LLM_CALL("llm_call", "LLM Call");

    private final String value;
    private final String displayName;

    NodeType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    // Wire name used in the canvas JSON ("for_each", "llm_call", ...)
    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Accepts the wire name or the enum constant name, case-insensitive. Returns null when unknown. */
    public static NodeType fromValue(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String trimmed = raw.trim();
        for (NodeType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
