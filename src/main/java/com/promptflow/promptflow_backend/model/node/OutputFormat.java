package com.promptflow.promptflow_backend.model.node;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output shape of an Output node, or the shape a Prompt node is expected to produce.
 * STRUCTURED_LIST only makes sense as a Prompt expectation.
 */
public enum OutputFormat {
    TEXT("text"),
    JSON("json"),
    MARKDOWN("markdown"),
    STRUCTURED_LIST("structured_list");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
