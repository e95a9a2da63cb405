package com.promptflow.promptflow_backend.model.node;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IterationMode {
    SEQUENTIAL("sequential"),  // ordered, later items may use earlier results
    PARALLEL("parallel");      // independent items, reassembled by index

    private final String value;

    IterationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
