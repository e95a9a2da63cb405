package com.promptflow.promptflow_backend.model.node;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransformType {
    FORMAT("format"),
    SPLIT("split"),
    FILTER("filter"),
    MAP("map"),
    CUSTOM("custom");

    private final String value;

    TransformType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
