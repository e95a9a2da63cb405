package com.promptflow.promptflow_backend.model.node;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VariableDataType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    JSON("json");

    private final String value;

    VariableDataType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
