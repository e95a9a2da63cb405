package com.promptflow.promptflow_backend.model.node;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionOperator {
    EQUALS("equals"),
    CONTAINS("contains"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    EXISTS("exists");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
