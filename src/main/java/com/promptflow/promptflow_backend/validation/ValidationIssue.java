package com.promptflow.promptflow_backend.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(String nodeId, String message, Type type) {

    public enum Type {
        // errors
        CONNECTION("connection"),
        DATA("data"),
        LOGIC("logic"),
        // warnings
        PERFORMANCE("performance"),
        BEST_PRACTICE("best_practice"),
        OPTIMIZATION("optimization");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
