package com.promptflow.promptflow_backend.variable;

import com.promptflow.promptflow_backend.model.node.VariableDataType;

/** Widget the execution dialog renders for a variable. */
public enum InputKind {
    TEXT,
    NUMBER,
    SWITCH,
    JSON_TEXT;

    public static InputKind forType(VariableDataType type) {
        if (type == null) return TEXT;
        return switch (type) {
            case STRING -> TEXT;
            case NUMBER -> NUMBER;
            case BOOLEAN -> SWITCH;
            case JSON -> JSON_TEXT;
        };
    }
}
