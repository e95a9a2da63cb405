package com.promptflow.promptflow_backend.variable;

public enum BinderState {
    IDLE,
    VALIDATING,
    INVALID,     // transient: reported with errors, then back to IDLE
    EXECUTING,
    COMPLETED,
    FAILED
}
