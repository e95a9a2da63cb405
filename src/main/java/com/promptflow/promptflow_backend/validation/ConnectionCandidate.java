package com.promptflow.promptflow_backend.validation;

import com.promptflow.promptflow_backend.model.domain.FlowNode;

/** An edge the editor is trying to draw, before it exists in the graph. */
public record ConnectionCandidate(FlowNode source, FlowNode target, String sourceHandle, String targetHandle) {

    public static ConnectionCandidate of(FlowNode source, FlowNode target) {
        return new ConnectionCandidate(source, target, null, null);
    }
}
