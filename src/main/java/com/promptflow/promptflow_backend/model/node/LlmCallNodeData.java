package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LlmCallNodeData(
        String label,
        String description,
        String provider,
        String model,
        String prompt,
        Map<String, Object> parameters
) implements NodeData {

    public LlmCallNodeData {
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    @Override
    public NodeType nodeType() {
        return NodeType.LLM_CALL;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitLlmCall(this);
    }
}
