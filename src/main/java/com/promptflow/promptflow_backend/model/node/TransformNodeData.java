package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TransformNodeData(
        String label,
        String description,
        TransformType transformType,
        String code,               // only used by CUSTOM
        Map<String, Object> parameters
) implements NodeData {

    public TransformNodeData {
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TRANSFORM;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitTransform(this);
    }
}
