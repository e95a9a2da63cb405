package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

public record OutputNodeData(
        String label,
        String description,
        OutputFormat format,
        String template
) implements NodeData {

    @Override
    public NodeType nodeType() {
        return NodeType.OUTPUT;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitOutput(this);
    }
}
