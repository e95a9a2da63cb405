package com.promptflow.promptflow_backend.model.node;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.promptflow.promptflow_backend.model.domain.NodeType;

public record VariableNodeData(
        String label,
        String description,
        String name,
        VariableDataType type,
        @JsonDeserialize(using = JsonTextDeserializer.class) String defaultValue
) implements NodeData {

    @Override
    public NodeType nodeType() {
        return NodeType.VARIABLE;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    /** Declared type, STRING when the editor left it unset. */
    public VariableDataType effectiveType() {
        return type != null ? type : VariableDataType.STRING;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null && !defaultValue.isEmpty();
    }
}
