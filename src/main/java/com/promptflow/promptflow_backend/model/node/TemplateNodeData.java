package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TemplateNodeData(
        String label,
        String description,
        String templateId,
        Map<String, Object> variables
) implements NodeData {

    public TemplateNodeData {
        variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TEMPLATE;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitTemplate(this);
    }
}
