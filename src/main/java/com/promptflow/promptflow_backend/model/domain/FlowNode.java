package com.promptflow.promptflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.promptflow.promptflow_backend.model.node.NodeData;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * A vertex on the canvas. The JSON shape is {@code {id, type, position, data}} where
 * {@code type} is written from the payload variant and decides how {@code data} is read back.
 */
@Data
@NoArgsConstructor
public class FlowNode {

    private String id;

    private Position position = Position.origin();

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXTERNAL_PROPERTY, property = "type")
    private NodeData data;

    public FlowNode(String id, Position position, NodeData data) {
        this.id = id;
        this.position = position != null ? position : Position.origin();
        this.data = data;
    }

    // Not a bean getter on purpose: "type" is owned by the external type id of data.
    public NodeType type() {
        return data != null ? data.nodeType() : null;
    }

    public String label() {
        return data != null && data.label() != null && !data.label().isBlank() ? data.label() : id;
    }

    public <T extends NodeData> Optional<T> dataAs(Class<T> variant) {
        return variant.isInstance(data) ? Optional.of(variant.cast(data)) : Optional.empty();
    }

    public FlowNode copy() {
        return new FlowNode(id, position, data);
    }
}
