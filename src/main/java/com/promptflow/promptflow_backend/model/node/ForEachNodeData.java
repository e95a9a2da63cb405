package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loop over the collection held in {@code sourceVariable}, exposing each element as {@code itemVariable}.
 */
public record ForEachNodeData(
        String label,
        String description,
        String sourceVariable,
        String itemVariable,
        IterationMode iterationMode,
        List<String> itemProperties
) implements NodeData {

    public ForEachNodeData {
        itemProperties = itemProperties != null ? Collections.unmodifiableList(new ArrayList<>(itemProperties)) : List.of();
    }

    @Override
    public NodeType nodeType() {
        return NodeType.FOR_EACH;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitForEach(this);
    }

    public IterationMode effectiveMode() {
        return iterationMode != null ? iterationMode : IterationMode.SEQUENTIAL;
    }
}
