package com.promptflow.promptflow_backend.suggestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.node.NodeData;

/**
 * A proposed follow-on node. {@code defaultConfig}, when present, is a payload of {@code nodeType}
 * that replaces the palette default for the new node.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowSuggestion(
        NodeType nodeType,
        String reason,
        int priority,
        boolean autoConnect,
        NodeData defaultConfig
) {

    public FlowSuggestion {
        if (nodeType == null) {
            throw new IllegalArgumentException("nodeType is required");
        }
        if (defaultConfig != null && defaultConfig.nodeType() != nodeType) {
            throw new IllegalArgumentException(
                    "default config of type " + defaultConfig.nodeType().getValue() + " does not match " + nodeType.getValue());
        }
    }
}
