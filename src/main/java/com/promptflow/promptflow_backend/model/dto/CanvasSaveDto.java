package com.promptflow.promptflow_backend.model.dto;

import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;

import java.util.List;

/**
 * Body of GET and POST /api/flows/{flowId}/canvas.
 * Null-safe: null lists are treated as empty.
 */
public record CanvasSaveDto(
    List<FlowNode> nodes,
    List<FlowEdge> edges
) {
    public List<FlowNode> nodes() {
        return nodes != null ? nodes : java.util.Collections.emptyList();
    }

    public List<FlowEdge> edges() {
        return edges != null ? edges : java.util.Collections.emptyList();
    }
}
