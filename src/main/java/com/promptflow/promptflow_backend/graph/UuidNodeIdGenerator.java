package com.promptflow.promptflow_backend.graph;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.UUID;

public class UuidNodeIdGenerator implements NodeIdGenerator {

    @Override
    public String nextNodeId(NodeType type) {
        return type.getValue() + "-" + UUID.randomUUID();
    }

    @Override
    public String nextEdgeId(String sourceId, String targetId) {
        return "edge-" + UUID.randomUUID();
    }
}
