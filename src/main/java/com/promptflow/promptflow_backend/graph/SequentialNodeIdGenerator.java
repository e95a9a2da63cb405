package com.promptflow.promptflow_backend.graph;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Predictable ids ("prompt-1", "edge-a-b-2") for tests and reproducible demos.
 * A single counter is shared by nodes and edges.
 */
public class SequentialNodeIdGenerator implements NodeIdGenerator {

    private final AtomicLong counter = new AtomicLong();

    @Override
    public String nextNodeId(NodeType type) {
        return type.getValue() + "-" + counter.incrementAndGet();
    }

    @Override
    public String nextEdgeId(String sourceId, String targetId) {
        return "edge-" + sourceId + "-" + targetId + "-" + counter.incrementAndGet();
    }
}
