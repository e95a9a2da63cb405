package com.promptflow.promptflow_backend.graph;

import com.promptflow.promptflow_backend.model.domain.NodeType;

/** Source of ids for nodes and edges created by the graph itself. */
public interface NodeIdGenerator {

    String nextNodeId(NodeType type);

    String nextEdgeId(String sourceId, String targetId);
}
