package com.promptflow.promptflow_backend.graph;

import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.domain.Position;
import com.promptflow.promptflow_backend.model.domain.PromptFlow;
import com.promptflow.promptflow_backend.model.node.NodeData;
import com.promptflow.promptflow_backend.model.node.NodeDataDefaults;
import com.promptflow.promptflow_backend.suggestion.FlowSuggestion;
import com.promptflow.promptflow_backend.validation.ConnectionCandidate;
import com.promptflow.promptflow_backend.validation.ConnectionResult;
import com.promptflow.promptflow_backend.validation.ConnectionValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory canvas of one flow. Owns the node and edge collections and keeps them consistent:
 * node ids are unique, every edge points at existing nodes, and removing a node removes its edges.
 *
 * Every mutation either applies completely or leaves the graph untouched. Callers get copies,
 * never the stored instances.
 */
@Slf4j
public class FlowGraph {

    // Where a node added from a suggestion lands relative to its source
    static final double SUGGESTED_NODE_OFFSET_X = 250;

    private final String flowId;
    private final ConnectionValidator connectionValidator;
    private final NodeIdGenerator idGenerator;

    private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
    private final List<FlowEdge> edges = new ArrayList<>();

    private String name;
    private String description;
    private Instant updatedAt = Instant.now();

    public FlowGraph(String flowId, String name, ConnectionValidator connectionValidator, NodeIdGenerator idGenerator) {
        this.flowId = flowId;
        this.name = name;
        this.connectionValidator = connectionValidator;
        this.idGenerator = idGenerator;
    }

    /** Rebuilds a graph from its saved form. Throws when the saved form breaks a structural invariant. */
    public static FlowGraph fromPromptFlow(PromptFlow flow, ConnectionValidator connectionValidator, NodeIdGenerator idGenerator) {
        FlowGraph graph = new FlowGraph(flow.getId(), flow.getName(), connectionValidator, idGenerator);
        graph.description = flow.getDescription();
        GraphMutation loaded = graph.replaceContents(flow.getNodes(), flow.getEdges());
        if (!loaded.isApplied()) {
            throw new IllegalArgumentException("Flow " + flow.getId() + " cannot be loaded: " + loaded.message());
        }
        if (flow.getUpdatedAt() != null) {
            graph.updatedAt = flow.getUpdatedAt();
        }
        return graph;
    }

    // ── Nodes ─────────────────────────────────────────────────────────────────

    public synchronized GraphMutation addNode(FlowNode node) {
        if (node == null || node.getId() == null || node.getId().isBlank()) {
            return reject("node id is required");
        }
        if (node.getData() == null) {
            return reject("node " + node.getId() + " has no data");
        }
        if (nodes.containsKey(node.getId())) {
            return reject("node id already exists: " + node.getId());
        }
        FlowNode stored = node.copy();
        nodes.put(stored.getId(), stored);
        touch();
        log.info("Flow {}: added {} node {}", flowId, stored.type().getValue(), stored.getId());
        return GraphMutation.applied(stored.copy());
    }

    /** Drops a new node of {@code type} with the palette defaults. */
    public synchronized GraphMutation createNode(NodeType type, Position position) {
        if (type == null) {
            return reject("node type is required");
        }
        return addNode(new FlowNode(freshNodeId(type), position, NodeDataDefaults.forType(type)));
    }

    /** Property-panel edit. The node keeps its type, so the new payload must be of the same variant. */
    public synchronized GraphMutation updateNodeData(String nodeId, NodeData data) {
        FlowNode node = nodes.get(nodeId);
        if (node == null) {
            return reject("unknown node: " + nodeId);
        }
        if (data == null) {
            return reject("node " + nodeId + " has no data");
        }
        if (data.nodeType() != node.type()) {
            return reject("node " + nodeId + " is a " + node.type().getValue()
                    + " node and cannot take " + data.nodeType().getValue() + " data");
        }
        node.setData(data);
        touch();
        return GraphMutation.applied(node.copy());
    }

    public synchronized GraphMutation moveNode(String nodeId, Position position) {
        FlowNode node = nodes.get(nodeId);
        if (node == null) {
            return reject("unknown node: " + nodeId);
        }
        node.setPosition(position != null ? position : Position.origin());
        touch();
        return GraphMutation.applied(node.copy());
    }

    public synchronized GraphMutation removeNode(String nodeId) {
        FlowNode removed = nodes.remove(nodeId);
        if (removed == null) {
            return reject("unknown node: " + nodeId);
        }
        int before = edges.size();
        edges.removeIf(edge -> edge.touches(nodeId));
        touch();
        log.info("Flow {}: removed node {} and {} connected edge(s)", flowId, nodeId, before - edges.size());
        return GraphMutation.applied(removed.copy());
    }

    // ── Edges ─────────────────────────────────────────────────────────────────

    public synchronized GraphMutation addEdge(String sourceId, String targetId, String sourceHandle, String targetHandle) {
        FlowNode source = nodes.get(sourceId);
        FlowNode target = nodes.get(targetId);
        if (source == null || target == null) {
            return reject("unknown node: " + (source == null ? sourceId : targetId));
        }
        ConnectionResult result = connectionValidator.validate(
                new ConnectionCandidate(source, target, blankToNull(sourceHandle), blankToNull(targetHandle)), edges);
        if (!result.valid()) {
            log.info("Flow {}: connection {} -> {} refused: {}", flowId, sourceId, targetId, result.message());
            return GraphMutation.invalidConnection(result);
        }
        FlowEdge edge = new FlowEdge(freshEdgeId(sourceId, targetId), sourceId, targetId,
                blankToNull(sourceHandle), blankToNull(targetHandle));
        edges.add(edge);
        touch();
        log.info("Flow {}: connected {} -> {} as {}", flowId, sourceId, targetId, edge.getId());
        return GraphMutation.applied(edge.copy(), result);
    }

    public GraphMutation addEdge(String sourceId, String targetId) {
        return addEdge(sourceId, targetId, null, null);
    }

    public synchronized GraphMutation removeEdge(String edgeId) {
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i).getId().equals(edgeId)) {
                FlowEdge removed = edges.remove(i);
                touch();
                return GraphMutation.applied(removed.copy(), null);
            }
        }
        return reject("unknown edge: " + edgeId);
    }

    /** Dry run of {@link #addEdge}; empty when either endpoint does not exist. */
    public synchronized Optional<ConnectionResult> validateConnection(String sourceId, String targetId,
                                                                      String sourceHandle, String targetHandle) {
        FlowNode source = nodes.get(sourceId);
        FlowNode target = nodes.get(targetId);
        if (source == null || target == null) {
            return Optional.empty();
        }
        return Optional.of(connectionValidator.validate(
                new ConnectionCandidate(source, target, blankToNull(sourceHandle), blankToNull(targetHandle)), edges));
    }

    // ── Suggestions ───────────────────────────────────────────────────────────

    /**
     * Adds the node a suggestion describes next to {@code sourceId} and, when the suggestion asks
     * for it, connects the two. A refused auto-connection keeps the new node; the refusal is
     * reported through {@link GraphMutation#connection()}.
     */
    public synchronized GraphMutation applySuggestion(String sourceId, FlowSuggestion suggestion) {
        FlowNode source = nodes.get(sourceId);
        if (source == null) {
            return reject("unknown node: " + sourceId);
        }
        NodeType type = suggestion.nodeType();
        NodeData data = suggestion.defaultConfig() != null ? suggestion.defaultConfig() : NodeDataDefaults.forType(type);
        FlowNode node = new FlowNode(freshNodeId(type), source.getPosition().offset(SUGGESTED_NODE_OFFSET_X, 0), data);
        nodes.put(node.getId(), node);
        touch();

        if (!suggestion.autoConnect()) {
            log.info("Flow {}: added suggested {} node {} next to {}", flowId, type.getValue(), node.getId(), sourceId);
            return GraphMutation.applied(node.copy());
        }

        ConnectionResult result = connectionValidator.validate(ConnectionCandidate.of(source, node), edges);
        if (!result.valid()) {
            log.warn("Flow {}: suggested node {} added but not connected: {}", flowId, node.getId(), result.message());
            return GraphMutation.applied(node.copy(), null, result);
        }
        FlowEdge edge = new FlowEdge(freshEdgeId(sourceId, node.getId()), sourceId, node.getId(), null, null);
        edges.add(edge);
        log.info("Flow {}: added suggested {} node {} connected from {}", flowId, type.getValue(), node.getId(), sourceId);
        return GraphMutation.applied(node.copy(), edge.copy(), result);
    }

    // ── Bulk ──────────────────────────────────────────────────────────────────

    /**
     * Swaps the whole canvas, as the editor does on save. Only structural invariants are checked:
     * a saved canvas may contain edges the connection rules would refuse today.
     */
    public synchronized GraphMutation replaceContents(List<FlowNode> newNodes, List<FlowEdge> newEdges) {
        Map<String, FlowNode> staged = new LinkedHashMap<>();
        for (FlowNode node : newNodes != null ? newNodes : List.<FlowNode>of()) {
            if (node == null || node.getId() == null || node.getId().isBlank()) {
                return reject("node id is required");
            }
            if (node.getData() == null) {
                return reject("node " + node.getId() + " has no data");
            }
            if (staged.put(node.getId(), node.copy()) != null) {
                return reject("node id already exists: " + node.getId());
            }
        }
        List<FlowEdge> stagedEdges = new ArrayList<>();
        Set<String> edgeIds = new HashSet<>();
        for (FlowEdge edge : newEdges != null ? newEdges : List.<FlowEdge>of()) {
            if (edge == null || !staged.containsKey(edge.getSource()) || !staged.containsKey(edge.getTarget())) {
                return reject("edge " + (edge != null ? edge.getId() : null) + " references a missing node");
            }
            FlowEdge copy = edge.copy();
            if (copy.getId() == null || copy.getId().isBlank()) {
                copy.setId(idGenerator.nextEdgeId(copy.getSource(), copy.getTarget()));
            }
            if (!edgeIds.add(copy.getId())) {
                return reject("edge id already exists: " + copy.getId());
            }
            stagedEdges.add(copy);
        }
        nodes.clear();
        nodes.putAll(staged);
        edges.clear();
        edges.addAll(stagedEdges);
        touch();
        log.info("Flow {}: canvas replaced with {} node(s) and {} edge(s)", flowId, nodes.size(), edges.size());
        return GraphMutation.applied(null, null, null);
    }

    public synchronized void updateDetails(String name, String description) {
        this.name = name;
        this.description = description;
        touch();
    }

    // ── Views ─────────────────────────────────────────────────────────────────

    public synchronized PromptFlow toPromptFlow() {
        PromptFlow flow = new PromptFlow(flowId, name);
        flow.setDescription(description);
        flow.setNodes(getNodes());
        flow.setEdges(getEdges());
        flow.setUpdatedAt(updatedAt);
        return flow;
    }

    public synchronized List<FlowNode> getNodes() {
        return nodes.values().stream().map(FlowNode::copy).toList();
    }

    public synchronized List<FlowEdge> getEdges() {
        return edges.stream().map(FlowEdge::copy).toList();
    }

    public synchronized Optional<FlowNode> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId)).map(FlowNode::copy);
    }

    public String getFlowId() {
        return flowId;
    }

    public synchronized String getName() {
        return name;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private String freshNodeId(NodeType type) {
        String id = idGenerator.nextNodeId(type);
        while (nodes.containsKey(id)) {
            id = idGenerator.nextNodeId(type);
        }
        return id;
    }

    private String freshEdgeId(String sourceId, String targetId) {
        String id = idGenerator.nextEdgeId(sourceId, targetId);
        while (hasEdge(id)) {
            id = idGenerator.nextEdgeId(sourceId, targetId);
        }
        return id;
    }

    private boolean hasEdge(String edgeId) {
        return edges.stream().anyMatch(edge -> edge.getId().equals(edgeId));
    }

    private GraphMutation reject(String message) {
        log.warn("Flow {}: mutation rejected: {}", flowId, message);
        return GraphMutation.rejected(message);
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    private static String blankToNull(String value) {
        return value != null && !value.isBlank() ? value.trim() : null;
    }
}
