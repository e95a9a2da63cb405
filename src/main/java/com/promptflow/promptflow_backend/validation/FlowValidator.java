package com.promptflow.promptflow_backend.validation;

import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.domain.PromptFlow;
import com.promptflow.promptflow_backend.model.node.ForEachNodeData;
import com.promptflow.promptflow_backend.model.node.IterationMode;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;
import com.promptflow.promptflow_backend.model.node.VariableNodeData;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whole-flow check run before execution and on demand from the editor.
 *
 * Errors: dangling edges, duplicate node ids, cycles, and node payloads missing what they need to run.
 * Warnings: disconnected nodes, no Output node, parallel ForEach without item properties.
 */
@Slf4j
public class FlowValidator {

    public FlowValidationResult validate(PromptFlow flow) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        Map<String, FlowNode> byId = new LinkedHashMap<>();
        for (FlowNode node : flow.getNodes()) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                errors.add(error(node.getId(), "Duplicate node id '" + node.getId() + "'", ValidationIssue.Type.DATA));
            }
        }

        List<FlowEdge> usableEdges = new ArrayList<>();
        for (FlowEdge edge : flow.getEdges()) {
            boolean sourceKnown = byId.containsKey(edge.getSource());
            boolean targetKnown = byId.containsKey(edge.getTarget());
            if (!sourceKnown || !targetKnown) {
                String missing = !sourceKnown ? edge.getSource() : edge.getTarget();
                errors.add(error(null, "Edge '" + edge.getId() + "' references missing node '" + missing + "'",
                        ValidationIssue.Type.CONNECTION));
            } else {
                usableEdges.add(edge);
            }
        }

        List<String> cyclic = unorderableNodes(byId.keySet(), usableEdges);
        if (!cyclic.isEmpty()) {
            errors.add(error(cyclic.get(0), "Flow contains a circular dependency involving " + String.join(", ", cyclic),
                    ValidationIssue.Type.LOGIC));
        }

        Set<String> connected = new HashSet<>();
        for (FlowEdge edge : usableEdges) {
            connected.add(edge.getSource());
            connected.add(edge.getTarget());
        }

        boolean hasOutput = false;
        for (FlowNode node : byId.values()) {
            checkNodeData(node, errors, warnings);
            if (node.type() == NodeType.OUTPUT) {
                hasOutput = true;
            }
            if (byId.size() > 1 && !connected.contains(node.getId())) {
                warnings.add(warning(node.getId(), "Node '" + node.label() + "' is not connected to the flow",
                        ValidationIssue.Type.BEST_PRACTICE));
            }
        }
        if (!byId.isEmpty() && !hasOutput) {
            warnings.add(warning(null, "Flow has no Output node, results will not be displayed",
                    ValidationIssue.Type.BEST_PRACTICE));
        }

        FlowValidationResult result = FlowValidationResult.of(errors, warnings);
        log.debug("Flow {} validated: {} error(s), {} warning(s)", flow.getId(), errors.size(), warnings.size());
        return result;
    }

    private void checkNodeData(FlowNode node, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        if (node.getData() == null) {
            errors.add(error(node.getId(), "Node '" + node.getId() + "' has no data", ValidationIssue.Type.DATA));
            return;
        }
        switch (node.type()) {
            case PROMPT -> {
                PromptNodeData prompt = (PromptNodeData) node.getData();
                if (isBlank(prompt.content())) {
                    errors.add(error(node.getId(), "Prompt node '" + node.label() + "' has no content",
                            ValidationIssue.Type.DATA));
                }
            }
            case VARIABLE -> {
                VariableNodeData variable = (VariableNodeData) node.getData();
                if (isBlank(variable.name())) {
                    errors.add(error(node.getId(), "Variable node '" + node.label() + "' has no name",
                            ValidationIssue.Type.DATA));
                }
            }
            case FOR_EACH -> {
                ForEachNodeData forEach = (ForEachNodeData) node.getData();
                if (isBlank(forEach.sourceVariable())) {
                    errors.add(error(node.getId(), "For Each node '" + node.label() + "' has no source variable",
                            ValidationIssue.Type.DATA));
                }
                if (forEach.effectiveMode() == IterationMode.PARALLEL && forEach.itemProperties().isEmpty()) {
                    warnings.add(warning(node.getId(), "Parallel For Each node '" + node.label()
                            + "' declares no item properties", ValidationIssue.Type.OPTIMIZATION));
                }
            }
            default -> {
                // no required fields
            }
        }
    }

    /** Kahn's algorithm: whatever cannot be peeled off in topological order sits on, or behind, a cycle. */
    static List<String> unorderableNodes(Set<String> nodeIds, List<FlowEdge> edges) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> outgoing = new HashMap<>();
        for (String id : nodeIds) {
            inDegree.put(id, 0);
        }
        for (FlowEdge edge : edges) {
            outgoing.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
            inDegree.merge(edge.getTarget(), 1, Integer::sum);
        }
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        while (!ready.isEmpty()) {
            String id = ready.poll();
            inDegree.remove(id);
            for (String next : outgoing.getOrDefault(id, List.of())) {
                Integer degree = inDegree.computeIfPresent(next, (k, d) -> d - 1);
                if (degree != null && degree == 0) {
                    ready.add(next);
                }
            }
        }
        return new ArrayList<>(inDegree.keySet());
    }

    private static ValidationIssue error(String nodeId, String message, ValidationIssue.Type type) {
        return new ValidationIssue(nodeId, message, type);
    }

    private static ValidationIssue warning(String nodeId, String message, ValidationIssue.Type type) {
        return new ValidationIssue(nodeId, message, type);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
