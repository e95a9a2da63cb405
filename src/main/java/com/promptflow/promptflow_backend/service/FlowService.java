package com.promptflow.promptflow_backend.service;

import com.promptflow.promptflow_backend.engine.FlowExecutionClient;
import com.promptflow.promptflow_backend.graph.FlowGraph;
import com.promptflow.promptflow_backend.graph.GraphMutation;
import com.promptflow.promptflow_backend.graph.NodeIdGenerator;
import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.domain.PromptFlow;
import com.promptflow.promptflow_backend.model.dto.ExecutionView;
import com.promptflow.promptflow_backend.repository.PromptFlowRepository;
import com.promptflow.promptflow_backend.suggestion.FlowSuggestion;
import com.promptflow.promptflow_backend.suggestion.SuggestionEngine;
import com.promptflow.promptflow_backend.validation.ConnectionValidator;
import com.promptflow.promptflow_backend.validation.FlowValidationResult;
import com.promptflow.promptflow_backend.validation.FlowValidator;
import com.promptflow.promptflow_backend.variable.BinderStateListener;
import com.promptflow.promptflow_backend.variable.ExecutionVariableBinder;
import com.promptflow.promptflow_backend.variable.FlowVariable;
import com.promptflow.promptflow_backend.variable.SubmissionResult;
import com.promptflow.promptflow_backend.variable.VariableCoercer;
import com.promptflow.promptflow_backend.variable.VariableResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Application service behind the REST layer. Keeps one live {@link FlowGraph} and one
 * {@link ExecutionVariableBinder} per flow and writes every applied mutation through to the repository.
 * All lookups return empty when the flow (or node) does not exist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowService {

    private final PromptFlowRepository flowRepository;
    private final ConnectionValidator connectionValidator;
    private final NodeIdGenerator idGenerator;
    private final SuggestionEngine suggestionEngine;
    private final VariableResolver variableResolver;
    private final VariableCoercer variableCoercer;
    private final FlowValidator flowValidator;
    private final FlowExecutionClient executionClient;
    private final BinderStateListener binderStateListener;

    private final Map<String, FlowGraph> graphs = new ConcurrentHashMap<>();
    private final Map<String, ExecutionVariableBinder> binders = new ConcurrentHashMap<>();

    // ── Flows ─────────────────────────────────────────────────────────────────

    public List<PromptFlow> listFlows() {
        return flowRepository.findAll().stream()
                .map(flow -> Optional.ofNullable(graphs.get(flow.getId())).map(FlowGraph::toPromptFlow).orElse(flow))
                .toList();
    }

    public PromptFlow createFlow(String name, String description) {
        PromptFlow flow = new PromptFlow(UUID.randomUUID().toString(), name.trim());
        flow.setDescription(description);
        PromptFlow saved = flowRepository.save(flow);
        log.info("Created flow {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    public Optional<PromptFlow> getFlow(String flowId) {
        return graph(flowId).map(FlowGraph::toPromptFlow);
    }

    public Optional<PromptFlow> updateFlow(String flowId, String name, String description) {
        return graph(flowId).map(graph -> {
            graph.updateDetails(name.trim(), description);
            return persist(graph);
        });
    }

    public boolean deleteFlow(String flowId) {
        if (!flowRepository.existsById(flowId)) {
            return false;
        }
        ExecutionVariableBinder binder = binders.remove(flowId);
        if (binder != null) {
            binder.close();
        }
        graphs.remove(flowId);
        flowRepository.deleteById(flowId);
        log.info("Deleted flow {}", flowId);
        return true;
    }

    // ── Canvas ────────────────────────────────────────────────────────────────

    public Optional<FlowGraph> graph(String flowId) {
        if (flowId == null) return Optional.empty();
        return Optional.ofNullable(graphs.computeIfAbsent(flowId, id -> flowRepository.findById(id)
                .map(flow -> FlowGraph.fromPromptFlow(flow, connectionValidator, idGenerator))
                .orElse(null)));
    }

    public Optional<FlowNode> findNode(String flowId, String nodeId) {
        return graph(flowId).flatMap(graph -> graph.findNode(nodeId));
    }

    public Optional<GraphMutation> saveCanvas(String flowId, List<FlowNode> nodes, List<FlowEdge> edges) {
        return mutate(flowId, graph -> graph.replaceContents(nodes, edges));
    }

    /** Runs a mutation against the flow's graph and saves the flow when it applied. */
    public Optional<GraphMutation> mutate(String flowId, Function<FlowGraph, GraphMutation> mutation) {
        return graph(flowId).map(graph -> {
            GraphMutation result = mutation.apply(graph);
            if (result.isApplied()) {
                persist(graph);
            }
            return result;
        });
    }

    // ── Suggestions & validation ──────────────────────────────────────────────

    public Optional<List<FlowSuggestion>> suggestions(String flowId, String nodeId) {
        return graph(flowId).flatMap(graph -> graph.findNode(nodeId)
                .map(node -> suggestionEngine.suggestNextNodes(node, graph.getNodes())));
    }

    /**
     * Recomputes the node's suggestions and applies the first one proposing {@code nodeType}.
     * Rejected when no current suggestion matches.
     */
    public Optional<GraphMutation> applySuggestion(String flowId, String nodeId, NodeType nodeType) {
        return mutate(flowId, graph -> graph.findNode(nodeId)
                .map(node -> suggestionEngine.suggestNextNodes(node, graph.getNodes()).stream()
                        .filter(suggestion -> suggestion.nodeType() == nodeType)
                        .findFirst()
                        .map(suggestion -> graph.applySuggestion(nodeId, suggestion))
                        .orElseGet(() -> GraphMutation.rejected("no " + (nodeType != null ? nodeType.getValue() : "null")
                                + " suggestion for node " + nodeId)))
                .orElseGet(() -> GraphMutation.rejected("unknown node: " + nodeId)));
    }

    public Optional<List<FlowSuggestion>> completionSuggestions(String flowId) {
        return graph(flowId).map(graph -> suggestionEngine.suggestFlowCompletion(graph.getNodes(), graph.getEdges()));
    }

    public Optional<FlowValidationResult> validate(String flowId) {
        return getFlow(flowId).map(flowValidator::validate);
    }

    public Optional<List<FlowVariable>> variables(String flowId) {
        return getFlow(flowId).map(variableResolver::resolve);
    }

    // ── Execution ─────────────────────────────────────────────────────────────

    /** The flow's binder, created on first use and refreshed against the current variables. */
    public Optional<ExecutionVariableBinder> binder(String flowId) {
        // Atomic per flow: concurrent first requests share one binder
        return variables(flowId).map(variables -> binders.compute(flowId, (id, existing) -> {
            if (existing != null && !existing.isClosed()) {
                existing.refresh(variables);
                return existing;
            }
            return new ExecutionVariableBinder(id, variables, executionClient, variableCoercer, binderStateListener);
        }));
    }

    public Optional<ExecutionView> executionView(String flowId) {
        return binder(flowId).map(FlowService::toView);
    }

    /** Returns the names the flow does not use; those values are ignored. */
    public Optional<List<String>> setValues(String flowId, Map<String, Object> values) {
        return binder(flowId).map(binder -> {
            List<String> unknown = new ArrayList<>();
            values.forEach((name, value) -> {
                if (!binder.setValue(name, value)) {
                    unknown.add(name);
                }
            });
            return unknown;
        });
    }

    public Optional<ExecutionSubmission> submit(String flowId) {
        Optional<PromptFlow> flow = getFlow(flowId);
        if (flow.isEmpty()) {
            return Optional.empty();
        }
        FlowValidationResult validation = flowValidator.validate(flow.get());
        if (!validation.valid()) {
            log.warn("Flow {}: not executed, {} structural error(s)", flowId, validation.errors().size());
            return Optional.of(new ExecutionSubmission(validation, null));
        }
        return binder(flowId).map(binder -> {
            SubmissionResult result = binder.submit();
            return new ExecutionSubmission(validation, result);
        });
    }

    public boolean closeExecution(String flowId) {
        ExecutionVariableBinder binder = binders.remove(flowId);
        if (binder == null) {
            return flowRepository.existsById(flowId);
        }
        binder.close();
        return true;
    }

    private PromptFlow persist(FlowGraph graph) {
        return flowRepository.save(graph.toPromptFlow());
    }

    static ExecutionView toView(ExecutionVariableBinder binder) {
        return new ExecutionView(binder.getState(), binder.inputs(), binder.getErrors());
    }
}
