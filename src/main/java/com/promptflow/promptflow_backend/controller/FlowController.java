package com.promptflow.promptflow_backend.controller;

import com.promptflow.promptflow_backend.graph.FlowGraph;
import com.promptflow.promptflow_backend.graph.GraphMutation;
import com.promptflow.promptflow_backend.model.domain.PromptFlow;
import com.promptflow.promptflow_backend.model.dto.ApplySuggestionRequest;
import com.promptflow.promptflow_backend.model.dto.CanvasSaveDto;
import com.promptflow.promptflow_backend.model.dto.ConnectionRequest;
import com.promptflow.promptflow_backend.model.dto.CreateNodeRequest;
import com.promptflow.promptflow_backend.model.dto.FlowDetailsRequest;
import com.promptflow.promptflow_backend.model.dto.UpdateNodeRequest;
import com.promptflow.promptflow_backend.service.FlowService;
import com.promptflow.promptflow_backend.suggestion.FlowSuggestion;
import com.promptflow.promptflow_backend.validation.ConnectionResult;
import com.promptflow.promptflow_backend.validation.FlowValidationResult;
import com.promptflow.promptflow_backend.variable.FlowVariable;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/flows")
@RequiredArgsConstructor
public class FlowController {

    private final FlowService flowService;

    @GetMapping
    public List<PromptFlow> getAllFlows() {
        return flowService.listFlows();
    }

    @PostMapping
    public ResponseEntity<PromptFlow> createFlow(@RequestBody FlowDetailsRequest body) {
        if (body == null || body.name() == null || body.name().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(flowService.createFlow(body.name(), body.description()));
    }

    @GetMapping("/{flowId}")
    public ResponseEntity<PromptFlow> getFlow(@PathVariable String flowId) {
        return flowService.getFlow(flowId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{flowId}")
    public ResponseEntity<PromptFlow> updateFlow(@PathVariable String flowId, @RequestBody FlowDetailsRequest body) {
        if (body == null || body.name() == null || body.name().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return flowService.updateFlow(flowId, body.name(), body.description())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{flowId}")
    public ResponseEntity<Void> deleteFlow(@PathVariable String flowId) {
        return flowService.deleteFlow(flowId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // ── Canvas ────────────────────────────────────────────────────────────────

    @GetMapping("/{flowId}/canvas")
    public ResponseEntity<CanvasSaveDto> getCanvas(@PathVariable String flowId) {
        return flowService.graph(flowId)
                .map(graph -> new CanvasSaveDto(graph.getNodes(), graph.getEdges()))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // Save the entire canvas in one shot; the editor sends all nodes + edges together
    @PostMapping("/{flowId}/canvas")
    public ResponseEntity<?> saveCanvas(@PathVariable String flowId, @RequestBody CanvasSaveDto dto) {
        return flowService.saveCanvas(flowId, dto.nodes(), dto.edges())
                .<ResponseEntity<?>>map(result -> result.isApplied()
                        ? ResponseEntity.ok().build()
                        : structuralError(result))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{flowId}/nodes")
    public ResponseEntity<?> createNode(@PathVariable String flowId, @RequestBody CreateNodeRequest body) {
        return flowService.mutate(flowId, graph -> graph.createNode(body.type(), body.position()))
                .<ResponseEntity<?>>map(result -> result.isApplied()
                        ? ResponseEntity.status(HttpStatus.CREATED).body(result.node())
                        : structuralError(result))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{flowId}/nodes/{nodeId}")
    public ResponseEntity<?> updateNode(@PathVariable String flowId,
                                        @PathVariable String nodeId,
                                        @RequestBody UpdateNodeRequest body) {
        if (flowService.findNode(flowId, nodeId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        GraphMutation result = flowService.mutate(flowId, graph -> applyNodeUpdate(graph, nodeId, body))
                .orElseThrow();
        return result.isApplied() ? ResponseEntity.ok(result.node()) : structuralError(result);
    }

    private static GraphMutation applyNodeUpdate(FlowGraph graph, String nodeId, UpdateNodeRequest body) {
        GraphMutation result = null;
        if (body.getData() != null) {
            result = graph.updateNodeData(nodeId, body.getData());
            if (!result.isApplied()) return result;
        }
        if (body.getPosition() != null) {
            result = graph.moveNode(nodeId, body.getPosition());
        }
        return result != null ? result : GraphMutation.rejected("nothing to update on node " + nodeId);
    }

    @DeleteMapping("/{flowId}/nodes/{nodeId}")
    public ResponseEntity<Void> deleteNode(@PathVariable String flowId, @PathVariable String nodeId) {
        return flowService.mutate(flowId, graph -> graph.removeNode(nodeId))
                .filter(GraphMutation::isApplied)
                .map(result -> ResponseEntity.noContent().<Void>build())
                .orElse(ResponseEntity.notFound().build());
    }

    // ── Edges ─────────────────────────────────────────────────────────────────

    @PostMapping("/{flowId}/edges")
    public ResponseEntity<?> createEdge(@PathVariable String flowId, @RequestBody ConnectionRequest body) {
        return flowService.mutate(flowId,
                        graph -> graph.addEdge(body.source(), body.target(), body.sourceHandle(), body.targetHandle()))
                .<ResponseEntity<?>>map(result -> switch (result.outcome()) {
                    case APPLIED -> ResponseEntity.status(HttpStatus.CREATED).body(result);
                    case INVALID_CONNECTION -> ResponseEntity.unprocessableEntity().body(result.connection());
                    case REJECTED -> structuralError(result);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{flowId}/edges/{edgeId}")
    public ResponseEntity<Void> deleteEdge(@PathVariable String flowId, @PathVariable String edgeId) {
        return flowService.mutate(flowId, graph -> graph.removeEdge(edgeId))
                .filter(GraphMutation::isApplied)
                .map(result -> ResponseEntity.noContent().<Void>build())
                .orElse(ResponseEntity.notFound().build());
    }

    // Dry run for the editor while the user drags a connection
    @PostMapping("/{flowId}/connections/validate")
    public ResponseEntity<ConnectionResult> validateConnection(@PathVariable String flowId,
                                                               @RequestBody ConnectionRequest body) {
        return flowService.graph(flowId)
                .flatMap(graph -> graph.validateConnection(body.source(), body.target(), body.sourceHandle(), body.targetHandle()))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // ── Suggestions ───────────────────────────────────────────────────────────

    @GetMapping("/{flowId}/nodes/{nodeId}/suggestions")
    public ResponseEntity<List<FlowSuggestion>> getSuggestions(@PathVariable String flowId, @PathVariable String nodeId) {
        return flowService.suggestions(flowId, nodeId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{flowId}/nodes/{nodeId}/suggestions/apply")
    public ResponseEntity<?> applySuggestion(@PathVariable String flowId,
                                             @PathVariable String nodeId,
                                             @RequestBody ApplySuggestionRequest body) {
        if (flowService.findNode(flowId, nodeId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        GraphMutation result = flowService.applySuggestion(flowId, nodeId, body.nodeType()).orElseThrow();
        return result.isApplied()
                ? ResponseEntity.status(HttpStatus.CREATED).body(result)
                : structuralError(result);
    }

    @GetMapping("/{flowId}/suggestions/completion")
    public ResponseEntity<List<FlowSuggestion>> getCompletionSuggestions(@PathVariable String flowId) {
        return flowService.completionSuggestions(flowId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // ── Analysis ──────────────────────────────────────────────────────────────

    @GetMapping("/{flowId}/validation")
    public ResponseEntity<FlowValidationResult> validateFlow(@PathVariable String flowId) {
        return flowService.validate(flowId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{flowId}/variables")
    public ResponseEntity<List<FlowVariable>> getVariables(@PathVariable String flowId) {
        return flowService.variables(flowId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private static ResponseEntity<Map<String, String>> structuralError(GraphMutation result) {
        return ResponseEntity.badRequest().body(Map.of("error", result.message()));
    }
}
