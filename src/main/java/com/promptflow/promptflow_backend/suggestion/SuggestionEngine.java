package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ranks follow-on nodes for the editor's context menu.
 * Suggestions are sorted by priority, highest first; ties keep the order the provider emitted them.
 */
@Slf4j
public class SuggestionEngine {

    public static final int DEFAULT_LIMIT = 5;
    static final int COMPLETION_PRIORITY = 60;

    private final SuggestionRuleSet ruleSet;
    private final int limit;

    public SuggestionEngine(SuggestionRuleSet ruleSet, int limit) {
        this.ruleSet = ruleSet;
        this.limit = limit > 0 ? limit : DEFAULT_LIMIT;
    }

    public SuggestionEngine(SuggestionRuleSet ruleSet) {
        this(ruleSet, DEFAULT_LIMIT);
    }

    public List<FlowSuggestion> suggestNextNodes(FlowNode source, List<FlowNode> existingNodes) {
        if (source == null || source.type() == null) {
            return List.of();
        }
        List<FlowSuggestion> suggestions = ruleSet.providerFor(source.type())
                .map(provider -> provider.suggest(source, existingNodes != null ? existingNodes : List.of()))
                .orElse(List.of());
        List<FlowSuggestion> ranked = suggestions.stream()
                .sorted(Comparator.comparingInt(FlowSuggestion::priority).reversed())
                .limit(limit)
                .toList();
        log.debug("{} suggestion(s) for {} node {}", ranked.size(), source.type().getValue(), source.getId());
        return ranked;
    }

    /** One Output suggestion per node that feeds nothing and is not itself an Output node. */
    public List<FlowSuggestion> suggestFlowCompletion(List<FlowNode> nodes, List<FlowEdge> edges) {
        Set<String> sources = new HashSet<>();
        for (FlowEdge edge : edges) {
            sources.add(edge.getSource());
        }
        return nodes.stream()
                .filter(node -> node.type() != NodeType.OUTPUT)
                .filter(node -> !sources.contains(node.getId()))
                .map(node -> new FlowSuggestion(NodeType.OUTPUT,
                        "Complete the flow by outputting results from " + node.label(),
                        COMPLETION_PRIORITY, true, null))
                .toList();
    }
}
