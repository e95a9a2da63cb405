package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.node.NodeDataDefaults;

import java.util.List;

/** Branch targets. None auto-connect: the author picks the true or false handle. */
public class ConditionalSuggestionProvider implements SuggestionProvider {

    @Override
    public NodeType supportedType() {
        return NodeType.CONDITIONAL;
    }

    @Override
    public List<FlowSuggestion> suggest(FlowNode source, List<FlowNode> existingNodes) {
        return List.of(
                branch(NodeType.PROMPT, "Create different prompts for each conditional branch", 85, "Branch-Specific Prompt"),
                branch(NodeType.TRANSFORM, "Apply different transformations based on condition results", 80, "Conditional Transform"),
                branch(NodeType.OUTPUT, "Output different results for each condition", 75, "Conditional Output")
        );
    }

    private static FlowSuggestion branch(NodeType type, String reason, int priority, String label) {
        return new FlowSuggestion(type, reason, priority, false,
                NodeDataDefaults.relabel(NodeDataDefaults.forType(type), label));
    }
}
