package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.node.NodeDataDefaults;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;
import com.promptflow.promptflow_backend.model.node.TransformNodeData;
import com.promptflow.promptflow_backend.model.node.TransformType;

import java.util.ArrayList;
import java.util.List;

public class TransformSuggestionProvider implements SuggestionProvider {

    @Override
    public NodeType supportedType() {
        return NodeType.TRANSFORM;
    }

    @Override
    public List<FlowSuggestion> suggest(FlowNode source, List<FlowNode> existingNodes) {
        List<FlowSuggestion> suggestions = new ArrayList<>();

        if (source.dataAs(TransformNodeData.class).map(TransformSuggestionProvider::producesList).orElse(false)) {
            suggestions.add(new FlowSuggestion(NodeType.CONDITIONAL,
                    "Apply conditional logic to each transformed item", 85, true, null));
            PromptNodeData promptDefaults = (PromptNodeData) NodeDataDefaults.forType(NodeType.PROMPT);
            suggestions.add(new FlowSuggestion(NodeType.PROMPT,
                    "Process each item with a specialized prompt", 80, true,
                    new PromptNodeData("Process Item", promptDefaults.description(), "Analyze this item: {{item}}",
                            promptDefaults.model(), null, promptDefaults.parameters(), List.of(), null)));
        }

        suggestions.add(new FlowSuggestion(NodeType.OUTPUT, "Display the transformed results", 70, true, null));
        return suggestions;
    }

    static boolean producesList(TransformNodeData transform) {
        if (transform.transformType() == TransformType.SPLIT) return true;
        String code = transform.code();
        return code != null && (code.contains("split") || code.contains("map"));
    }
}
