package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.node.ConditionOperator;
import com.promptflow.promptflow_backend.model.node.ConditionalNodeData;
import com.promptflow.promptflow_backend.model.node.ForEachNodeData;
import com.promptflow.promptflow_backend.model.node.IterationMode;
import com.promptflow.promptflow_backend.model.node.NodeDataDefaults;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;
import com.promptflow.promptflow_backend.model.node.VariableNodeData;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class VariableSuggestionProvider implements SuggestionProvider {

    @Override
    public NodeType supportedType() {
        return NodeType.VARIABLE;
    }

    @Override
    public List<FlowSuggestion> suggest(FlowNode source, List<FlowNode> existingNodes) {
        VariableNodeData variable = source.dataAs(VariableNodeData.class).orElse(null);
        String name = variable != null && variable.name() != null && !variable.name().isEmpty() ? variable.name() : null;
        List<FlowSuggestion> suggestions = new ArrayList<>();

        if (variable != null && looksLikeCollection(variable)) {
            suggestions.add(new FlowSuggestion(NodeType.FOR_EACH,
                    "Iterate over each item in this list/array variable", 95, true,
                    new ForEachNodeData("Process Each " + (name != null ? name : "Item"),
                            NodeDataDefaults.defaultDescription(NodeType.FOR_EACH),
                            name != null ? name : "list", "item", IterationMode.SEQUENTIAL, List.of())));
        }

        String reference = name != null ? name : "input";
        PromptNodeData promptDefaults = (PromptNodeData) NodeDataDefaults.forType(NodeType.PROMPT);
        suggestions.add(new FlowSuggestion(NodeType.PROMPT,
                "Use this variable to personalize or parameterize a prompt", 95, true,
                new PromptNodeData("Dynamic Prompt", promptDefaults.description(),
                        "Please analyze the following: {{" + reference + "}}", promptDefaults.model(), null,
                        promptDefaults.parameters(), List.of(), null)));
        suggestions.add(new FlowSuggestion(NodeType.CONDITIONAL,
                "Apply conditional logic based on variable value", 80, false,
                new ConditionalNodeData("Check Variable", NodeDataDefaults.defaultDescription(NodeType.CONDITIONAL),
                        new ConditionalNodeData.Condition(reference, ConditionOperator.EXISTS, "true"))));
        return suggestions;
    }

    /** Name mentions list/array/items, or the default value is bracketed or has more than two comma-separated parts. */
    static boolean looksLikeCollection(VariableNodeData variable) {
        String name = variable.name() != null ? variable.name().toLowerCase(Locale.ROOT) : "";
        if (name.contains("list") || name.contains("array") || name.contains("items")) {
            return true;
        }
        String defaultValue = variable.defaultValue() != null ? variable.defaultValue() : "";
        if (defaultValue.startsWith("[") && defaultValue.endsWith("]")) {
            return true;
        }
        return defaultValue.contains(",") && defaultValue.split(",", -1).length > 2;
    }
}
