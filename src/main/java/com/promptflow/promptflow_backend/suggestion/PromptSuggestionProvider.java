package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.node.ConditionOperator;
import com.promptflow.promptflow_backend.model.node.ConditionalNodeData;
import com.promptflow.promptflow_backend.model.node.ForEachNodeData;
import com.promptflow.promptflow_backend.model.node.IterationMode;
import com.promptflow.promptflow_backend.model.node.NodeDataDefaults;
import com.promptflow.promptflow_backend.model.node.OutputFormat;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;
import com.promptflow.promptflow_backend.model.node.TransformNodeData;
import com.promptflow.promptflow_backend.model.node.TransformType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class PromptSuggestionProvider implements SuggestionProvider {

    private static final List<String> LIST_KEYWORDS = List.of("list", "items", "bullet", "numbered");
    private static final List<String> ANALYSIS_KEYWORDS = List.of("analyze", "sentiment", "classify", "categorize");

    static final String SPLIT_LIST_CODE = """
            // Split list output into individual items
            const items = input.split('\\n').filter(item => item.trim());
            return items.map(item => ({ value: item.trim(), index: items.indexOf(item) }));""";

    @Override
    public NodeType supportedType() {
        return NodeType.PROMPT;
    }

    @Override
    public List<FlowSuggestion> suggest(FlowNode source, List<FlowNode> existingNodes) {
        PromptNodeData prompt = source.dataAs(PromptNodeData.class).orElse(null);
        String content = prompt != null && prompt.content() != null ? prompt.content().toLowerCase(Locale.ROOT) : "";
        List<FlowSuggestion> suggestions = new ArrayList<>();

        if (containsAny(content, LIST_KEYWORDS)
                || (prompt != null && prompt.expectedFormat() == OutputFormat.STRUCTURED_LIST)) {
            suggestions.add(new FlowSuggestion(NodeType.FOR_EACH,
                    "Iterate over each item in the generated list", 95, true,
                    new ForEachNodeData("Process Each Item", NodeDataDefaults.defaultDescription(NodeType.FOR_EACH),
                            "result", "item", IterationMode.SEQUENTIAL, List.of())));
            suggestions.add(new FlowSuggestion(NodeType.TRANSFORM,
                    "Parse and split the list output into individual items", 90, true,
                    new TransformNodeData("Split List", NodeDataDefaults.defaultDescription(NodeType.TRANSFORM),
                            TransformType.CUSTOM, SPLIT_LIST_CODE, Map.of())));
            suggestions.add(new FlowSuggestion(NodeType.CONDITIONAL,
                    "Apply conditional logic to each list item", 85, false,
                    new ConditionalNodeData("Filter List Items", NodeDataDefaults.defaultDescription(NodeType.CONDITIONAL),
                            new ConditionalNodeData.Condition("item.length", ConditionOperator.GREATER_THAN, "0"))));
        }

        if (containsAny(content, ANALYSIS_KEYWORDS)) {
            suggestions.add(new FlowSuggestion(NodeType.CONDITIONAL,
                    "Branch based on analysis results (positive/negative, categories, etc.)", 80, true, null));
        }

        suggestions.add(new FlowSuggestion(NodeType.OUTPUT,
                "Format and display the prompt results", 70, true,
                NodeDataDefaults.relabel(NodeDataDefaults.forType(NodeType.OUTPUT), "Display Results")));
        return suggestions;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
