package com.promptflow.promptflow_backend.validation;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.node.OutputFormat;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;

import java.util.List;
import java.util.Set;

/**
 * Immutable rules consulted by {@link ConnectionValidator}. Advisory rules are matched in
 * list order, first match wins.
 */
public record ConnectionRuleSet(List<ConnectionRule> connectionRules, List<CompatibilityRule> compatibilityRules) {

    public static final Set<String> CONDITIONAL_HANDLES = Set.of("true", "false");

    public ConnectionRuleSet {
        connectionRules = connectionRules != null ? List.copyOf(connectionRules) : List.of();
        compatibilityRules = compatibilityRules != null ? List.copyOf(compatibilityRules) : List.of();
    }

    public static ConnectionRuleSet empty() {
        return new ConnectionRuleSet(List.of(), List.of());
    }

    /** The rules the editor ships with. */
    public static ConnectionRuleSet standard() {
        return new ConnectionRuleSet(standardConnectionRules(), standardCompatibilityRules());
    }

    private static List<ConnectionRule> standardConnectionRules() {
        return List.of(
                // Conditional rule goes first so it can shadow the generic prompt -> transform advice
                new ConnectionRule(NodeType.PROMPT, NodeType.TRANSFORM,
                        (source, target) -> expectsStructuredList(source),
                        "Split list into individual items for processing"),
                ConnectionRule.of(NodeType.PROMPT, NodeType.CONDITIONAL,
                        "Add conditional logic to branch based on prompt output"),
                ConnectionRule.of(NodeType.PROMPT, NodeType.TRANSFORM,
                        "Transform the prompt output format or extract specific data"),
                ConnectionRule.of(NodeType.PROMPT, NodeType.OUTPUT,
                        "Output the prompt result directly"),
                ConnectionRule.of(NodeType.VARIABLE, NodeType.PROMPT,
                        "Use variable as input to customize the prompt"),
                ConnectionRule.of(NodeType.TRANSFORM, NodeType.CONDITIONAL,
                        "Apply conditional logic to transformed data")
        );
    }

    private static List<CompatibilityRule> standardCompatibilityRules() {
        return List.of(
                new CompatibilityRule("output-has-no-outgoing-port",
                        candidate -> candidate.source().type() == NodeType.OUTPUT,
                        "Output nodes cannot feed other nodes",
                        "Connect from the node that produces the value instead"),
                new CompatibilityRule("variable-has-no-incoming-port",
                        candidate -> candidate.target().type() == NodeType.VARIABLE,
                        "Variable nodes do not accept incoming connections",
                        "Reference the variable with {{name}} in the downstream node"),
                new CompatibilityRule("conditional-branch-handle",
                        candidate -> candidate.source().type() == NodeType.CONDITIONAL
                                && candidate.sourceHandle() != null
                                && !CONDITIONAL_HANDLES.contains(candidate.sourceHandle()),
                        "Conditional nodes branch through the 'true' or 'false' handle",
                        null)
        );
    }

    private static boolean expectsStructuredList(FlowNode node) {
        return node.dataAs(PromptNodeData.class)
                .map(data -> data.expectedFormat() == OutputFormat.STRUCTURED_LIST)
                .orElse(false);
    }
}
