package com.promptflow.promptflow_backend.validation;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.function.BiPredicate;

/**
 * Advisory pattern for a (source type, target type) pair. {@code condition} is optional;
 * when present the rule only applies if it holds for the concrete nodes.
 */
public record ConnectionRule(
        NodeType sourceType,
        NodeType targetType,
        BiPredicate<FlowNode, FlowNode> condition,
        String suggestion
) {

    public static ConnectionRule of(NodeType sourceType, NodeType targetType, String suggestion) {
        return new ConnectionRule(sourceType, targetType, null, suggestion);
    }

    public boolean matches(FlowNode source, FlowNode target) {
        return sourceType == source.type()
                && targetType == target.type()
                && (condition == null || condition.test(source, target));
    }
}
