package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

public record ConditionalNodeData(
        String label,
        String description,
        Condition condition
) implements NodeData {

    @Override
    public NodeType nodeType() {
        return NodeType.CONDITIONAL;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    public record Condition(String leftOperand, ConditionOperator operator, String rightOperand) {}
}
