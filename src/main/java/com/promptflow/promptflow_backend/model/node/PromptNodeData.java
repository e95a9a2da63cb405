package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prompt node. {@code content} may contain {{name}} placeholders; {@code variables}
 * lists the references the author declared explicitly.
 */
public record PromptNodeData(
        String label,
        String description,
        String content,
        String model,
        String systemMessage,
        PromptParameters parameters,
        List<VariableReference> variables,
        OutputFormat expectedFormat
) implements NodeData {

    public PromptNodeData {
        variables = variables != null ? Collections.unmodifiableList(new ArrayList<>(variables)) : List.of();
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PROMPT;
    }

    @Override
    public <R> R accept(NodeDataVisitor<R> visitor) {
        return visitor.visitPrompt(this);
    }

    public record PromptParameters(double temperature, int maxTokens, double topP) {

        public static PromptParameters defaults() {
            return new PromptParameters(0.7, 1000, 1.0);
        }
    }

    public record VariableReference(String name, String nodeId) {}
}
