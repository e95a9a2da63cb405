package com.promptflow.promptflow_backend.model.node;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.promptflow.promptflow_backend.model.domain.NodeType;

/**
 * Payload of a {@link com.promptflow.promptflow_backend.model.domain.FlowNode}, one variant per node type.
 *
 * The type discriminant lives on the owning node ("type" next to "data" in the canvas JSON),
 * so the subtype names below must match {@link NodeType#getValue()}.
 */
@JsonSubTypes({
        @JsonSubTypes.Type(value = PromptNodeData.class, name = "prompt"),
        @JsonSubTypes.Type(value = VariableNodeData.class, name = "variable"),
        @JsonSubTypes.Type(value = ConditionalNodeData.class, name = "conditional"),
        @JsonSubTypes.Type(value = TransformNodeData.class, name = "transform"),
        @JsonSubTypes.Type(value = OutputNodeData.class, name = "output"),
        @JsonSubTypes.Type(value = ForEachNodeData.class, name = "for_each"),
        @JsonSubTypes.Type(value = TemplateNodeData.class, name = "template"),
        @JsonSubTypes.Type(value = LlmCallNodeData.class, name = "llm_call")
})
public sealed interface NodeData
        permits PromptNodeData, VariableNodeData, ConditionalNodeData, TransformNodeData,
                OutputNodeData, ForEachNodeData, TemplateNodeData, LlmCallNodeData {

    NodeType nodeType();

    String label();

    String description();

    <R> R accept(NodeDataVisitor<R> visitor);
}
