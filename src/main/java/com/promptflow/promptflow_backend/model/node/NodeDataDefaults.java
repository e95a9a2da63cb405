package com.promptflow.promptflow_backend.model.node;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Payload a freshly dropped node starts with, per type.
 * Labels follow the palette convention: "Prompt Node", "A prompt node".
 */
public final class NodeDataDefaults {

    private NodeDataDefaults() {}

    public static NodeData forType(NodeType type) {
        if (type == null) {
            throw new IllegalArgumentException("node type is required");
        }
        String label = defaultLabel(type);
        String description = defaultDescription(type);
        return switch (type) {
            case PROMPT -> new PromptNodeData(label, description, "Enter your prompt here...", "gpt-3.5-turbo",
                    null, PromptNodeData.PromptParameters.defaults(), List.of(), null);
            case VARIABLE -> new VariableNodeData(label, description, "variable1", VariableDataType.STRING, "");
            case CONDITIONAL -> new ConditionalNodeData(label, description,
                    new ConditionalNodeData.Condition("", ConditionOperator.EQUALS, ""));
            case TRANSFORM -> new TransformNodeData(label, description, TransformType.FORMAT, null, Map.of());
            case OUTPUT -> new OutputNodeData(label, description, OutputFormat.TEXT, "{{result}}");
            case FOR_EACH -> new ForEachNodeData(label, description, "", "item", IterationMode.SEQUENTIAL, List.of());
            case TEMPLATE -> new TemplateNodeData(label, description, "template1", Map.of());
            case LLM_CALL -> new LlmCallNodeData(label, description, "openai", "gpt-3.5-turbo",
                    "Your prompt here...", Map.of());
        };
    }

    /** Same payload under a different label. */
    public static NodeData relabel(NodeData data, String label) {
        return data.accept(new NodeDataVisitor<NodeData>() {
            @Override
            public NodeData visitPrompt(PromptNodeData d) {
                return new PromptNodeData(label, d.description(), d.content(), d.model(), d.systemMessage(),
                        d.parameters(), d.variables(), d.expectedFormat());
            }

            @Override
            public NodeData visitVariable(VariableNodeData d) {
                return new VariableNodeData(label, d.description(), d.name(), d.type(), d.defaultValue());
            }

            @Override
            public NodeData visitConditional(ConditionalNodeData d) {
                return new ConditionalNodeData(label, d.description(), d.condition());
            }

            @Override
            public NodeData visitTransform(TransformNodeData d) {
                return new TransformNodeData(label, d.description(), d.transformType(), d.code(), d.parameters());
            }

            @Override
            public NodeData visitOutput(OutputNodeData d) {
                return new OutputNodeData(label, d.description(), d.format(), d.template());
            }

            @Override
            public NodeData visitForEach(ForEachNodeData d) {
                return new ForEachNodeData(label, d.description(), d.sourceVariable(), d.itemVariable(),
                        d.iterationMode(), d.itemProperties());
            }

            @Override
            public NodeData visitTemplate(TemplateNodeData d) {
                return new TemplateNodeData(label, d.description(), d.templateId(), d.variables());
            }

            @Override
            public NodeData visitLlmCall(LlmCallNodeData d) {
                return new LlmCallNodeData(label, d.description(), d.provider(), d.model(), d.prompt(), d.parameters());
            }
        });
    }

    public static String defaultLabel(NodeType type) {
        return type.getDisplayName() + " Node";
    }

    public static String defaultDescription(NodeType type) {
        return "A " + type.getDisplayName().toLowerCase(Locale.ROOT) + " node";
    }
}
