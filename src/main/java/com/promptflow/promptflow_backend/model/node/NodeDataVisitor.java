package com.promptflow.promptflow_backend.model.node;

public interface NodeDataVisitor<R> {

    R visitPrompt(PromptNodeData data);

    R visitVariable(VariableNodeData data);

    R visitConditional(ConditionalNodeData data);

    R visitTransform(TransformNodeData data);

    R visitOutput(OutputNodeData data);

    R visitForEach(ForEachNodeData data);

    R visitTemplate(TemplateNodeData data);

    R visitLlmCall(LlmCallNodeData data);
}
