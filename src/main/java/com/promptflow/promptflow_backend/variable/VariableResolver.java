package com.promptflow.promptflow_backend.variable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.PromptFlow;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;
import com.promptflow.promptflow_backend.model.node.VariableDataType;
import com.promptflow.promptflow_backend.model.node.VariableNodeData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the variables a flow needs, in this order: Variable nodes, then names Prompt nodes
 * declare, then any {{name}} placeholder found anywhere in the serialized flow.
 * The first occurrence of a name wins.
 */
@Slf4j
@RequiredArgsConstructor
public class VariableResolver {

    // Same placeholder shape the editor writes: {{name}}
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)}}");

    private final ObjectMapper objectMapper;

    public List<FlowVariable> resolve(PromptFlow flow) {
        Map<String, FlowVariable> found = new LinkedHashMap<>();

        for (FlowNode node : flow.getNodes()) {
            node.dataAs(VariableNodeData.class).ifPresent(variable -> {
                if (variable.name() == null || variable.name().isEmpty()) return;
                found.putIfAbsent(variable.name(), new FlowVariable(
                        variable.name(),
                        variable.effectiveType(),
                        variable.defaultValue(),
                        !variable.hasDefaultValue(),
                        variable.description(),
                        VariableProvenance.VARIABLE_NODE));
            });
        }

        for (FlowNode node : flow.getNodes()) {
            node.dataAs(PromptNodeData.class).ifPresent(prompt -> {
                for (PromptNodeData.VariableReference reference : prompt.variables()) {
                    if (reference == null || reference.name() == null || reference.name().isEmpty()) continue;
                    found.putIfAbsent(reference.name(), new FlowVariable(
                            reference.name(), VariableDataType.STRING, null, true,
                            "Variable referenced in " + node.label(),
                            VariableProvenance.PROMPT_REFERENCE));
                }
            });
        }

        List<String> placeholders = new ArrayList<>();
        collectPlaceholders(objectMapper.valueToTree(flow), placeholders);
        for (String name : placeholders) {
            found.putIfAbsent(name, new FlowVariable(
                    name, VariableDataType.STRING, null, true, "Template variable",
                    VariableProvenance.TEMPLATE_PLACEHOLDER));
        }

        log.debug("Flow {}: resolved {} variable(s)", flow.getId(), found.size());
        return List.copyOf(found.values());
    }

    /** Depth-first over the JSON tree in document order. */
    private void collectPlaceholders(JsonNode json, List<String> into) {
        if (json == null) return;
        if (json.isTextual()) {
            Matcher matcher = PLACEHOLDER.matcher(json.asText());
            while (matcher.find()) {
                String name = matcher.group(1).trim();
                if (!name.isEmpty()) {
                    into.add(name);
                }
            }
            return;
        }
        for (JsonNode child : json) {
            collectPlaceholders(child, into);
        }
    }
}
