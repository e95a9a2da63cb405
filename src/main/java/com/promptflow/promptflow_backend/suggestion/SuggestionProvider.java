package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.List;

/** Follow-on suggestions for one source node type. Order of the returned list breaks priority ties. */
public interface SuggestionProvider {

    NodeType supportedType();

    List<FlowSuggestion> suggest(FlowNode source, List<FlowNode> existingNodes);
}
