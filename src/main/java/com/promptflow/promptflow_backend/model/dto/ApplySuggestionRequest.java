package com.promptflow.promptflow_backend.model.dto;

import com.promptflow.promptflow_backend.model.domain.NodeType;

/** Picks one of the node's current suggestions by the type of node it proposes. */
public record ApplySuggestionRequest(NodeType nodeType) {}
