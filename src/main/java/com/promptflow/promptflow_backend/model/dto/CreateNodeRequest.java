package com.promptflow.promptflow_backend.model.dto;

import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.domain.Position;

/** Palette drop: a node of {@code type} at {@code position}, starting from the type's defaults. */
public record CreateNodeRequest(NodeType type, Position position) {}
