package com.promptflow.promptflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.promptflow.promptflow_backend.model.domain.Position;
import com.promptflow.promptflow_backend.model.node.NodeData;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Property-panel edit, shaped like a canvas node: {@code {type, data}} replaces the payload,
 * {@code position} moves the node. Either part may be omitted.
 */
@Data
@NoArgsConstructor
public class UpdateNodeRequest {

    private Position position;

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXTERNAL_PROPERTY, property = "type")
    private NodeData data;
}
