package com.promptflow.promptflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowEdge {

    private String id;

    private String source;

    private String target;

    // Handle ids are only set for nodes with more than one port, e.g. "true" / "false" on a conditional
    private String sourceHandle;

    private String targetHandle;

    public boolean touches(String nodeId) {
        return nodeId.equals(source) || nodeId.equals(target);
    }

    public FlowEdge copy() {
        return new FlowEdge(id, source, target, sourceHandle, targetHandle);
    }
}
