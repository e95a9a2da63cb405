package com.promptflow.promptflow_backend.model.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Save/load unit of the editor: {@code {id, name, nodes[], edges[], updatedAt}}.
 */
@Data
@NoArgsConstructor
public class PromptFlow {

    private String id;

    private String name;

    private String description;

    private List<FlowNode> nodes = new ArrayList<>();

    private List<FlowEdge> edges = new ArrayList<>();

    private Instant updatedAt = Instant.now();

    public PromptFlow(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public List<FlowNode> getNodes() {
        return nodes != null ? nodes : List.of();
    }

    public List<FlowEdge> getEdges() {
        return edges != null ? edges : List.of();
    }
}
