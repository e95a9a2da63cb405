package com.promptflow.promptflow_backend.repository;

import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.PromptFlow;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Process-local store, lost on restart. Listing order is creation order. */
@Repository
public class InMemoryPromptFlowRepository implements PromptFlowRepository {

    private final Map<String, PromptFlow> flows = new LinkedHashMap<>();

    @Override
    public synchronized List<PromptFlow> findAll() {
        return flows.values().stream().map(InMemoryPromptFlowRepository::copyOf).toList();
    }

    @Override
    public synchronized Optional<PromptFlow> findById(String id) {
        return Optional.ofNullable(flows.get(id)).map(InMemoryPromptFlowRepository::copyOf);
    }

    @Override
    public synchronized boolean existsById(String id) {
        return flows.containsKey(id);
    }

    @Override
    public synchronized PromptFlow save(PromptFlow flow) {
        if (flow.getId() == null || flow.getId().isBlank()) {
            throw new IllegalArgumentException("flow id is required");
        }
        flows.put(flow.getId(), copyOf(flow));
        return copyOf(flow);
    }

    @Override
    public synchronized void deleteById(String id) {
        flows.remove(id);
    }

    private static PromptFlow copyOf(PromptFlow flow) {
        PromptFlow copy = new PromptFlow(flow.getId(), flow.getName());
        copy.setDescription(flow.getDescription());
        copy.setNodes(new ArrayList<>(flow.getNodes().stream().map(FlowNode::copy).toList()));
        copy.setEdges(new ArrayList<>(flow.getEdges().stream().map(FlowEdge::copy).toList()));
        copy.setUpdatedAt(flow.getUpdatedAt());
        return copy;
    }
}
