package com.promptflow.promptflow_backend.graph;

import com.promptflow.promptflow_backend.model.domain.FlowEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Breadth-first reachability over an edge list. */
public final class GraphReachability {

    private GraphReachability() {}

    public static boolean canReach(Collection<FlowEdge> edges, String fromId, String toId) {
        if (fromId == null || toId == null) return false;
        if (fromId.equals(toId)) return true;
        return reachableFrom(edges, fromId).contains(toId);
    }

    /** Every node id reachable from {@code startId}, excluding the start itself unless it lies on a cycle. */
    public static Set<String> reachableFrom(Collection<FlowEdge> edges, String startId) {
        Map<String, List<String>> adjacency = adjacency(edges);
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    static Map<String, List<String>> adjacency(Collection<FlowEdge> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (FlowEdge edge : edges) {
            if (edge.getSource() == null || edge.getTarget() == null) continue;
            adjacency.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
        }
        return adjacency;
    }
}
