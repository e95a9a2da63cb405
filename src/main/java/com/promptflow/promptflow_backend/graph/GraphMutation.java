package com.promptflow.promptflow_backend.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.validation.ConnectionResult;

/**
 * Result of a {@link FlowGraph} mutation.
 * <ul>
 *   <li>{@code APPLIED}: the graph changed; {@code node} / {@code edge} hold what was added or touched.</li>
 *   <li>{@code REJECTED}: structural error, the graph is unchanged and {@code message} says why.</li>
 *   <li>{@code INVALID_CONNECTION}: the connection validator refused the edge; see {@code connection}.</li>
 * </ul>
 * {@code connection} is also set on applied edge mutations so the advisory suggestion reaches the caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphMutation(
        Outcome outcome,
        String message,
        FlowNode node,
        FlowEdge edge,
        ConnectionResult connection
) {

    public enum Outcome { APPLIED, REJECTED, INVALID_CONNECTION }

    public static GraphMutation applied(FlowNode node) {
        return new GraphMutation(Outcome.APPLIED, null, node, null, null);
    }

    public static GraphMutation applied(FlowEdge edge, ConnectionResult connection) {
        return new GraphMutation(Outcome.APPLIED, null, null, edge, connection);
    }

    public static GraphMutation applied(FlowNode node, FlowEdge edge, ConnectionResult connection) {
        return new GraphMutation(Outcome.APPLIED, null, node, edge, connection);
    }

    public static GraphMutation rejected(String message) {
        return new GraphMutation(Outcome.REJECTED, message, null, null, null);
    }

    public static GraphMutation invalidConnection(ConnectionResult connection) {
        return new GraphMutation(Outcome.INVALID_CONNECTION, connection.message(), null, null, connection);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }
}
