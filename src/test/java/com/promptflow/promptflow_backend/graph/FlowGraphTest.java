package com.promptflow.promptflow_backend.graph;

import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.domain.Position;
import com.promptflow.promptflow_backend.model.domain.PromptFlow;
import com.promptflow.promptflow_backend.model.node.ForEachNodeData;
import com.promptflow.promptflow_backend.model.node.IterationMode;
import com.promptflow.promptflow_backend.model.node.NodeDataDefaults;
import com.promptflow.promptflow_backend.model.node.OutputNodeData;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;
import com.promptflow.promptflow_backend.model.node.VariableDataType;
import com.promptflow.promptflow_backend.model.node.VariableNodeData;
import com.promptflow.promptflow_backend.suggestion.FlowSuggestion;
import com.promptflow.promptflow_backend.validation.ConnectionRuleSet;
import com.promptflow.promptflow_backend.validation.ConnectionValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.promptflow.promptflow_backend.FlowFixtures.edge;
import static com.promptflow.promptflow_backend.FlowFixtures.output;
import static com.promptflow.promptflow_backend.FlowFixtures.prompt;
import static com.promptflow.promptflow_backend.FlowFixtures.variable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphTest {

    private FlowGraph graph;

    @BeforeEach
    void setUp() {
        graph = new FlowGraph("flow-1", "Test flow",
                new ConnectionValidator(ConnectionRuleSet.standard()), new SequentialNodeIdGenerator());
    }

    @Test
    void addNode_duplicateId_shouldBeRejectedAndLeaveGraphUnchanged() {
        graph.addNode(prompt("p1", "Write a haiku"));

        GraphMutation result = graph.addNode(output("p1", "{{result}}"));

        assertThat(result.outcome()).isEqualTo(GraphMutation.Outcome.REJECTED);
        assertThat(result.message()).contains("p1");
        assertThat(graph.getNodes()).hasSize(1);
        assertThat(graph.getNodes().get(0).type()).isEqualTo(NodeType.PROMPT);
    }

    @Test
    void addNode_withoutData_shouldBeRejected() {
        GraphMutation result = graph.addNode(new FlowNode("n1", Position.origin(), null));

        assertThat(result.isApplied()).isFalse();
        assertThat(graph.getNodes()).isEmpty();
    }

    @Test
    void createNode_shouldUseGeneratedIdAndTypeDefaults() {
        GraphMutation result = graph.createNode(NodeType.OUTPUT, new Position(40, 80));

        assertThat(result.isApplied()).isTrue();
        FlowNode node = result.node();
        assertThat(node.getId()).isEqualTo("output-1");
        assertThat(node.getPosition()).isEqualTo(new Position(40, 80));
        assertThat(node.getData()).isEqualTo(NodeDataDefaults.forType(NodeType.OUTPUT));
        assertThat(node.label()).isEqualTo("Output Node");
    }

    @Test
    void createNode_multiWordType_shouldUseDisplayNameInLabel() {
        FlowNode forEach = graph.createNode(NodeType.FOR_EACH, new Position(0, 0)).node();
        FlowNode llmCall = graph.createNode(NodeType.LLM_CALL, new Position(0, 100)).node();

        assertThat(forEach.label()).isEqualTo("For Each Node");
        assertThat(forEach.getData().description()).isEqualTo("A for each node");
        assertThat(llmCall.label()).isEqualTo("LLM Call Node");
    }

    @Test
    void removeNode_shouldCascadeToTouchingEdges() {
        graph.addNode(variable("v1", "topic", VariableDataType.STRING, ""));
        graph.addNode(prompt("p1", "Write about {{topic}}"));
        graph.addNode(output("o1", "{{result}}"));
        graph.addEdge("v1", "p1");
        graph.addEdge("p1", "o1");

        GraphMutation result = graph.removeNode("p1");

        assertThat(result.isApplied()).isTrue();
        assertThat(result.node().getId()).isEqualTo("p1");
        assertThat(result.node().getData()).isEqualTo(prompt("p1", "Write about {{topic}}").getData());
        assertThat(graph.getNodes()).extracting(FlowNode::getId).containsExactly("v1", "o1");
        assertThat(graph.getEdges()).isEmpty();
    }

    @Test
    void removeNode_unknownId_shouldBeRejected() {
        assertThat(graph.removeNode("missing").outcome()).isEqualTo(GraphMutation.Outcome.REJECTED);
    }

    @Test
    void addEdge_selfLoop_shouldBeInvalidAndNotAdded() {
        graph.addNode(prompt("p1", "Summarize"));

        GraphMutation result = graph.addEdge("p1", "p1");

        assertThat(result.outcome()).isEqualTo(GraphMutation.Outcome.INVALID_CONNECTION);
        assertThat(result.connection().valid()).isFalse();
        assertThat(result.connection().message()).isEqualTo(ConnectionValidator.SELF_LOOP_MESSAGE);
        assertThat(graph.getEdges()).isEmpty();
    }

    @Test
    void addEdge_closingThreeNodeCycle_shouldBeInvalid() {
        graph.addNode(prompt("a", "one"));
        graph.addNode(prompt("b", "two"));
        graph.addNode(prompt("c", "three"));
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");

        GraphMutation result = graph.addEdge("c", "a");

        assertThat(result.outcome()).isEqualTo(GraphMutation.Outcome.INVALID_CONNECTION);
        assertThat(result.connection().message()).isEqualTo(ConnectionValidator.CYCLE_MESSAGE);
        assertThat(graph.getEdges()).hasSize(2);
    }

    @Test
    void addEdge_unknownEndpoint_shouldBeRejected() {
        graph.addNode(prompt("p1", "Summarize"));

        GraphMutation result = graph.addEdge("p1", "ghost");

        assertThat(result.outcome()).isEqualTo(GraphMutation.Outcome.REJECTED);
        assertThat(graph.getEdges()).isEmpty();
    }

    @Test
    void addEdge_valid_shouldCarryAdvisorySuggestion() {
        graph.addNode(prompt("p1", "Summarize"));
        graph.addNode(output("o1", "{{result}}"));

        GraphMutation result = graph.addEdge("p1", "o1");

        assertThat(result.isApplied()).isTrue();
        assertThat(result.edge().getSource()).isEqualTo("p1");
        assertThat(result.edge().getTarget()).isEqualTo("o1");
        assertThat(result.connection().suggestion()).isEqualTo("Output the prompt result directly");
    }

    @Test
    void removeEdge_shouldDropOnlyThatEdge() {
        graph.addNode(prompt("p1", "Summarize"));
        graph.addNode(output("o1", "{{result}}"));
        graph.addNode(output("o2", "{{result}}"));
        String first = graph.addEdge("p1", "o1").edge().getId();
        graph.addEdge("p1", "o2");

        GraphMutation removed = graph.removeEdge(first);
        assertThat(removed.isApplied()).isTrue();
        assertThat(removed.edge().getTarget()).isEqualTo("o1");
        assertThat(graph.getEdges()).extracting(FlowEdge::getTarget).containsExactly("o2");
        assertThat(graph.removeEdge(first).isApplied()).isFalse();
    }

    @Test
    void updateNodeData_ofOtherType_shouldBeRejected() {
        graph.addNode(prompt("p1", "Summarize"));

        GraphMutation result = graph.updateNodeData("p1", new OutputNodeData("Out", null, null, "{{x}}"));

        assertThat(result.outcome()).isEqualTo(GraphMutation.Outcome.REJECTED);
        assertThat(graph.findNode("p1").orElseThrow().type()).isEqualTo(NodeType.PROMPT);
    }

    @Test
    void updateNodeData_sameType_shouldReplacePayload() {
        graph.addNode(variable("v1", "topic", VariableDataType.STRING, ""));

        graph.updateNodeData("v1", new VariableNodeData("Topic", null, "subject", VariableDataType.STRING, "cats"));

        VariableNodeData data = graph.findNode("v1").orElseThrow().dataAs(VariableNodeData.class).orElseThrow();
        assertThat(data.name()).isEqualTo("subject");
        assertThat(data.defaultValue()).isEqualTo("cats");
    }

    @Test
    void applySuggestion_autoConnect_shouldPlaceNodeRightOfSourceAndConnect() {
        FlowNode source = prompt("p1", "Give me a numbered list of ideas");
        source.setPosition(new Position(100, 200));
        graph.addNode(source);
        FlowSuggestion suggestion = new FlowSuggestion(NodeType.FOR_EACH, "Iterate", 95, true,
                new ForEachNodeData("Process Each Item", null, "result", "item", IterationMode.SEQUENTIAL, List.of()));

        GraphMutation result = graph.applySuggestion("p1", suggestion);

        assertThat(result.isApplied()).isTrue();
        assertThat(result.node().getPosition()).isEqualTo(new Position(350, 200));
        assertThat(result.node().label()).isEqualTo("Process Each Item");
        assertThat(result.edge().getSource()).isEqualTo("p1");
        assertThat(result.edge().getTarget()).isEqualTo(result.node().getId());
        assertThat(graph.getEdges()).hasSize(1);
    }

    @Test
    void applySuggestion_withoutAutoConnect_shouldOnlyAddNode() {
        graph.addNode(prompt("p1", "Summarize"));

        GraphMutation result = graph.applySuggestion("p1",
                new FlowSuggestion(NodeType.CONDITIONAL, "Branch", 85, false, null));

        assertThat(result.isApplied()).isTrue();
        assertThat(result.edge()).isNull();
        assertThat(result.node().getData()).isEqualTo(NodeDataDefaults.forType(NodeType.CONDITIONAL));
        assertThat(graph.getNodes()).hasSize(2);
        assertThat(graph.getEdges()).isEmpty();
    }

    @Test
    void applySuggestion_fromOutputNode_shouldKeepNodeButReportRefusedConnection() {
        graph.addNode(output("o1", "{{result}}"));

        GraphMutation result = graph.applySuggestion("o1",
                new FlowSuggestion(NodeType.PROMPT, "Follow up", 50, true, null));

        assertThat(result.isApplied()).isTrue();
        assertThat(result.edge()).isNull();
        assertThat(result.connection().valid()).isFalse();
        assertThat(graph.getNodes()).hasSize(2);
    }

    @Test
    void replaceContents_withDanglingEdge_shouldBeRejectedAndKeepOldCanvas() {
        graph.addNode(prompt("p1", "Summarize"));

        GraphMutation result = graph.replaceContents(
                List.of(prompt("a", "x"), output("b", "y")),
                List.of(edge("e1", "a", "missing")));

        assertThat(result.outcome()).isEqualTo(GraphMutation.Outcome.REJECTED);
        assertThat(graph.getNodes()).extracting(FlowNode::getId).containsExactly("p1");
    }

    @Test
    void returnedNodes_shouldBeCopies() {
        graph.addNode(prompt("p1", "Summarize"));

        graph.getNodes().get(0).setPosition(new Position(999, 999));

        assertThat(graph.findNode("p1").orElseThrow().getPosition()).isEqualTo(new Position(0, 0));
    }

    @Test
    void fromPromptFlow_shouldRestoreNodesEdgesAndMetadata() {
        graph.addNode(prompt("p1", "Summarize {{text}}"));
        graph.addNode(output("o1", "{{result}}"));
        graph.addEdge("p1", "o1");
        graph.updateDetails("Renamed", "A description");
        PromptFlow saved = graph.toPromptFlow();

        FlowGraph restored = FlowGraph.fromPromptFlow(saved,
                new ConnectionValidator(ConnectionRuleSet.standard()), new SequentialNodeIdGenerator());

        assertThat(restored.toPromptFlow()).isEqualTo(saved);
        assertThat(restored.findNode("p1").orElseThrow().dataAs(PromptNodeData.class).orElseThrow().content())
                .isEqualTo("Summarize {{text}}");
    }

    @Test
    void fromPromptFlow_withDuplicateNodeIds_shouldThrow() {
        PromptFlow broken = new PromptFlow("f", "Broken");
        broken.setNodes(List.of(prompt("p1", "a"), prompt("p1", "b")));

        assertThatThrownBy(() -> FlowGraph.fromPromptFlow(broken,
                new ConnectionValidator(ConnectionRuleSet.standard()), new SequentialNodeIdGenerator()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("p1");
    }
}
