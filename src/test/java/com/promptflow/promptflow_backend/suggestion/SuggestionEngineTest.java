package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.FlowNode;
import com.promptflow.promptflow_backend.model.domain.NodeType;
import com.promptflow.promptflow_backend.model.node.ConditionalNodeData;
import com.promptflow.promptflow_backend.model.node.ForEachNodeData;
import com.promptflow.promptflow_backend.model.node.OutputFormat;
import com.promptflow.promptflow_backend.model.node.PromptNodeData;
import com.promptflow.promptflow_backend.model.node.TransformType;
import com.promptflow.promptflow_backend.model.node.VariableDataType;
import com.promptflow.promptflow_backend.model.node.VariableNodeData;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.promptflow.promptflow_backend.FlowFixtures.conditional;
import static com.promptflow.promptflow_backend.FlowFixtures.edge;
import static com.promptflow.promptflow_backend.FlowFixtures.output;
import static com.promptflow.promptflow_backend.FlowFixtures.prompt;
import static com.promptflow.promptflow_backend.FlowFixtures.transform;
import static com.promptflow.promptflow_backend.FlowFixtures.variable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SuggestionEngineTest {

    private final SuggestionEngine engine = new SuggestionEngine(SuggestionRuleSet.standard());

    @Test
    void suggestNextNodes_numberedListPrompt_shouldRankForEachInTopTwo() {
        FlowNode source = prompt("p1", "Give me a numbered list of 5 blog ideas");

        List<FlowSuggestion> suggestions = engine.suggestNextNodes(source, List.of(source));

        assertThat(suggestions.subList(0, 2)).extracting(FlowSuggestion::nodeType).contains(NodeType.FOR_EACH);
        assertThat(suggestions).extracting(FlowSuggestion::priority).isSortedAccordingTo((a, b) -> b - a);
        FlowSuggestion forEach = suggestions.get(0);
        assertThat(forEach.autoConnect()).isTrue();
        assertThat(((ForEachNodeData) forEach.defaultConfig()).sourceVariable()).isEqualTo("result");
    }

    @Test
    void suggestNextNodes_structuredListFormat_shouldTriggerListSuggestionsWithoutKeywords() {
        FlowNode source = prompt("p1", "Name some rivers", OutputFormat.STRUCTURED_LIST, List.of());

        assertThat(engine.suggestNextNodes(source, List.of()))
                .extracting(FlowSuggestion::nodeType)
                .containsExactly(NodeType.FOR_EACH, NodeType.TRANSFORM, NodeType.CONDITIONAL, NodeType.OUTPUT);
    }

    @Test
    void suggestNextNodes_plainPrompt_shouldOnlySuggestOutput() {
        List<FlowSuggestion> suggestions = engine.suggestNextNodes(prompt("p1", "Write a haiku"), List.of());

        assertThat(suggestions).singleElement().satisfies(suggestion -> {
            assertThat(suggestion.nodeType()).isEqualTo(NodeType.OUTPUT);
            assertThat(suggestion.priority()).isEqualTo(70);
            assertThat(suggestion.defaultConfig().label()).isEqualTo("Display Results");
        });
    }

    @Test
    void suggestNextNodes_analysisPrompt_shouldSuggestBranching() {
        List<FlowSuggestion> suggestions = engine.suggestNextNodes(
                prompt("p1", "Analyze the sentiment of this review"), List.of());

        assertThat(suggestions).extracting(FlowSuggestion::nodeType)
                .containsExactly(NodeType.CONDITIONAL, NodeType.OUTPUT);
        assertThat(suggestions.get(0).defaultConfig()).isNull();
    }

    @Test
    void suggestNextNodes_commaSeparatedVariable_shouldRankForEachFirstAndKeepTieOrder() {
        FlowNode source = variable("v1", "topics", VariableDataType.STRING, "a,b,c");

        List<FlowSuggestion> suggestions = engine.suggestNextNodes(source, List.of(source));

        assertThat(suggestions).extracting(FlowSuggestion::nodeType)
                .containsExactly(NodeType.FOR_EACH, NodeType.PROMPT, NodeType.CONDITIONAL);
        FlowSuggestion forEach = suggestions.get(0);
        assertThat(forEach.priority()).isEqualTo(95);
        assertThat(forEach.autoConnect()).isTrue();
        assertThat(forEach.defaultConfig().label()).isEqualTo("Process Each topics");
        assertThat(((ForEachNodeData) forEach.defaultConfig()).sourceVariable()).isEqualTo("topics");
        assertThat(((PromptNodeData) suggestions.get(1).defaultConfig()).content())
                .isEqualTo("Please analyze the following: {{topics}}");
        assertThat(suggestions.get(2).autoConnect()).isFalse();
    }

    @Test
    void suggestNextNodes_scalarVariable_shouldSkipForEach() {
        FlowNode source = variable("v1", "topic", VariableDataType.STRING, "cats");

        List<FlowSuggestion> suggestions = engine.suggestNextNodes(source, List.of());

        assertThat(suggestions).extracting(FlowSuggestion::nodeType)
                .containsExactly(NodeType.PROMPT, NodeType.CONDITIONAL);
        ConditionalNodeData check = (ConditionalNodeData) suggestions.get(1).defaultConfig();
        assertThat(check.condition().leftOperand()).isEqualTo("topic");
    }

    @Test
    void looksLikeCollection_shouldRecognizeNamesAndDefaults() {
        assertThat(VariableSuggestionProvider.looksLikeCollection(variableData("itemList", ""))).isTrue();
        assertThat(VariableSuggestionProvider.looksLikeCollection(variableData("x", "[1]"))).isTrue();
        assertThat(VariableSuggestionProvider.looksLikeCollection(variableData("pair", "a,b"))).isFalse();
    }

    @Test
    void suggestNextNodes_splittingTransform_shouldSuggestPerItemProcessing() {
        List<FlowSuggestion> suggestions = engine.suggestNextNodes(
                transform("t1", TransformType.SPLIT, null), List.of());

        assertThat(suggestions).extracting(FlowSuggestion::nodeType)
                .containsExactly(NodeType.CONDITIONAL, NodeType.PROMPT, NodeType.OUTPUT);
    }

    @Test
    void suggestNextNodes_conditional_shouldNotAutoConnect() {
        List<FlowSuggestion> suggestions = engine.suggestNextNodes(conditional("c1"), List.of());

        assertThat(suggestions).hasSize(3).noneMatch(FlowSuggestion::autoConnect);
        assertThat(suggestions).extracting(FlowSuggestion::priority).containsExactly(85, 80, 75);
    }

    @Test
    void suggestNextNodes_unsupportedType_shouldReturnEmpty() {
        assertThat(engine.suggestNextNodes(output("o1", "{{result}}"), List.of())).isEmpty();
    }

    @Test
    void suggestNextNodes_shouldRespectLimit() {
        SuggestionEngine limited = new SuggestionEngine(SuggestionRuleSet.standard(), 2);
        FlowNode source = prompt("p1", "Analyze and list the key items");

        assertThat(engine.suggestNextNodes(source, List.of())).hasSize(5);
        assertThat(limited.suggestNextNodes(source, List.of()))
                .extracting(FlowSuggestion::nodeType)
                .containsExactly(NodeType.FOR_EACH, NodeType.TRANSFORM);
    }

    @Test
    void suggestFlowCompletion_shouldProposeOutputForEachDeadEnd() {
        List<FlowNode> nodes = List.of(
                variable("v1", "topic", VariableDataType.STRING, ""),
                prompt("p1", "Write about {{topic}}"),
                prompt("p2", "Summarize"),
                output("o1", "{{result}}"));

        List<FlowSuggestion> suggestions = engine.suggestFlowCompletion(nodes, List.of(
                edge("e1", "v1", "p1"), edge("e2", "p1", "o1")));

        assertThat(suggestions).singleElement().satisfies(suggestion -> {
            assertThat(suggestion.nodeType()).isEqualTo(NodeType.OUTPUT);
            assertThat(suggestion.reason()).isEqualTo("Complete the flow by outputting results from p2 label");
            assertThat(suggestion.autoConnect()).isTrue();
        });
    }

    @Test
    void ruleSet_duplicateProvider_shouldBeRefused() {
        assertThatThrownBy(() -> new SuggestionRuleSet(List.of(
                new PromptSuggestionProvider(), new PromptSuggestionProvider())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void flowSuggestion_mismatchedConfig_shouldBeRefused() {
        assertThatThrownBy(() -> new FlowSuggestion(NodeType.OUTPUT, "x", 1, true, prompt("p", "c").getData()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static VariableNodeData variableData(String name, String defaultValue) {
        return new VariableNodeData(name, null, name, VariableDataType.STRING, defaultValue);
    }
}
