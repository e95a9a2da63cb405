package com.promptflow.promptflow_backend.variable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptflow.promptflow_backend.engine.ExecutionResult;
import com.promptflow.promptflow_backend.engine.FlowExecutionClient;
import com.promptflow.promptflow_backend.model.node.VariableDataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionVariableBinderTest {

    private static final String FLOW_ID = "flow-1";

    @Mock
    private FlowExecutionClient executionClient;

    private final List<BinderState> transitions = new ArrayList<>();

    private ExecutionVariableBinder binder;

    @BeforeEach
    void setUp() {
        List<FlowVariable> variables = List.of(
                new FlowVariable("topic", VariableDataType.STRING, null, true, null, VariableProvenance.VARIABLE_NODE),
                new FlowVariable("count", VariableDataType.NUMBER, "3", false, null, VariableProvenance.VARIABLE_NODE),
                new FlowVariable("config", VariableDataType.JSON, null, true, null, VariableProvenance.VARIABLE_NODE));
        binder = new ExecutionVariableBinder(FLOW_ID, variables, executionClient,
                new VariableCoercer(new ObjectMapper()), (flowId, state, errors) -> transitions.add(state));
    }

    @Test
    void inputs_shouldStartFromDefaultsAndTypedEmptyValues() {
        List<VariableInput> inputs = binder.inputs();

        assertThat(inputs).extracting(VariableInput::name).containsExactly("topic", "count", "config");
        assertThat(inputs).extracting(VariableInput::value).containsExactly("", "3", Map.of());
        assertThat(inputs).extracting(VariableInput::kind)
                .containsExactly(InputKind.TEXT, InputKind.NUMBER, InputKind.JSON_TEXT);
    }

    @Test
    void submit_requiredFieldEmpty_shouldReportErrorsWithoutInvokingExecution() {
        binder.setValue("config", "{not json");

        SubmissionResult result = binder.submit();

        assertThat(result.status()).isEqualTo(SubmissionResult.Status.INVALID);
        assertThat(result.errors()).containsOnlyKeys("topic", "config");
        assertThat(result.errors()).containsEntry("topic", "topic is required");
        assertThat(result.errors()).containsEntry("config", "config must be valid JSON");
        assertThat(transitions).containsExactly(BinderState.VALIDATING, BinderState.INVALID, BinderState.IDLE);
        assertThat(binder.getState()).isEqualTo(BinderState.IDLE);
        verifyNoInteractions(executionClient);
    }

    @Test
    void setValue_shouldClearOnlyThatFieldError() {
        binder.setValue("config", "{broken");
        binder.submit();

        binder.setValue("topic", "cats");

        assertThat(binder.getErrors()).containsOnlyKeys("config");
        assertThat(binder.inputs().get(0).error()).isNull();
    }

    @Test
    void setValue_unknownName_shouldBeRefused() {
        assertThat(binder.setValue("nope", "x")).isFalse();
        assertThat(binder.getValues()).doesNotContainKey("nope");
    }

    @Test
    void submit_validValues_shouldDispatchTypedVariablesAndComplete() throws Exception {
        CompletableFuture<ExecutionResult> pending = new CompletableFuture<>();
        when(executionClient.execute(eq(FLOW_ID), anyMap())).thenReturn(pending);
        binder.setValue("topic", "cats");
        binder.setValue("config", "{\"depth\": 2}");

        SubmissionResult result = binder.submit();

        assertThat(result.status()).isEqualTo(SubmissionResult.Status.DISPATCHED);
        assertThat(result.variables()).containsExactly(
                Map.entry("topic", "cats"), Map.entry("count", 3L), Map.entry("config", Map.of("depth", 2)));
        verify(executionClient).execute(FLOW_ID, result.variables());
        assertThat(binder.getState()).isEqualTo(BinderState.EXECUTING);

        ExecutionResult done = new ExecutionResult("exec-1", "completed", Map.of("result", "ok"));
        pending.complete(done);

        assertThat(result.execution().get()).isEqualTo(done);
        assertThat(binder.getState()).isEqualTo(BinderState.COMPLETED);
        assertThat(transitions).containsExactly(
                BinderState.VALIDATING, BinderState.EXECUTING, BinderState.COMPLETED);
    }

    @Test
    void submit_whileExecuting_shouldBeRefusedAsBusy() {
        when(executionClient.execute(eq(FLOW_ID), anyMap())).thenReturn(new CompletableFuture<>());
        binder.setValue("topic", "cats");
        binder.setValue("config", "{}");
        binder.submit();

        SubmissionResult second = binder.submit();

        assertThat(second.status()).isEqualTo(SubmissionResult.Status.BUSY);
        verify(executionClient, times(1)).execute(eq(FLOW_ID), anyMap());
    }

    @Test
    void submit_failedExecution_shouldPropagateOriginalError() {
        CompletableFuture<ExecutionResult> pending = new CompletableFuture<>();
        when(executionClient.execute(eq(FLOW_ID), anyMap())).thenReturn(pending);
        binder.setValue("topic", "cats");
        binder.setValue("config", "{}");
        SubmissionResult result = binder.submit();

        IllegalStateException failure = new IllegalStateException("model unavailable");
        pending.completeExceptionally(failure);

        assertThatThrownBy(() -> result.execution().get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseReference(failure);
        assertThat(binder.getState()).isEqualTo(BinderState.FAILED);
    }

    @Test
    void submit_clientThrowingSynchronously_shouldFailTheExecution() {
        when(executionClient.execute(eq(FLOW_ID), anyMap())).thenThrow(new IllegalStateException("offline"));
        binder.setValue("topic", "cats");
        binder.setValue("config", "{}");

        SubmissionResult result = binder.submit();

        assertThat(result.status()).isEqualTo(SubmissionResult.Status.DISPATCHED);
        assertThat(result.execution()).isCompletedExceptionally();
        assertThat(binder.getState()).isEqualTo(BinderState.FAILED);
    }

    @Test
    void close_whileExecuting_shouldDiscardLateResult() {
        CompletableFuture<ExecutionResult> pending = new CompletableFuture<>();
        when(executionClient.execute(eq(FLOW_ID), anyMap())).thenReturn(pending);
        binder.setValue("topic", "cats");
        binder.setValue("config", "{}");
        binder.submit();

        binder.close();
        transitions.clear();
        pending.complete(new ExecutionResult("exec-1", "completed", null));

        assertThat(binder.isClosed()).isTrue();
        assertThat(binder.getState()).isEqualTo(BinderState.IDLE);
        assertThat(transitions).isEmpty();
    }

    @Test
    void refresh_shouldKeepValuesOfSurvivingVariables() {
        binder.setValue("topic", "cats");

        binder.refresh(List.of(
                new FlowVariable("topic", VariableDataType.STRING, null, true, null, VariableProvenance.VARIABLE_NODE),
                new FlowVariable("tone", VariableDataType.STRING, "dry", false, null, VariableProvenance.VARIABLE_NODE)));

        assertThat(binder.getValues()).containsExactly(Map.entry("topic", "cats"), Map.entry("tone", "dry"));
    }
}
