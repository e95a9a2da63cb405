package com.promptflow.promptflow_backend.engine;

import com.promptflow.promptflow_backend.variable.BinderState;
import com.promptflow.promptflow_backend.variable.BinderStateListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class ExecutionEventPublisher implements BinderStateListener {

    // The execution dialog subscribes to /topic/flow-execution/{flowId}
    static final String TOPIC = "/topic/flow-execution/";

    private final SimpMessagingTemplate messagingTemplate;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void onStateChange(String flowId, BinderState state, Map<String, String> errors) {
        Map<String, Object> payload = Map.of(
                "flowId", flowId,
                "state",  state.name(),
                "errors", errors != null ? errors : Map.of()
        );
        String destination = TOPIC + flowId;
        log.debug("Publishing {} to {}", state, destination);
        messagingTemplate.convertAndSend(destination, payload);
    }
}
