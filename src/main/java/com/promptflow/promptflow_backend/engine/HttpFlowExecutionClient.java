package com.promptflow.promptflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts {@code {flowId, variables}} as JSON to the configured execution endpoint.
 * Any non-2xx answer fails the returned future.
 */
@Slf4j
@Component
public class HttpFlowExecutionClient implements FlowExecutionClient {

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();

    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final Duration timeout;

    public HttpFlowExecutionClient(ObjectMapper objectMapper,
                                   @Value("${app.execution.endpoint}") String endpoint,
                                   @Value("${app.execution.timeout-seconds:60}") long timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public CompletableFuture<ExecutionResult> execute(String flowId, Map<String, Object> variables) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("flowId", flowId);
        body.put("variables", variables);
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        log.info("Flow {}: POST {}", flowId, endpoint);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> toResult(flowId, response));
    }

    private ExecutionResult toResult(String flowId, HttpResponse<String> response) {
        if (response.statusCode() / 100 != 2) {
            log.error("Flow {}: execution endpoint answered HTTP {}", flowId, response.statusCode());
            throw new IllegalStateException("Execution endpoint error " + response.statusCode() + ": " + fallbackBody(response.body()));
        }
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> parsed = response.body() == null || response.body().isBlank()
                    ? Map.of()
                    : objectMapper.readValue(response.body(), Map.class);
            Object executionId = parsed.get("executionId");
            Object status = parsed.get("status");
            @SuppressWarnings("unchecked")
            Map<String, Object> output = parsed.get("output") instanceof Map<?, ?> map
                    ? (Map<String, Object>) map
                    : parsed;
            return new ExecutionResult(
                    executionId != null ? executionId.toString() : null,
                    status != null ? status.toString() : "COMPLETED",
                    output);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Execution endpoint returned a body that is not JSON", e);
        }
    }

    private static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
