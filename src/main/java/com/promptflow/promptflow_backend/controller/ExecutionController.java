package com.promptflow.promptflow_backend.controller;

import com.promptflow.promptflow_backend.model.dto.ExecutionView;
import com.promptflow.promptflow_backend.service.ExecutionSubmission;
import com.promptflow.promptflow_backend.service.FlowService;
import com.promptflow.promptflow_backend.variable.SubmissionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backs the execution dialog: read the inputs, edit values, run, close.
 * State changes are also pushed to /topic/flow-execution/{flowId}.
 */
@RestController
@RequestMapping("/api/flows/{flowId}/execution")
@RequiredArgsConstructor
public class ExecutionController {

    private final FlowService flowService;

    // Inputs with their current values, field errors and binder state
    @GetMapping
    public ResponseEntity<ExecutionView> getExecution(@PathVariable String flowId) {
        return flowService.executionView(flowId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // Partial update, each edited field loses its error
    @PutMapping("/values")
    public ResponseEntity<?> setValues(@PathVariable String flowId, @RequestBody Map<String, Object> values) {
        return flowService.setValues(flowId, values != null ? values : Map.of())
                .<ResponseEntity<?>>map(unknown -> unknown.isEmpty()
                        ? ResponseEntity.ok(flowService.executionView(flowId).orElseThrow())
                        : ResponseEntity.badRequest().body(Map.of("error", "unknown variable(s): " + String.join(", ", unknown))))
                .orElse(ResponseEntity.notFound().build());
    }

    // Validate, type and dispatch; the run itself finishes asynchronously
    @PostMapping
    public ResponseEntity<?> submit(@PathVariable String flowId) {
        return flowService.submit(flowId)
                .map(ExecutionController::toResponse)
                .orElse(ResponseEntity.notFound().build());
    }

    // Dialog closed: a running execution is left to finish but its result is dropped
    @DeleteMapping
    public ResponseEntity<Void> close(@PathVariable String flowId) {
        return flowService.closeExecution(flowId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private static ResponseEntity<?> toResponse(ExecutionSubmission submission) {
        if (submission.flowInvalid()) {
            return ResponseEntity.unprocessableEntity().body(submission.validation());
        }
        SubmissionResult result = submission.submission();
        return switch (result.status()) {
            case INVALID -> ResponseEntity.unprocessableEntity().body(Map.of("errors", result.errors()));
            case BUSY -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "An execution is already running for this flow"));
            case DISPATCHED -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("state", "EXECUTING");
                body.put("variables", result.variables());
                body.put("warnings", submission.validation() != null ? submission.validation().warnings() : List.of());
                yield ResponseEntity.accepted().body(body);
            }
        };
    }
}
