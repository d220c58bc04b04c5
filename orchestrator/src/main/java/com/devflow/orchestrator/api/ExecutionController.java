package com.devflow.orchestrator.api;

import com.devflow.orchestrator.api.dto.*;
import com.devflow.orchestrator.model.Execution;
import com.devflow.orchestrator.model.ExecutionStatus;
import com.devflow.orchestrator.service.ExecutionHistory;
import com.devflow.orchestrator.service.ExecutionMetricsReport;
import com.devflow.orchestrator.service.ExecutionTracker;
import com.devflow.orchestrator.service.RoleBatchResult;
import com.devflow.orchestrator.service.TransitionOutcome;
import com.devflow.orchestrator.service.WorkflowOrchestrator;
import com.devflow.orchestrator.service.WorkflowRun;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for execution lifecycle.
 *
 * POST /executions                    : start a workflow execution (optionally run it)
 * GET  /executions?status=RUNNING     : list executions by status
 * GET  /executions/{id}               : current state of an execution
 * POST /executions/{id}/advance       : run the current role's batch once
 * POST /executions/{id}/run           : advance until blocked or finished
 * POST /executions/{id}/pause|resume|fail
 * POST /executions/{id}/transitions   : request a validated role handoff
 * POST /executions/{id}/gates         : approve quality gates manually
 * GET  /executions/{id}/metrics       : aggregated step metrics
 * GET  /executions/{id}/steps         : every step attempt, oldest first
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final WorkflowOrchestrator orchestrator;
    private final ExecutionTracker     tracker;

    public ExecutionController(WorkflowOrchestrator orchestrator, ExecutionTracker tracker) {
        this.orchestrator = orchestrator;
        this.tracker      = tracker;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/executions \
     *     -H "Content-Type: application/json" \
     *     -d '{"workflowId":"feature-development","agentType":"cursor","projectPath":"/work/app","run":true}'
     */
    @PostMapping
    public ResponseEntity<ExecutionResponse> create(@RequestBody CreateExecutionRequest req) {
        Execution execution = orchestrator.createExecution(
                        req.workflowId(), req.agentType(), req.initialRole(), req.projectPath(), req.variables())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Workflow not found: " + req.workflowId()));
        if (req.run()) {
            orchestrator.runUntilBlocked(execution.getId());
            execution = require(orchestrator.getExecution(execution.getId()).orElse(null), execution.getId());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ExecutionResponse.from(execution));
    }

    @GetMapping
    public List<ExecutionResponse> list(@RequestParam(defaultValue = "RUNNING") ExecutionStatus status) {
        return tracker.getExecutionsByStatus(status).stream()
                .map(ExecutionResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ExecutionResponse get(@PathVariable UUID id) {
        return ExecutionResponse.from(require(orchestrator.getExecution(id).orElse(null), id));
    }

    @PostMapping("/{id}/advance")
    public RoleBatchResult advance(@PathVariable UUID id) {
        return require(orchestrator.advance(id).orElse(null), id);
    }

    @PostMapping("/{id}/run")
    public WorkflowRun run(@PathVariable UUID id) {
        return require(orchestrator.runUntilBlocked(id).orElse(null), id);
    }

    @PostMapping("/{id}/pause")
    public ExecutionResponse pause(@PathVariable UUID id,
                                   @RequestBody(required = false) ReasonRequest req) {
        String reason = req == null || req.reason() == null ? "Paused on request" : req.reason();
        return ExecutionResponse.from(require(orchestrator.pause(id, reason).orElse(null), id));
    }

    @PostMapping("/{id}/resume")
    public ExecutionResponse resume(@PathVariable UUID id) {
        return ExecutionResponse.from(require(orchestrator.resume(id).orElse(null), id));
    }

    @PostMapping("/{id}/fail")
    public ExecutionResponse fail(@PathVariable UUID id,
                                  @RequestBody(required = false) ReasonRequest req) {
        String reason = req == null || req.reason() == null ? "Failed on request" : req.reason();
        return ExecutionResponse.from(require(orchestrator.fail(id, reason).orElse(null), id));
    }

    /**
     * HTTP 200: handoff recorded, body is the updated execution
     * HTTP 409: handoff refused, body is the {@code TransitionValidation}
     * HTTP 404: execution ID not found
     */
    @PostMapping("/{id}/transitions")
    public ResponseEntity<?> transition(@PathVariable UUID id, @RequestBody TransitionRequest req) {
        TransitionOutcome outcome = require(orchestrator.requestTransition(
                id, req.toRole(), req.handoffNotes(), req.decisions(), req.rationale()).orElse(null), id);
        if (!outcome.transitioned()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(outcome.validation());
        }
        return ResponseEntity.ok(ExecutionResponse.from(outcome.execution()));
    }

    @PostMapping("/{id}/gates")
    public ExecutionResponse approveGates(@PathVariable UUID id, @RequestBody GateApprovalRequest req) {
        List<String> gates = req.gates() == null ? List.of() : req.gates();
        return ExecutionResponse.from(require(orchestrator.approveQualityGates(id, gates).orElse(null), id));
    }

    @GetMapping("/{id}/metrics")
    public ExecutionMetricsReport metrics(@PathVariable UUID id) {
        return require(orchestrator.getMetrics(id).orElse(null), id);
    }

    @GetMapping("/{id}/steps")
    public List<StepExecutionResponse> steps(@PathVariable UUID id) {
        ExecutionHistory history = require(orchestrator.getHistory(id).orElse(null), id);
        return history.stepExecutions().stream()
                .map(StepExecutionResponse::from)
                .toList();
    }

    private static <T> T require(T value, UUID id) {
        if (value == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution not found: " + id);
        }
        return value;
    }
}
