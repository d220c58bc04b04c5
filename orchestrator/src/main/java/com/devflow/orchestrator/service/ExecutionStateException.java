package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.ExecutionStatus;

import java.util.UUID;

/**
 * Thrown when an operation is not allowed in the execution's current status
 * (e.g. transitioning a completed execution, resuming one that is not paused).
 *
 * Unchecked: the REST layer maps it to 409 Conflict, and the orchestrator
 * reports it in the batch result instead of letting it escape.
 */
public class ExecutionStateException extends RuntimeException {

    public enum Kind { TERMINAL, NOT_RUNNING, NOT_PAUSED }

    private final Kind            kind;
    private final UUID            executionId;
    private final ExecutionStatus status;

    public ExecutionStateException(Kind kind, UUID executionId, String operation, ExecutionStatus status) {
        super(describe(kind, executionId, operation, status));
        this.kind        = kind;
        this.executionId = executionId;
        this.status      = status;
    }

    public Kind            getKind()        { return kind; }
    public UUID            getExecutionId() { return executionId; }
    public ExecutionStatus getStatus()      { return status; }

    private static String describe(Kind kind, UUID id, String operation, ExecutionStatus status) {
        return switch (kind) {
            case TERMINAL    -> "Cannot %s execution %s: execution is terminal (%s)".formatted(operation, id, status);
            case NOT_RUNNING -> "Cannot %s execution %s: execution is not running (%s)".formatted(operation, id, status);
            case NOT_PAUSED  -> "Cannot %s execution %s: execution is not paused (%s)".formatted(operation, id, status);
        };
    }
}
