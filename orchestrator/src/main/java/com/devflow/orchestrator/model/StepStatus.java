package com.devflow.orchestrator.model;

/**
 * Status of one step attempt.
 *
 * Transitions:
 *   PENDING → RUNNING   (dispatch starts, stamps startedAt)
 *   RUNNING → COMPLETED (handler succeeded, stamps completedAt)
 *   RUNNING → FAILED    (handler failed or action unknown)
 *
 * A retry creates a new StepExecution; records are never reset.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
