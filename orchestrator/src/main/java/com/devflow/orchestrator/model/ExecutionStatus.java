package com.devflow.orchestrator.model;

/**
 * Lifecycle status of an Execution.
 *
 * Transitions:
 *   RUNNING → PAUSED    (pauseExecution)
 *   PAUSED  → RUNNING   (resumeExecution)
 *   RUNNING → COMPLETED (terminal role finished all its steps)
 *   RUNNING → FAILED    (unrecoverable dispatch error, or failExecution)
 *
 * COMPLETED and FAILED are terminal: the tracker rejects every later mutation.
 */
public enum ExecutionStatus {
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
