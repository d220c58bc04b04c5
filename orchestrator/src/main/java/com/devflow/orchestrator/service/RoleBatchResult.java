package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.ExecutionMetrics;
import com.devflow.orchestrator.model.ExecutionStatus;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one {@link WorkflowOrchestrator#advance} call: the current
 * role's batch of steps and the handoff decision that followed it.
 *
 * @param success      false whenever a step failed, a quality check failed
 *                     or the handoff was refused
 * @param previousRole Role that owned the batch.
 * @param currentRole  Role after the call; differs from previousRole only when
 *                     {@code transitioned} is true.
 * @param nextRole     First declared successor of previousRole, null when terminal.
 */
public record RoleBatchResult(
        boolean           success,
        UUID              executionId,
        ExecutionStatus   status,
        String            previousRole,
        String            currentRole,
        String            nextRole,
        boolean           transitioned,
        List<StepSummary> steps,
        ExecutionMetrics  metrics,
        List<String>      errors,
        List<String>      suggestions) {

    public RoleBatchResult {
        steps       = steps == null ? List.of() : List.copyOf(steps);
        errors      = errors == null ? List.of() : List.copyOf(errors);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /** A call that did no work at all (execution not runnable, busy, misconfigured). */
    static RoleBatchResult rejected(UUID executionId, ExecutionStatus status, String role,
                                    ExecutionMetrics metrics, String error) {
        return new RoleBatchResult(false, executionId, status, role, role, null, false,
                List.of(), metrics, List.of(error), List.of());
    }
}
