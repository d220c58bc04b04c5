package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.StepStatus;
import com.devflow.orchestrator.quality.QualityCheckResult;

import java.util.List;
import java.util.UUID;

/**
 * Per-step line of a {@link RoleBatchResult}.
 *
 * @param accepted true when the step joined the execution's completed steps
 */
public record StepSummary(
        UUID                     stepExecutionId,
        String                   stepId,
        String                   stepName,
        String                   action,
        StepStatus               status,
        boolean                  accepted,
        String                   result,
        String                   error,
        List<QualityCheckResult> qualityChecks) {

    public StepSummary {
        qualityChecks = qualityChecks == null ? List.of() : List.copyOf(qualityChecks);
    }
}
