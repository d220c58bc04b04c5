package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.model.StepExecution;
import com.devflow.orchestrator.model.StepStatus;
import com.devflow.orchestrator.quality.QualityCheckResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of one step attempt returned by GET /executions/{id}/steps.
 */
public record StepExecutionResponse(
        UUID                     id,
        String                   stepId,
        String                   roleId,
        StepStatus               status,
        Instant                  createdAt,
        Instant                  startedAt,
        Instant                  completedAt,
        String                   result,
        String                   error,
        List<QualityCheckResult> qualityChecks,
        List<String>             suggestions
) {
    public static StepExecutionResponse from(StepExecution s) {
        return new StepExecutionResponse(
                s.getId(),
                s.getStepId(),
                s.getRoleId(),
                s.getStatus(),
                s.getCreatedAt(),
                s.getStartedAt(),
                s.getCompletedAt(),
                s.getResult(),
                s.getError(),
                List.copyOf(s.getQualityChecks()),
                List.copyOf(s.getSuggestions())
        );
    }
}
