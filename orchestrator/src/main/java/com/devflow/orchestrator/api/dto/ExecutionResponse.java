package com.devflow.orchestrator.api.dto;

import com.devflow.orchestrator.model.Execution;
import com.devflow.orchestrator.model.ExecutionMetrics;
import com.devflow.orchestrator.model.ExecutionStatus;
import com.devflow.orchestrator.model.RoleTransition;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Response body for POST /executions and GET /executions/{id}.
 */
public record ExecutionResponse(
        UUID                 id,
        String               workflowId,
        String               agentType,
        String               projectPath,
        String               currentRole,
        ExecutionStatus      status,
        String               currentStep,
        List<String>         completedSteps,
        Set<String>          qualityGates,
        ExecutionMetrics     metrics,
        List<RoleTransition> roleHistory,
        String               pauseReason,
        String               failureReason,
        Instant              createdAt,
        Instant              updatedAt,
        Instant              completedAt
) {
    public static ExecutionResponse from(Execution e) {
        return new ExecutionResponse(
                e.getId(),
                e.getWorkflowId(),
                e.getAgentType(),
                e.getProjectPath(),
                e.getCurrentRole(),
                e.getStatus(),
                e.getCurrentStep(),
                List.copyOf(e.getCompletedSteps()),
                Set.copyOf(e.getContext().getQualityGates()),
                e.getMetrics().copy(),
                List.copyOf(e.getRoleHistory()),
                e.getContext().getPauseReason(),
                e.getContext().getFailureReason(),
                e.getCreatedAt(),
                e.getUpdatedAt(),
                e.getCompletedAt()
        );
    }
}
