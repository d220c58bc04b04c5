package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.ExecutionStatus;

import java.util.List;
import java.util.UUID;

/** Every batch run by {@link WorkflowOrchestrator#runUntilBlocked} for one execution. */
public record WorkflowRun(UUID executionId, ExecutionStatus status, List<RoleBatchResult> batches) {

    public WorkflowRun {
        batches = List.copyOf(batches);
    }

    public boolean success() {
        return status == ExecutionStatus.COMPLETED;
    }
}
