package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.StepStatus;
import com.devflow.orchestrator.quality.QualityCheckResult;

import java.util.List;

/**
 * Partial update of a StepExecution. Null fields are left unchanged.
 */
public record StepExecutionUpdate(
        StepStatus               status,
        String                   result,
        String                   error,
        List<QualityCheckResult> qualityChecks,
        List<String>             suggestions) {

    public static StepExecutionUpdate status(StepStatus status) {
        return new StepExecutionUpdate(status, null, null, null, null);
    }

    public static StepExecutionUpdate completed(String result,
                                                List<QualityCheckResult> checks,
                                                List<String> suggestions) {
        return new StepExecutionUpdate(StepStatus.COMPLETED, result, null, checks, suggestions);
    }

    public static StepExecutionUpdate failed(String error, List<String> suggestions) {
        return new StepExecutionUpdate(StepStatus.FAILED, null, error, null, suggestions);
    }
}
