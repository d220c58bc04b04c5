package com.devflow.orchestrator.service;

import java.util.UUID;

/**
 * Aggregate progress figures for one execution.
 *
 * @param successRate     completed attempts / all attempts; 0 with no attempts.
 * @param averageStepTime mean duration in ms over completed attempts only.
 */
public record ExecutionMetricsReport(
        UUID   executionId,
        int    totalSteps,
        int    completedSteps,
        double successRate,
        double averageStepTime,
        double qualityScore,
        int    roleTransitions) {}
