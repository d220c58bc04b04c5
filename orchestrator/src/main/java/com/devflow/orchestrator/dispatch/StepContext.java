package com.devflow.orchestrator.dispatch;

import com.devflow.orchestrator.catalog.WorkflowDefinition;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Runtime context passed to every step dispatch.
 *
 * Handlers use it to locate the project on disk and to tag logs with the
 * owning execution.
 *
 * @param projectRoot Directory every step target is resolved against.
 */
public record StepContext(
        UUID               executionId,
        WorkflowDefinition workflow,
        String             agentType,
        Path               projectRoot) {}
