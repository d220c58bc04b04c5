package com.devflow.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /executions.
 *
 * @param initialRole optional; the agent profile picks the role when absent
 * @param run         when true the execution is run until it blocks before
 *                    the response is returned
 */
public record CreateExecutionRequest(
        String              workflowId,
        String              agentType,
        String              initialRole,
        String              projectPath,
        Map<String, String> variables,
        boolean             run) {}
