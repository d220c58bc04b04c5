package com.devflow.orchestrator.api.dto;

/** Request body for POST /executions/{id}/pause and /fail. */
public record ReasonRequest(String reason) {}
