package com.devflow.orchestrator.api.dto;

import java.util.List;

/** Request body for POST /executions/{id}/gates. */
public record GateApprovalRequest(List<String> gates) {}
