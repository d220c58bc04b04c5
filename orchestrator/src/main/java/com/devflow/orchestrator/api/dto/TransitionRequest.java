package com.devflow.orchestrator.api.dto;

import java.util.List;

/** Request body for POST /executions/{id}/transitions. */
public record TransitionRequest(
        String       toRole,
        String       handoffNotes,
        List<String> decisions,
        String       rationale) {}
