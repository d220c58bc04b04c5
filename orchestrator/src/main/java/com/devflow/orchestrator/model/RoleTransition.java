package com.devflow.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * One handoff between roles. Appended to {@link Execution#getRoleHistory()}
 * and never modified afterwards.
 */
public record RoleTransition(
        String       fromRole,
        String       toRole,
        Instant      timestamp,
        String       handoffNotes,
        List<String> decisions,
        String       rationale) {

    public RoleTransition {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        if (handoffNotes == null) handoffNotes = "";
        if (rationale == null) rationale = "";
    }
}
