package com.devflow.orchestrator.role;

import java.util.List;

/**
 * Agent-specific additions to a role's guidance (e.g. Cursor adds React and
 * TypeScript practices to the senior-developer role).
 *
 * Overrides only enrich advisory text. They never change capabilities used for
 * step selection or the gates used for transitions.
 */
public record RoleOverride(
        List<String> capabilities,
        List<String> templates,
        List<String> examples,
        List<String> bestPractices) {

    public RoleOverride {
        capabilities  = List.copyOf(capabilities);
        templates     = List.copyOf(templates);
        examples      = List.copyOf(examples);
        bestPractices = List.copyOf(bestPractices);
    }
}
