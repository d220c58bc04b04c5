package com.devflow.orchestrator.role;

import java.util.List;

/**
 * Advisory guidance for an agent acting in a role. Never read by the
 * transition logic.
 */
public record RoleGuidance(
        Role         role,
        String       agentType,
        List<String> guidance,
        List<String> qualityGates,
        List<String> nextSteps,
        List<String> templates,
        List<String> examples,
        List<String> bestPractices) {}
