package com.devflow.orchestrator.role;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What a given coding agent (cursor, copilot, ...) is able to do.
 *
 * @param agentType      Profile key, e.g. "cursor".
 * @param supportedRoles Role ids the agent can act as, in preference order.
 *                       The first one is the default initial role.
 * @param capabilities   Informational agent capabilities.
 * @param limitations    Informational agent limitations.
 * @param templates      Template ids the agent works well with.
 * @param roleOverrides  Per-role guidance enrichments, keyed by role id.
 */
public record AgentProfile(
        String                    agentType,
        List<String>              supportedRoles,
        List<String>              capabilities,
        List<String>              limitations,
        List<String>              templates,
        Map<String, RoleOverride> roleOverrides) {

    public AgentProfile {
        supportedRoles = List.copyOf(supportedRoles);
        capabilities   = List.copyOf(capabilities);
        limitations    = List.copyOf(limitations);
        templates      = List.copyOf(templates);
        roleOverrides  = Map.copyOf(roleOverrides);
    }

    public Optional<RoleOverride> overrideFor(String roleId) {
        return Optional.ofNullable(roleOverrides.get(roleId));
    }
}
