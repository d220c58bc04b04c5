package com.devflow.orchestrator.role;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Assembles role guidance, enriched by the agent profile's override for the
 * role when the agent has one.
 */
@Service
public class GuidanceService {

    private final RoleRegistry registry;

    public GuidanceService(RoleRegistry registry) {
        this.registry = registry;
    }

    public Optional<RoleGuidance> getRoleGuidance(String roleId, String agentType) {
        return registry.getRole(roleId).map(role -> build(role, agentType));
    }

    private RoleGuidance build(Role role, String agentType) {
        Optional<AgentProfile> profile = registry.getAgentProfile(agentType);
        Optional<RoleOverride> override = profile.flatMap(p -> p.overrideFor(role.id()));

        List<String> guidance = new ArrayList<>(role.guidance());
        override.ifPresent(o -> o.capabilities().forEach(c -> guidance.add("Apply " + c)));

        List<String> templates = new ArrayList<>(profile.map(AgentProfile::templates).orElse(List.of()));
        override.ifPresent(o -> templates.addAll(o.templates()));

        return new RoleGuidance(
                role,
                profile.map(AgentProfile::agentType).orElse(agentType),
                List.copyOf(guidance),
                role.qualityGates(),
                role.nextSteps(),
                List.copyOf(templates),
                override.map(RoleOverride::examples).orElse(List.of()),
                override.map(RoleOverride::bestPractices).orElse(List.of()));
    }
}
