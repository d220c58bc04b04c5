package com.devflow.orchestrator.role;

import com.devflow.orchestrator.model.Execution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of roles and agent profiles.
 *
 * Built once at startup (see {@code OrchestratorConfig}) and injected wherever
 * role lookups are needed. The role graph is validated on construction:
 * every next-role and supported-role reference must point at a declared role.
 * Cycles are allowed.
 */
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    // LinkedHashMap keeps declaration order for getAllRoles() and the default initial role.
    private final Map<String, Role>         roles    = new LinkedHashMap<>();
    private final Map<String, AgentProfile> profiles = new LinkedHashMap<>();

    public RoleRegistry(List<Role> roles, List<AgentProfile> profiles) {
        if (roles.isEmpty()) {
            throw new IllegalArgumentException("At least one role must be declared");
        }
        for (Role role : roles) {
            if (this.roles.putIfAbsent(role.id(), role) != null) {
                throw new IllegalArgumentException("Duplicate role id: '" + role.id() + "'");
            }
        }
        for (Role role : roles) {
            for (String next : role.nextRoles()) {
                if (!this.roles.containsKey(next)) {
                    throw new IllegalArgumentException(
                            "Role '" + role.id() + "' hands off to unknown role '" + next + "'");
                }
            }
        }
        for (AgentProfile profile : profiles) {
            for (String supported : profile.supportedRoles()) {
                if (!this.roles.containsKey(supported)) {
                    throw new IllegalArgumentException(
                            "Agent '" + profile.agentType() + "' supports unknown role '" + supported + "'");
                }
            }
            if (this.profiles.putIfAbsent(profile.agentType(), profile) != null) {
                throw new IllegalArgumentException("Duplicate agent profile: '" + profile.agentType() + "'");
            }
        }
        log.info("Role registry initialised with {} roles and {} agent profiles",
                this.roles.size(), this.profiles.size());
    }

    // ------------------------------------------------------------------
    // Role lookup
    // ------------------------------------------------------------------

    public Optional<Role> getRole(String roleId) {
        return Optional.ofNullable(roleId == null ? null : roles.get(roleId));
    }

    public List<Role> getAllRoles() {
        return List.copyOf(roles.values());
    }

    /**
     * Successor roles in declared order. Empty for a terminal role and for an
     * unknown role id.
     */
    public List<Role> getNextRoles(String roleId) {
        return getRole(roleId)
                .map(role -> role.nextRoles().stream().map(roles::get).toList())
                .orElse(List.of());
    }

    public boolean canTransition(String fromRoleId, String toRoleId) {
        return getRole(fromRoleId)
                .map(role -> role.nextRoles().contains(toRoleId))
                .orElse(false);
    }

    // ------------------------------------------------------------------
    // Transition validation
    // ------------------------------------------------------------------

    public TransitionValidation validateRoleTransition(Execution execution, String toRoleId) {
        return validateRoleTransition(execution.getCurrentRole(),
                execution.getContext().getQualityGates(), toRoleId);
    }

    /**
     * Check whether control may pass from {@code fromRoleId} to {@code toRoleId}
     * given the set of gates satisfied so far.
     *
     * Checks, in order: both roles exist; the target is a declared next role;
     * every gate of the current role is satisfied. The missing gates are
     * reported in the current role's declaration order.
     */
    public TransitionValidation validateRoleTransition(String fromRoleId,
                                                       Collection<String> satisfiedGates,
                                                       String toRoleId) {
        Optional<Role> from = getRole(fromRoleId);
        Optional<Role> to   = getRole(toRoleId);
        if (from.isEmpty() || to.isEmpty()) {
            return TransitionValidation.invalidRole();
        }
        if (!canTransition(fromRoleId, toRoleId)) {
            return TransitionValidation.notAllowed(from.get().nextRoles());
        }
        Set<String> satisfied = Set.copyOf(satisfiedGates);
        List<String> missing = from.get().qualityGates().stream()
                .filter(gate -> !satisfied.contains(gate))
                .toList();
        if (!missing.isEmpty()) {
            return TransitionValidation.gatesNotMet(missing);
        }
        return TransitionValidation.ok();
    }

    // ------------------------------------------------------------------
    // Agent profiles
    // ------------------------------------------------------------------

    public Optional<AgentProfile> getAgentProfile(String agentType) {
        return Optional.ofNullable(agentType == null ? null : profiles.get(agentType));
    }

    public List<AgentProfile> getAllAgentProfiles() {
        return List.copyOf(profiles.values());
    }

    /** Roles an agent supports, in the profile's order. Empty for unknown agents. */
    public List<Role> getRolesForAgent(String agentType) {
        return getAgentProfile(agentType)
                .map(p -> p.supportedRoles().stream().map(roles::get).toList())
                .orElse(List.of());
    }

    /**
     * The role a new execution starts in: the agent's first supported role,
     * or the first declared role when the agent is unknown or supports none.
     */
    public Role initialRoleFor(String agentType) {
        List<Role> supported = getRolesForAgent(agentType);
        return supported.isEmpty() ? roles.values().iterator().next() : supported.get(0);
    }
}
