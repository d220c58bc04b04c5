package com.devflow.orchestrator.role;

import java.util.List;

/**
 * One stage of the development pipeline (product manager, architect, ...).
 *
 * Roles are declared once at startup by {@link DefaultRoleCatalog} and never
 * change afterwards; an execution hands control from one role to another
 * along the {@code nextRoles} edges.
 *
 * @param id               Stable identifier, e.g. "senior-developer".
 * @param displayName      Human-readable name used in handoff notes and guidance.
 * @param description      One-line summary of the role.
 * @param capabilities     Capability tags; decide which step actions the role owns.
 * @param responsibilities Free-text responsibilities shown in guidance.
 * @param qualityGates     Gate ids that must all be satisfied before handing off.
 * @param nextRoles        Allowed successor role ids, in preference order.
 * @param guidance         Advisory guidance lines for agents acting in this role.
 * @param nextSteps        Suggested next steps for agents acting in this role.
 */
public record Role(
        String       id,
        String       displayName,
        String       description,
        List<String> capabilities,
        List<String> responsibilities,
        List<String> qualityGates,
        List<String> nextRoles,
        List<String> guidance,
        List<String> nextSteps) {

    public Role {
        capabilities     = List.copyOf(capabilities);
        responsibilities = List.copyOf(responsibilities);
        qualityGates     = List.copyOf(qualityGates);
        nextRoles        = List.copyOf(nextRoles);
        guidance         = List.copyOf(guidance);
        nextSteps        = List.copyOf(nextSteps);
    }

    /** True when the role has no successor: finishing it finishes the execution. */
    public boolean isTerminal() {
        return nextRoles.isEmpty();
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }
}
