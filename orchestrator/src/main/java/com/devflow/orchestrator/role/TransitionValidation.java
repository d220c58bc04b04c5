package com.devflow.orchestrator.role;

import java.util.List;

/**
 * Outcome of {@link RoleRegistry#validateRoleTransition}.
 *
 * @param valid        true when the handoff may proceed.
 * @param reason       Why the handoff was refused; null when valid.
 * @param requirements Allowed next roles when the target is not reachable.
 * @param missingGates Gates of the current role not yet satisfied.
 */
public record TransitionValidation(
        boolean      valid,
        String       reason,
        List<String> requirements,
        List<String> missingGates) {

    public static final String INVALID_ROLE       = "invalid role";
    public static final String NOT_ALLOWED        = "transition not allowed";
    public static final String GATES_NOT_MET      = "quality gates not met";

    public static TransitionValidation ok() {
        return new TransitionValidation(true, null, List.of(), List.of());
    }

    public static TransitionValidation invalidRole() {
        return new TransitionValidation(false, INVALID_ROLE, List.of(), List.of());
    }

    public static TransitionValidation notAllowed(List<String> allowedNextRoles) {
        return new TransitionValidation(false, NOT_ALLOWED, List.copyOf(allowedNextRoles), List.of());
    }

    public static TransitionValidation gatesNotMet(List<String> missingGates) {
        return new TransitionValidation(false, GATES_NOT_MET, List.of(), List.copyOf(missingGates));
    }
}
