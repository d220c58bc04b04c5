package com.devflow.orchestrator.role;

import com.devflow.orchestrator.model.Execution;
import com.devflow.orchestrator.model.ExecutionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.devflow.orchestrator.role.DefaultRoleCatalog.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RoleRegistry against the default role table.
 * No Spring context.
 */
class RoleRegistryTest {

    RoleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoleRegistry(DefaultRoleCatalog.roles(), DefaultRoleCatalog.agentProfiles());
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    @Test
    void getAllRoles_keepsDeclarationOrder() {
        assertThat(registry.getAllRoles()).extracting(Role::id).containsExactly(
                PRODUCT_MANAGER, ARCHITECT, SENIOR_DEVELOPER, CODE_REVIEW, INTEGRATION_ENGINEER);
    }

    @Test
    void getRole_unknownId_isEmpty() {
        assertThat(registry.getRole("janitor")).isEmpty();
        assertThat(registry.getRole(null)).isEmpty();
    }

    @Test
    void getNextRoles_terminalAndUnknown_areEmpty() {
        assertThat(registry.getNextRoles(INTEGRATION_ENGINEER)).isEmpty();
        assertThat(registry.getNextRoles("janitor")).isEmpty();
        assertThat(registry.getNextRoles(SENIOR_DEVELOPER)).extracting(Role::id).containsExactly(CODE_REVIEW);
    }

    @Test
    void canTransition_followsDeclaredEdgesOnly() {
        assertThat(registry.canTransition(PRODUCT_MANAGER, ARCHITECT)).isTrue();
        assertThat(registry.canTransition(PRODUCT_MANAGER, SENIOR_DEVELOPER)).isFalse();
        assertThat(registry.canTransition(ARCHITECT, PRODUCT_MANAGER)).isFalse();
        assertThat(registry.canTransition("janitor", ARCHITECT)).isFalse();
    }

    // ------------------------------------------------------------------
    // validateRoleTransition()
    // ------------------------------------------------------------------

    @Test
    void validate_unknownTarget_isInvalidRole() {
        TransitionValidation v = registry.validateRoleTransition(PRODUCT_MANAGER, Set.of(), "janitor");

        assertThat(v.valid()).isFalse();
        assertThat(v.reason()).isEqualTo(TransitionValidation.INVALID_ROLE);
    }

    @Test
    void validate_skippingARole_isNotAllowedWithRequirements() {
        TransitionValidation v = registry.validateRoleTransition(PRODUCT_MANAGER, Set.of(), CODE_REVIEW);

        assertThat(v.valid()).isFalse();
        assertThat(v.reason()).isEqualTo(TransitionValidation.NOT_ALLOWED);
        assertThat(v.requirements()).containsExactly(ARCHITECT);
    }

    @Test
    void validate_missingGates_reportedInDeclarationOrder() {
        TransitionValidation v = registry.validateRoleTransition(
                PRODUCT_MANAGER, Set.of("stakeholder-approval"), ARCHITECT);

        assertThat(v.valid()).isFalse();
        assertThat(v.reason()).isEqualTo(TransitionValidation.GATES_NOT_MET);
        assertThat(v.missingGates()).containsExactly("requirements-complete", "scope-defined");
    }

    @Test
    void validate_allGatesSatisfied_isValid() {
        Execution execution = new Execution("wf", PRODUCT_MANAGER, new ExecutionContext(Map.of()));
        execution.getContext().getQualityGates().addAll(
                List.of("requirements-complete", "stakeholder-approval", "scope-defined", "extra-gate"));

        assertThat(registry.validateRoleTransition(execution, ARCHITECT).valid()).isTrue();
    }

    // ------------------------------------------------------------------
    // Agent profiles
    // ------------------------------------------------------------------

    @Test
    void getRolesForAgent_usesProfileOrder() {
        assertThat(registry.getRolesForAgent("copilot")).extracting(Role::id)
                .containsExactly(SENIOR_DEVELOPER, CODE_REVIEW);
        assertThat(registry.getRolesForAgent("nobody")).isEmpty();
    }

    @Test
    void initialRoleFor_knownAgent_isFirstSupportedRole() {
        assertThat(registry.initialRoleFor("roocode").id()).isEqualTo(ARCHITECT);
    }

    @Test
    void initialRoleFor_unknownAgent_fallsBackToFirstDeclaredRole() {
        assertThat(registry.initialRoleFor("nobody").id()).isEqualTo(PRODUCT_MANAGER);
        assertThat(registry.initialRoleFor(null).id()).isEqualTo(PRODUCT_MANAGER);
    }

    // ------------------------------------------------------------------
    // Table validation
    // ------------------------------------------------------------------

    @Test
    void constructor_duplicateRoleId_throws() {
        Role a = role("a", List.of());
        assertThatThrownBy(() -> new RoleRegistry(List.of(a, a), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate role id");
    }

    @Test
    void constructor_nextRoleNotDeclared_throws() {
        assertThatThrownBy(() -> new RoleRegistry(List.of(role("a", List.of("ghost"))), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void constructor_profileSupportsUnknownRole_throws() {
        AgentProfile profile = new AgentProfile("bot", List.of("ghost"),
                List.of(), List.of(), List.of(), Map.of());
        assertThatThrownBy(() -> new RoleRegistry(List.of(role("a", List.of())), List.of(profile)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bot");
    }

    @Test
    void constructor_cyclesAreAllowed() {
        RoleRegistry cyclic = new RoleRegistry(
                List.of(role("a", List.of("b")), role("b", List.of("a"))), List.of());

        assertThat(cyclic.canTransition("b", "a")).isTrue();
    }

    private static Role role(String id, List<String> next) {
        return new Role(id, id, id, List.of(), List.of(), List.of(), next, List.of(), List.of());
    }
}
