package com.devflow.orchestrator.api;

import com.devflow.orchestrator.role.AgentProfile;
import com.devflow.orchestrator.role.GuidanceService;
import com.devflow.orchestrator.role.Role;
import com.devflow.orchestrator.role.RoleGuidance;
import com.devflow.orchestrator.role.RoleRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read-only view of the role table and agent profiles.
 *
 * GET /roles                        : every role in declaration order
 * GET /roles/{id}/guidance?agentType: guidance for an agent acting in the role
 * GET /agents                       : every agent profile
 * GET /agents/{type}/roles          : roles the agent supports
 */
@RestController
public class RoleController {

    private final RoleRegistry    registry;
    private final GuidanceService guidance;

    public RoleController(RoleRegistry registry, GuidanceService guidance) {
        this.registry = registry;
        this.guidance = guidance;
    }

    @GetMapping("/roles")
    public List<Role> roles() {
        return registry.getAllRoles();
    }

    @GetMapping("/roles/{id}/guidance")
    public RoleGuidance guidance(@PathVariable String id,
                                 @RequestParam(defaultValue = "general") String agentType) {
        return guidance.getRoleGuidance(id, agentType)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Role not found: " + id));
    }

    @GetMapping("/agents")
    public List<AgentProfile> agents() {
        return registry.getAllAgentProfiles();
    }

    @GetMapping("/agents/{type}/roles")
    public List<Role> rolesForAgent(@PathVariable String type) {
        if (registry.getAgentProfile(type).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Agent not found: " + type);
        }
        return registry.getRolesForAgent(type);
    }
}
