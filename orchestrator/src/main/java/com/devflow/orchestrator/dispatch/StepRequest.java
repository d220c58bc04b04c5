package com.devflow.orchestrator.dispatch;

import com.devflow.orchestrator.catalog.WorkflowStep;
import com.devflow.orchestrator.role.Role;

import java.util.Map;

/**
 * One step to carry out on behalf of a role.
 *
 * @param variables Execution variables available to templates.
 */
public record StepRequest(
        WorkflowStep        step,
        Role                role,
        StepContext         context,
        Map<String, String> variables) {

    public StepRequest {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }
}
