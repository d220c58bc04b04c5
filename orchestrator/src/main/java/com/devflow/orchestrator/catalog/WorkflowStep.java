package com.devflow.orchestrator.catalog;

import java.util.List;

/**
 * A unit of work within a workflow.
 *
 * @param id          Unique within the workflow.
 * @param name        Display name; also the default target path.
 * @param description Free text.
 * @param action      Declared action kind ("create", "validate", ...). Kept as
 *                    declared so that a misconfigured workflow still loads and
 *                    the bad step fails visibly at dispatch time.
 * @param template    Template id rendered by create/modify/test/document, or null.
 * @param rules       Quality rule ids checked after this step, may be empty.
 * @param order       Sequencing index within a role's batch (ascending).
 * @param target      Path relative to the project root, or null to use {@code name}.
 */
public record WorkflowStep(
        String       id,
        String       name,
        String       description,
        String       action,
        String       template,
        List<String> rules,
        int          order,
        String       target) {

    public WorkflowStep {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public String targetPath() {
        return target == null || target.isBlank() ? name : target;
    }
}
