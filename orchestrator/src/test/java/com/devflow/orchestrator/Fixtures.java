package com.devflow.orchestrator;

import com.devflow.orchestrator.catalog.*;
import com.devflow.orchestrator.role.Role;

import java.util.List;

/** Small builders shared by the unit tests. */
public final class Fixtures {

    private Fixtures() {}

    public static WorkflowStep step(String id, String action, int order) {
        return new WorkflowStep(id, id + ".txt", "step " + id, action, null, List.of(), order, null);
    }

    public static WorkflowStep step(String id, String action, int order, String template, List<String> rules) {
        return new WorkflowStep(id, id + ".txt", "step " + id, action, template, rules, order, null);
    }

    public static WorkflowDefinition workflow(String id, WorkflowStep... steps) {
        return new WorkflowDefinition(id, id, "workflow " + id, List.of(steps), List.of(), List.of());
    }

    public static QualityRule rule(String id, String pattern, String gate) {
        return new QualityRule(id, "Rule " + id, "", "lint", "warning", pattern, gate, "Fix " + id);
    }

    public static Template template(String id, String content) {
        return new Template(id, id, "code", content, List.of(), "", List.of());
    }

    public static Role role(String id, List<String> capabilities, List<String> gates, List<String> next) {
        return new Role(id, "Role " + id, "does " + id, capabilities, List.of(), gates, next,
                List.of("Guidance for " + id), List.of());
    }
}
