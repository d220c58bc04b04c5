package com.devflow.orchestrator.dispatch;

import com.devflow.orchestrator.model.MetricsDelta;
import com.devflow.orchestrator.role.Role;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of step actions a workflow may declare.
 *
 * Each kind carries the capability tags that decide which role owns a step
 * with that action: a role owns the step when it has any of the tags.
 */
public enum ActionKind {

    CREATE  ("create",   "code-implementation", "project-setup"),
    MODIFY  ("modify",   "code-implementation", "code-optimization"),
    VALIDATE("validate", "code-review", "quality-assessment"),
    TEST    ("test",     "unit-testing", "integration-testing"),
    DOCUMENT("document", "documentation", "project-setup"),
    ANALYZE ("analyze",  "architecture-planning", "performance-review");

    private final String       id;
    private final List<String> capabilities;

    ActionKind(String id, String... capabilities) {
        this.id           = id;
        this.capabilities = List.of(capabilities);
    }

    /** The action name as declared in workflow definitions. */
    public String id() { return id; }

    public List<String> capabilities() { return capabilities; }

    public boolean isOwnedBy(Role role) {
        return capabilities.stream().anyMatch(role::hasCapability);
    }

    /** Counter increment credited when a step of this kind succeeds. */
    public MetricsDelta metricsDelta() {
        return switch (this) {
            case CREATE, DOCUMENT -> MetricsDelta.created();
            case MODIFY           -> MetricsDelta.modified();
            case TEST             -> MetricsDelta.tested();
            case VALIDATE, ANALYZE -> MetricsDelta.NONE;
        };
    }

    /** Empty for null, blank or unknown actions such as "deploy". */
    public static Optional<ActionKind> parse(String action) {
        if (action == null || action.isBlank()) return Optional.empty();
        String normalized = action.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.id.equals(normalized)).findFirst();
    }
}
