package com.devflow.orchestrator.catalog;

/**
 * A pattern-based quality rule.
 *
 * @param id          Unique rule id, referenced by steps and workflows.
 * @param name        Display name.
 * @param description Free text.
 * @param type        lint, test, security, performance or accessibility.
 * @param severity    error, warning or info (informational: any match fails the rule).
 * @param pattern     Regex searched in the step artifact; a match is a violation.
 *                    Null for rules that cannot be checked by pattern.
 * @param gate        Quality gate id evidenced by a pass of this rule, or null.
 * @param suggestion  Remediation hint attached to failing results.
 */
public record QualityRule(
        String id,
        String name,
        String description,
        String type,
        String severity,
        String pattern,
        String gate,
        String suggestion) {

    public boolean hasPattern() {
        return pattern != null && !pattern.isBlank();
    }
}
