package com.devflow.orchestrator.quality;

import java.util.List;

/**
 * Result of evaluating one quality rule against one step artifact.
 *
 * @param gate Gate id this rule evidences; a PASS adds it to the execution's
 *             satisfied gates. Null when the rule evidences no gate.
 */
public record QualityCheckResult(
        String       ruleId,
        String       ruleName,
        String       gate,
        CheckStatus  status,
        String       message,
        List<String> suggestions) {

    public QualityCheckResult {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean passed() {
        return status == CheckStatus.PASS;
    }
}
