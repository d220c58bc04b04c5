package com.devflow.orchestrator.dispatch;

import com.devflow.orchestrator.model.MetricsDelta;
import com.devflow.orchestrator.quality.QualityCheckResult;

import java.util.List;

/**
 * Outcome of dispatching one workflow step.
 *
 * @param configurationError true when the step declared an action outside
 *                           {@link ActionKind}; the orchestrator fails the
 *                           execution for it.
 */
public record StepDispatchResult(
        boolean                  success,
        String                   result,
        String                   artifact,
        MetricsDelta             metricsDelta,
        List<QualityCheckResult> qualityChecks,
        List<String>             suggestions,
        String                   error,
        boolean                  configurationError) {

    public StepDispatchResult {
        metricsDelta  = metricsDelta == null ? MetricsDelta.NONE : metricsDelta;
        qualityChecks = qualityChecks == null ? List.of() : List.copyOf(qualityChecks);
        suggestions   = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static StepDispatchResult succeeded(ActionOutcome outcome,
                                               MetricsDelta delta,
                                               List<QualityCheckResult> checks,
                                               List<String> suggestions) {
        return new StepDispatchResult(true, outcome.result(), outcome.artifact(),
                delta, checks, suggestions, null, false);
    }

    public static StepDispatchResult failed(String error, List<String> suggestions) {
        return new StepDispatchResult(false, null, null, MetricsDelta.NONE,
                List.of(), suggestions, error, false);
    }

    public static StepDispatchResult unknownAction(String stepId, String action) {
        return new StepDispatchResult(false, null, null, MetricsDelta.NONE, List.of(), List.of(),
                "Unknown action '%s' in step '%s'".formatted(action, stepId), true);
    }

    /** True when dispatch succeeded and none of the quality checks failed. */
    public boolean accepted() {
        return success && qualityChecks.stream().allMatch(QualityCheckResult::passed);
    }
}
