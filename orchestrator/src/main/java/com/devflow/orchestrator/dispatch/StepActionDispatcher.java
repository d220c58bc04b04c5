package com.devflow.orchestrator.dispatch;

import com.devflow.orchestrator.catalog.WorkflowStep;
import com.devflow.orchestrator.model.MetricsDelta;
import com.devflow.orchestrator.quality.QualityCheckResult;
import com.devflow.orchestrator.quality.QualityGateEvaluator;
import com.devflow.orchestrator.role.GuidanceService;
import com.devflow.orchestrator.role.Role;
import com.devflow.orchestrator.role.RoleGuidance;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a workflow step to the handler for its action kind.
 *
 * All {@link StepActionHandler} beans are collected at startup; a missing or
 * duplicate handler for any {@link ActionKind} fails application startup.
 *
 * <p>Every dispatch is timed and counted:
 * <pre>
 *   devflow.step.calls{action, status="success|failed|unknown_action"}
 *   devflow.step.duration{action}
 * </pre>
 *
 * <p>{@link #executeStep} never throws for step-level problems: an unknown
 * action or a handler failure comes back as a failed
 * {@link StepDispatchResult}.
 */
@Component
public class StepActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StepActionDispatcher.class);

    private final Map<ActionKind, StepActionHandler> handlers = new EnumMap<>(ActionKind.class);
    private final QualityGateEvaluator evaluator;
    private final GuidanceService      guidance;
    private final MeterRegistry        meterRegistry;

    public StepActionDispatcher(List<StepActionHandler> allHandlers,
                                QualityGateEvaluator evaluator,
                                GuidanceService guidance,
                                MeterRegistry meterRegistry) {
        this.evaluator     = evaluator;
        this.guidance      = guidance;
        this.meterRegistry = meterRegistry;
        for (StepActionHandler handler : allHandlers) {
            StepActionHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for action '%s': %s and %s".formatted(
                        handler.kind().id(), previous.getClass().getSimpleName(),
                        handler.getClass().getSimpleName()));
            }
            log.info("Registered step handler '{}' ({})", handler.kind().id(), handler.getClass().getSimpleName());
        }
        for (ActionKind kind : ActionKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for action '" + kind.id() + "'");
            }
        }
    }

    public StepDispatchResult executeStep(WorkflowStep step,
                                          Role role,
                                          StepContext context,
                                          Map<String, String> variables) {
        Optional<ActionKind> parsed = ActionKind.parse(step.action());
        if (parsed.isEmpty()) {
            log.warn("Execution {}: step '{}' declares unknown action '{}'",
                    context.executionId(), step.id(), step.action());
            meterRegistry.counter("devflow.step.calls",
                    "action", "unknown", "status", "unknown_action").increment();
            return StepDispatchResult.unknownAction(step.id(), step.action());
        }
        ActionKind kind = parsed.get();
        List<String> suggestions = roleSuggestions(role, context.agentType());

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            ActionOutcome outcome = handlers.get(kind).execute(new StepRequest(step, role, context, variables));

            List<QualityCheckResult> checks =
                    evaluator.runQualityChecks(step, context.workflow(), role, outcome.artifact());
            suggestions.add("Executed %s with %s approach".formatted(step.name(), role.displayName()));
            checks.forEach(c -> suggestions.addAll(c.suggestions()));

            MetricsDelta delta = kind.metricsDelta().plus(MetricsDelta.qualityScore(qualityScore(checks)));
            log.info("Execution {}: step '{}' ({}) done as {}, {}/{} checks passed",
                    context.executionId(), step.id(), kind.id(), role.id(),
                    checks.stream().filter(QualityCheckResult::passed).count(), checks.size());
            return StepDispatchResult.succeeded(outcome, delta, checks, suggestions);
        } catch (StepActionException e) {
            status = "failed";
            log.warn("Execution {}: step '{}' failed [{}]: {}",
                    context.executionId(), step.id(), e.getKind(), e.getMessage());
            return StepDispatchResult.failed(e.getMessage(), suggestions);
        } catch (RuntimeException e) {
            status = "failed";
            log.warn("Execution {}: unexpected error in step '{}'", context.executionId(), step.id(), e);
            return StepDispatchResult.failed("Step execution failed: " + e.getMessage(), suggestions);
        } finally {
            sample.stop(meterRegistry.timer("devflow.step.duration", "action", kind.id()));
            meterRegistry.counter("devflow.step.calls", "action", kind.id(), "status", status).increment();
        }
    }

    /** Percentage of passed checks; 100 when nothing was checked. */
    static double qualityScore(List<QualityCheckResult> checks) {
        if (checks.isEmpty()) return 100.0;
        long passed = checks.stream().filter(QualityCheckResult::passed).count();
        return 100.0 * passed / checks.size();
    }

    private List<String> roleSuggestions(Role role, String agentType) {
        return new ArrayList<>(guidance.getRoleGuidance(role.id(), agentType)
                .map(RoleGuidance::guidance)
                .orElse(role.guidance()));
    }
}
