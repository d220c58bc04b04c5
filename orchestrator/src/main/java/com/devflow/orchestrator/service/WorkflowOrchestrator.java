package com.devflow.orchestrator.service;

import com.devflow.orchestrator.catalog.WorkflowCatalog;
import com.devflow.orchestrator.catalog.WorkflowDefinition;
import com.devflow.orchestrator.catalog.WorkflowStep;
import com.devflow.orchestrator.dispatch.ActionKind;
import com.devflow.orchestrator.dispatch.StepActionDispatcher;
import com.devflow.orchestrator.dispatch.StepContext;
import com.devflow.orchestrator.dispatch.StepDispatchResult;
import com.devflow.orchestrator.model.*;
import com.devflow.orchestrator.quality.QualityCheckResult;
import com.devflow.orchestrator.role.Role;
import com.devflow.orchestrator.role.RoleRegistry;
import com.devflow.orchestrator.role.TransitionValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives executions through their workflow, one role at a time.
 *
 * <p>Execution state machine:
 * <pre>
 *   RUNNING ⇄ PAUSED
 *   RUNNING → COMPLETED   (terminal role finished all its steps)
 *   RUNNING → FAILED      (unknown step action, or unexpected error in a batch)
 * </pre>
 *
 * <p>Each {@link #advance} call runs the current role's remaining steps in
 * order, then tries to hand off to the role's first successor. A handoff
 * happens only when every step of the batch was accepted and the registry
 * confirms all of the role's quality gates are satisfied.
 *
 * <p>All state changes go through {@link ExecutionTracker}.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    static final String BUSY = "execution is busy";

    private final WorkflowCatalog      catalog;
    private final RoleRegistry         roles;
    private final StepActionDispatcher dispatcher;
    private final ExecutionTracker     tracker;

    // Executions with an advance() in flight; an id leaves the set when its batch ends.
    private final Set<UUID> activeBatches = ConcurrentHashMap.newKeySet();

    public WorkflowOrchestrator(WorkflowCatalog catalog,
                                RoleRegistry roles,
                                StepActionDispatcher dispatcher,
                                ExecutionTracker tracker) {
        this.catalog    = catalog;
        this.roles      = roles;
        this.dispatcher = dispatcher;
        this.tracker    = tracker;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Start a new execution of {@code workflowId}.
     *
     * @param initialRole explicit starting role, or null to let the agent
     *                    profile choose
     * @return empty when the workflow does not exist
     * @throws IllegalArgumentException when {@code initialRole} is not a known role
     */
    public Optional<Execution> createExecution(String workflowId,
                                               String agentType,
                                               String initialRole,
                                               String projectPath,
                                               Map<String, String> variables) {
        if (catalog.getWorkflow(workflowId).isEmpty()) {
            log.warn("Cannot start execution: workflow '{}' not found", workflowId);
            return Optional.empty();
        }
        Role role = initialRole == null || initialRole.isBlank()
                ? roles.initialRoleFor(agentType)
                : roles.getRole(initialRole)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + initialRole));
        return Optional.of(tracker.createExecution(workflowId, role.id(), agentType, projectPath,
                variables == null ? Map.of() : variables));
    }

    // ------------------------------------------------------------------
    // Step selection
    // ------------------------------------------------------------------

    /** Steps whose action maps to one of the role's capabilities, by ascending order index. */
    public List<WorkflowStep> getStepsForRole(WorkflowDefinition workflow, Role role) {
        return workflow.orderedSteps().stream()
                .filter(step -> ActionKind.parse(step.action()).map(k -> k.isOwnedBy(role)).orElse(false))
                .toList();
    }

    /**
     * The role's not-yet-completed steps, plus every step whose action is not
     * recognized at all: such a step can never be owned by a role and must
     * surface as a failure instead of stalling the workflow silently.
     */
    List<WorkflowStep> batchFor(WorkflowDefinition workflow, Role role, Execution execution) {
        Set<String> owned = new LinkedHashSet<>();
        getStepsForRole(workflow, role).forEach(s -> owned.add(s.id()));
        return workflow.orderedSteps().stream()
                .filter(step -> ActionKind.parse(step.action()).isEmpty()
                        || (owned.contains(step.id()) && !execution.hasCompletedStep(step.id())))
                .toList();
    }

    // ------------------------------------------------------------------
    // Advancing
    // ------------------------------------------------------------------

    /**
     * Run the current role's batch and attempt the handoff that follows it.
     *
     * @return empty when the execution does not exist
     */
    public Optional<RoleBatchResult> advance(UUID executionId) {
        Optional<Execution> found = tracker.getExecution(executionId);
        if (found.isEmpty()) return Optional.empty();

        if (!activeBatches.add(executionId)) {
            Execution execution = found.get();
            log.warn("Execution {} is already being advanced", executionId);
            return Optional.of(RoleBatchResult.rejected(executionId, execution.getStatus(),
                    execution.getCurrentRole(), execution.getMetrics().copy(), BUSY));
        }
        try {
            // Re-read under the lock; another caller may have just finished a batch.
            return tracker.getExecution(executionId).map(this::runBatch);
        } finally {
            activeBatches.remove(executionId);
        }
    }

    int activeBatchCount() {
        return activeBatches.size();
    }

    /**
     * Keep advancing while each batch hands off and the execution stays
     * RUNNING. Stops at the first blocked, failed, paused or completed state.
     *
     * @return empty when the execution does not exist
     */
    public Optional<WorkflowRun> runUntilBlocked(UUID executionId) {
        List<RoleBatchResult> batches = new ArrayList<>();
        // A chain of n roles needs at most n batches; the bound only matters for cyclic role tables.
        int limit = roles.getAllRoles().size() + 1;
        for (int i = 0; i < limit; i++) {
            Optional<RoleBatchResult> next = advance(executionId);
            if (next.isEmpty()) {
                return batches.isEmpty() ? Optional.empty() : Optional.of(run(executionId, batches));
            }
            RoleBatchResult batch = next.get();
            batches.add(batch);
            if (!batch.transitioned() || batch.status() != ExecutionStatus.RUNNING) break;
        }
        return Optional.of(run(executionId, batches));
    }

    /** Create an execution and run it until it blocks. Empty when the workflow does not exist. */
    public Optional<WorkflowRun> execute(String workflowId,
                                         String agentType,
                                         String projectPath,
                                         Map<String, String> variables) {
        return createExecution(workflowId, agentType, null, projectPath, variables)
                .flatMap(execution -> runUntilBlocked(execution.getId()));
    }

    private WorkflowRun run(UUID executionId, List<RoleBatchResult> batches) {
        ExecutionStatus status = tracker.getExecution(executionId)
                .map(Execution::getStatus)
                .orElse(batches.get(batches.size() - 1).status());
        return new WorkflowRun(executionId, status, batches);
    }

    private RoleBatchResult runBatch(Execution execution) {
        UUID id = execution.getId();
        String roleId = execution.getCurrentRole();

        if (execution.getStatus() != ExecutionStatus.RUNNING) {
            return RoleBatchResult.rejected(id, execution.getStatus(), roleId, execution.getMetrics().copy(),
                    "Execution is " + execution.getStatus());
        }
        Optional<WorkflowDefinition> workflow = catalog.getWorkflow(execution.getWorkflowId());
        if (workflow.isEmpty()) {
            return RoleBatchResult.rejected(id, execution.getStatus(), roleId, execution.getMetrics().copy(),
                    "Workflow '" + execution.getWorkflowId() + "' not found");
        }
        Optional<Role> current = roles.getRole(roleId);
        if (current.isEmpty()) {
            return RoleBatchResult.rejected(id, execution.getStatus(), roleId, execution.getMetrics().copy(),
                    TransitionValidation.INVALID_ROLE);
        }
        Role role = current.get();
        String nextRole = role.isTerminal() ? null : role.nextRoles().get(0);

        List<StepSummary> summaries = new ArrayList<>();
        List<QualityCheckResult> batchChecks = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> suggestions = new LinkedHashSet<>();
        List<String> unknownActions = new ArrayList<>();
        boolean allAccepted = true;

        try {
            StepContext context = new StepContext(id, workflow.get(), execution.getAgentType(),
                    Path.of(execution.getProjectPath() == null ? "." : execution.getProjectPath()));
            Map<String, String> variables = execution.getContext().getVariables();

            for (WorkflowStep step : batchFor(workflow.get(), role, execution)) {
                if (!isRunning(id)) {
                    errors.add("Execution stopped before step '" + step.id() + "'");
                    allAccepted = false;
                    break;
                }
                StepSummary summary = runStep(id, step, role, context, variables, suggestions);
                summaries.add(summary);
                batchChecks.addAll(summary.qualityChecks());

                if (!summary.accepted()) {
                    allAccepted = false;
                    if (summary.error() != null) {
                        errors.add("Step '%s' failed: %s".formatted(step.id(), summary.error()));
                    } else {
                        errors.add("Step '%s' failed quality checks: %s".formatted(step.id(),
                                String.join(", ", summary.qualityChecks().stream()
                                        .filter(c -> !c.passed()).map(QualityCheckResult::ruleId).toList())));
                    }
                    if (ActionKind.parse(step.action()).isEmpty()) unknownActions.add(step.action());
                }
            }
        } catch (ExecutionStateException e) {
            // Paused or failed by someone else mid-batch; leave the state they chose.
            log.warn("Execution {}: batch for role '{}' interrupted: {}", id, roleId, e.getMessage());
            errors.add(e.getMessage());
            return finish(id, false, roleId, nextRole, false, summaries, errors, suggestions);
        } catch (RuntimeException e) {
            log.error("Execution {}: unexpected error in batch for role '{}'", id, roleId, e);
            tracker.failExecution(id, "Unexpected error during role '" + roleId + "' batch", e);
            errors.add("Unexpected error: " + e.getMessage());
            return finish(id, false, roleId, nextRole, false, summaries, errors, suggestions);
        }

        if (!unknownActions.isEmpty()) {
            String reason = "Unrecognized step action(s): " + String.join(", ", unknownActions);
            tracker.failExecution(id, reason, null);
            return finish(id, false, roleId, nextRole, false, summaries, errors, suggestions);
        }
        if (!allAccepted) {
            return finish(id, false, roleId, nextRole, false, summaries, errors, suggestions);
        }

        try {
            return conclude(id, role, nextRole, summaries, batchChecks, errors, suggestions);
        } catch (ExecutionStateException e) {
            // Paused or failed after the last step; the state check runs under the tracker lock.
            log.warn("Execution {}: handoff from role '{}' abandoned: {}", id, roleId, e.getMessage());
            errors.add(e.getMessage());
            return finish(id, false, roleId, nextRole, false, summaries, errors, suggestions);
        }
    }

    /** Complete the execution or hand off, once every step of the batch was accepted. */
    private RoleBatchResult conclude(UUID id,
                                     Role role,
                                     String nextRole,
                                     List<StepSummary> summaries,
                                     List<QualityCheckResult> batchChecks,
                                     List<String> errors,
                                     Set<String> suggestions) {
        String roleId = role.id();
        if (role.isTerminal()) {
            Execution latest = tracker.getExecution(id).orElseThrow();
            tracker.completeExecution(id, latest.getMetrics());
            return finish(id, true, roleId, null, false, summaries, errors, suggestions);
        }

        Execution latest = tracker.getExecution(id).orElseThrow();
        TransitionValidation validation = roles.validateRoleTransition(latest, nextRole);
        if (!validation.valid()) {
            String detail = validation.missingGates().isEmpty()
                    ? String.join(", ", validation.requirements())
                    : "missing " + String.join(", ", validation.missingGates());
            errors.add("Transition to '%s' blocked: %s (%s)".formatted(nextRole, validation.reason(), detail));
            log.info("Execution {}: handoff {} → {} blocked: {}", id, roleId, nextRole, validation.reason());
            return finish(id, false, roleId, nextRole, false, summaries, errors, suggestions);
        }

        List<String> decisions = summaries.stream()
                .map(s -> "%s: %s".formatted(s.stepId(), s.result()))
                .toList();
        tracker.transitionRole(id, nextRole, handoffNotes(role, batchChecks), decisions,
                "All %s steps accepted and quality gates satisfied".formatted(role.displayName()));
        return finish(id, true, roleId, nextRole, true, summaries, errors, suggestions);
    }

    private StepSummary runStep(UUID executionId,
                                WorkflowStep step,
                                Role role,
                                StepContext context,
                                Map<String, String> variables,
                                Set<String> suggestions) {
        StepExecution attempt = tracker.addStepExecution(executionId, step.id(), role.id(), variables)
                .orElseThrow();
        tracker.updateStepExecution(attempt.getId(), StepExecutionUpdate.status(StepStatus.RUNNING));
        tracker.startStep(executionId, step.id());

        StepDispatchResult outcome = dispatcher.executeStep(step, role, context, variables);
        suggestions.addAll(outcome.suggestions());

        StepExecution recorded = tracker.updateStepExecution(attempt.getId(), outcome.success()
                        ? StepExecutionUpdate.completed(outcome.result(), outcome.qualityChecks(), outcome.suggestions())
                        : StepExecutionUpdate.failed(outcome.error(), outcome.suggestions()))
                .orElseThrow();

        if (outcome.success()) {
            tracker.addMetrics(executionId, outcome.metricsDelta());
            List<String> gates = outcome.qualityChecks().stream()
                    .filter(QualityCheckResult::passed)
                    .map(QualityCheckResult::gate)
                    .filter(Objects::nonNull)
                    .toList();
            if (!gates.isEmpty()) tracker.recordQualityGates(executionId, gates);
        }
        if (outcome.accepted()) {
            tracker.completeStep(executionId, step.id());
        }
        return new StepSummary(recorded.getId(), step.id(), step.name(), step.action(),
                recorded.getStatus(), outcome.accepted(), outcome.result(), outcome.error(),
                outcome.qualityChecks());
    }

    private RoleBatchResult finish(UUID id, boolean success, String previousRole, String nextRole,
                                   boolean transitioned, List<StepSummary> steps,
                                   List<String> errors, Collection<String> suggestions) {
        Execution latest = tracker.getExecution(id).orElseThrow();
        return new RoleBatchResult(success && errors.isEmpty(), id, latest.getStatus(), previousRole,
                latest.getCurrentRole(), nextRole, transitioned, steps, latest.getMetrics().copy(),
                errors, List.copyOf(suggestions));
    }

    private boolean isRunning(UUID executionId) {
        return tracker.getExecution(executionId)
                .map(e -> e.getStatus() == ExecutionStatus.RUNNING)
                .orElse(false);
    }

    static String handoffNotes(Role role, List<QualityCheckResult> checks) {
        long passed = checks.stream().filter(QualityCheckResult::passed).count();
        return String.join("\n",
                "Handoff from " + role.displayName(),
                "Quality checks: %d/%d passed".formatted(passed, checks.size()),
                "Next role should focus on: " + String.join(", ", role.nextRoles()));
    }

    // ------------------------------------------------------------------
    // Manual control
    // ------------------------------------------------------------------

    /**
     * Hand off to {@code toRoleId} on request, subject to the same validation
     * as an automatic handoff.
     *
     * @return empty when the execution does not exist
     * @throws ExecutionStateException when the execution is terminal or paused
     */
    public Optional<TransitionOutcome> requestTransition(UUID executionId,
                                                         String toRoleId,
                                                         String handoffNotes,
                                                         List<String> decisions,
                                                         String rationale) {
        return tracker.getExecution(executionId).map(execution -> {
            if (execution.isTerminal()) {
                throw new ExecutionStateException(ExecutionStateException.Kind.TERMINAL,
                        executionId, "transition", execution.getStatus());
            }
            TransitionValidation validation = roles.validateRoleTransition(execution, toRoleId);
            if (!validation.valid()) {
                log.info("Execution {}: requested handoff {} → {} refused: {}",
                        executionId, execution.getCurrentRole(), toRoleId, validation.reason());
                return new TransitionOutcome(validation, execution);
            }
            Execution updated = tracker.transitionRole(executionId, toRoleId,
                    handoffNotes == null ? "" : handoffNotes,
                    decisions == null ? List.of() : decisions,
                    rationale == null ? "" : rationale).orElseThrow();
            return new TransitionOutcome(validation, updated);
        });
    }

    /** Mark gates as satisfied by a human decision, e.g. "stakeholder-approval". */
    public Optional<Execution> approveQualityGates(UUID executionId, Collection<String> gates) {
        log.info("Execution {}: gates approved manually: {}", executionId, gates);
        return tracker.recordQualityGates(executionId, gates);
    }

    public Optional<Execution> pause(UUID executionId, String reason) {
        return tracker.pauseExecution(executionId, reason);
    }

    public Optional<Execution> resume(UUID executionId) {
        return tracker.resumeExecution(executionId);
    }

    public Optional<Execution> fail(UUID executionId, String reason) {
        return tracker.failExecution(executionId, reason, null);
    }

    public Optional<Execution> getExecution(UUID executionId) {
        return tracker.getExecution(executionId);
    }

    public Optional<ExecutionMetricsReport> getMetrics(UUID executionId) {
        return tracker.getExecutionMetrics(executionId);
    }

    public Optional<ExecutionHistory> getHistory(UUID executionId) {
        return tracker.getExecutionHistory(executionId);
    }
}
