package com.devflow.orchestrator.service;

import com.devflow.orchestrator.model.*;
import com.devflow.orchestrator.quality.QualityCheckResult;
import com.devflow.orchestrator.repository.ExecutionRepository;
import com.devflow.orchestrator.repository.StepExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns the mutable state of every execution and its step attempts.
 *
 * Rules enforced here:
 * <ul>
 *   <li>Unknown ids return {@link Optional#empty()}.</li>
 *   <li>Every read-modify-write runs under the lock of the owning execution,
 *       so concurrent callers never lose each other's updates. Step attempts
 *       are guarded by their execution's lock.</li>
 *   <li>A COMPLETED or FAILED execution is never mutated again; attempts
 *       throw {@link ExecutionStateException} with kind TERMINAL.</li>
 * </ul>
 *
 * Locks come from a fixed table of stripes indexed by execution id, so the
 * table does not grow with the number of executions. Two executions may share
 * a stripe; they are then serialized, never deadlocked, since no method holds
 * more than one stripe.
 *
 * Methods are not @Transactional: each repository save commits on its own,
 * before the lock is released.
 */
@Service
public class ExecutionTracker {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

    private final ExecutionRepository     executionRepo;
    private final StepExecutionRepository stepRepo;

    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public ExecutionTracker(ExecutionRepository executionRepo,
                            StepExecutionRepository stepRepo) {
        this.executionRepo = executionRepo;
        this.stepRepo      = stepRepo;
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    // ------------------------------------------------------------------
    // Creation and lookup
    // ------------------------------------------------------------------

    /**
     * Create a RUNNING execution with no completed steps, no role history and
     * zero metrics. The supplied variables only seed the context's variable map.
     */
    public Execution createExecution(String workflowId,
                                     String initialRole,
                                     String agentType,
                                     String projectPath,
                                     Map<String, String> variables) {
        Execution execution = new Execution(workflowId, initialRole, new ExecutionContext(variables));
        execution.setAgentType(agentType);
        execution.setProjectPath(projectPath);
        Execution saved = executionRepo.save(execution);
        log.info("Execution {} created (workflow={}, role={}, agent={})",
                saved.getId(), workflowId, initialRole, agentType);
        return saved;
    }

    public Optional<Execution> getExecution(UUID executionId) {
        return executionRepo.findById(executionId);
    }

    public List<Execution> getExecutionsByStatus(ExecutionStatus status) {
        return executionRepo.findByStatus(status);
    }

    public List<Execution> getExecutionsByRole(String roleId) {
        return executionRepo.findByCurrentRole(roleId);
    }

    // ------------------------------------------------------------------
    // Step attempts
    // ------------------------------------------------------------------

    /** Record a new PENDING attempt of {@code stepId} for the execution. */
    public Optional<StepExecution> addStepExecution(UUID executionId,
                                                    String stepId,
                                                    String roleId,
                                                    Map<String, String> variables) {
        return locked(executionId, () -> executionRepo.findById(executionId).map(execution -> {
            requireNotTerminal(execution, "add a step to");
            return stepRepo.save(new StepExecution(executionId, stepId, roleId, variables));
        }));
    }

    public Optional<StepExecution> getStepExecution(UUID stepExecutionId) {
        return stepRepo.findById(stepExecutionId);
    }

    /**
     * Apply a partial update to a step attempt.
     *
     * RUNNING stamps startedAt, COMPLETED and FAILED stamp completedAt; each
     * timestamp is set at most once, later updates leave it untouched.
     */
    public Optional<StepExecution> updateStepExecution(UUID stepExecutionId, StepExecutionUpdate update) {
        return lockedStep(stepExecutionId, step -> {
            executionRepo.findById(step.getExecutionId())
                    .ifPresent(execution -> requireNotTerminal(execution, "update a step of"));
            Instant now = Instant.now();
            if (update.status() != null) {
                step.setStatus(update.status());
                if (update.status() == StepStatus.RUNNING && step.getStartedAt() == null) {
                    step.setStartedAt(now);
                }
                if ((update.status() == StepStatus.COMPLETED || update.status() == StepStatus.FAILED)
                        && step.getCompletedAt() == null) {
                    step.setCompletedAt(now);
                }
            }
            if (update.result() != null)        step.setResult(update.result());
            if (update.error() != null)         step.setError(update.error());
            if (update.qualityChecks() != null) step.setQualityChecks(update.qualityChecks());
            if (update.suggestions() != null)   step.setSuggestions(update.suggestions());
            return stepRepo.save(step);
        });
    }

    public Optional<StepExecution> addQualityCheck(UUID stepExecutionId, QualityCheckResult check) {
        return lockedStep(stepExecutionId, step -> {
            executionRepo.findById(step.getExecutionId())
                    .ifPresent(execution -> requireNotTerminal(execution, "add a quality check to"));
            step.addQualityCheck(check);
            return stepRepo.save(step);
        });
    }

    public List<StepExecution> getStepExecutions(UUID executionId) {
        return stepRepo.findByExecutionIdOrderByCreatedAtAsc(executionId);
    }

    // ------------------------------------------------------------------
    // Execution progress
    // ------------------------------------------------------------------

    public Optional<Execution> startStep(UUID executionId, String stepId) {
        return mutate(executionId, "start a step of", e -> e.setCurrentStep(stepId));
    }

    /** Accept a step: append it to completedSteps (once) and clear currentStep. */
    public Optional<Execution> completeStep(UUID executionId, String stepId) {
        return mutate(executionId, "complete a step of", e -> {
            e.addCompletedStep(stepId);
            e.setCurrentStep("");
        });
    }

    public Optional<Execution> addMetrics(UUID executionId, MetricsDelta delta) {
        return mutate(executionId, "update metrics of", e -> e.getMetrics().apply(delta));
    }

    /** Union {@code gates} into the satisfied-gate set. Gates are never removed. */
    public Optional<Execution> recordQualityGates(UUID executionId, Collection<String> gates) {
        return mutate(executionId, "record quality gates of",
                e -> gates.stream().filter(Objects::nonNull).forEach(e.getContext().getQualityGates()::add));
    }

    /**
     * Hand control to {@code toRoleId}, appending exactly one RoleTransition.
     *
     * Role validation does not happen here: callers check
     * {@code RoleRegistry.validateRoleTransition} first.
     *
     * @throws ExecutionStateException NOT_RUNNING when the execution is paused
     */
    public Optional<Execution> transitionRole(UUID executionId,
                                              String toRoleId,
                                              String handoffNotes,
                                              List<String> decisions,
                                              String rationale) {
        return mutate(executionId, "transition", e -> {
            requireRunning(e, "transition");
            RoleTransition transition = new RoleTransition(
                    e.getCurrentRole(), toRoleId, Instant.now(), handoffNotes, decisions, rationale);
            e.addRoleTransition(transition);
            e.setCurrentRole(toRoleId);
            e.getContext().getDecisions().addAll(transition.decisions());
            e.getContext().setLastHandoffNotes(transition.handoffNotes());
            log.info("Execution {} handed off {} → {}", executionId, transition.fromRole(), toRoleId);
        });
    }

    public Optional<Execution> transitionRole(UUID executionId, String toRoleId, String handoffNotes) {
        return transitionRole(executionId, toRoleId, handoffNotes, List.of(), "");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public Optional<Execution> pauseExecution(UUID executionId, String reason) {
        return mutate(executionId, "pause", e -> {
            requireRunning(e, "pause");
            e.setStatus(ExecutionStatus.PAUSED);
            e.getContext().setPauseReason(reason);
            e.getContext().setPausedAt(Instant.now());
            log.info("Execution {} paused: {}", executionId, reason);
        });
    }

    public Optional<Execution> resumeExecution(UUID executionId) {
        return mutate(executionId, "resume", e -> {
            if (e.getStatus() != ExecutionStatus.PAUSED) {
                throw new ExecutionStateException(ExecutionStateException.Kind.NOT_PAUSED,
                        executionId, "resume", e.getStatus());
            }
            e.setStatus(ExecutionStatus.RUNNING);
            e.getContext().setPauseReason(null);
            e.getContext().setResumedAt(Instant.now());
            log.info("Execution {} resumed", executionId);
        });
    }

    /**
     * Mark the execution COMPLETED. {@code finalMetrics}, when given, replace
     * the accumulated metrics; this is the only place metrics may go down.
     *
     * @throws ExecutionStateException NOT_RUNNING when the execution is paused
     */
    public Optional<Execution> completeExecution(UUID executionId, ExecutionMetrics finalMetrics) {
        return mutate(executionId, "complete", e -> {
            requireRunning(e, "complete");
            e.setStatus(ExecutionStatus.COMPLETED);
            e.setCompletedAt(Instant.now());
            e.setCurrentStep("");
            if (finalMetrics != null) e.setMetrics(finalMetrics.copy());
            log.info("Execution {} COMPLETED ({} steps, {})",
                    executionId, e.getCompletedSteps().size(), e.getMetrics());
        });
    }

    public Optional<Execution> failExecution(UUID executionId, String reason, Throwable error) {
        return mutate(executionId, "fail", e -> {
            e.setStatus(ExecutionStatus.FAILED);
            e.getContext().setFailureReason(reason);
            e.getContext().setFailureError(error != null ? error.getMessage() : null);
            e.getContext().setFailedAt(Instant.now());
            log.error("Execution {} FAILED: {}", executionId, reason);
        });
    }

    // ------------------------------------------------------------------
    // Reporting
    // ------------------------------------------------------------------

    public Optional<ExecutionMetricsReport> getExecutionMetrics(UUID executionId) {
        return executionRepo.findById(executionId).map(execution -> {
            List<StepExecution> steps = stepRepo.findByExecutionIdOrderByCreatedAtAsc(executionId);
            List<StepExecution> completed = steps.stream()
                    .filter(s -> s.getStatus() == StepStatus.COMPLETED)
                    .toList();
            double successRate = steps.isEmpty() ? 0 : (double) completed.size() / steps.size();
            double averageStepTime = completed.stream()
                    .map(StepExecution::duration)
                    .filter(Objects::nonNull)
                    .mapToLong(Duration::toMillis)
                    .average()
                    .orElse(0);
            return new ExecutionMetricsReport(
                    executionId,
                    steps.size(),
                    completed.size(),
                    successRate,
                    averageStepTime,
                    execution.getMetrics().getQualityScore(),
                    execution.getRoleHistory().size());
        });
    }

    public Optional<ExecutionHistory> getExecutionHistory(UUID executionId) {
        return executionRepo.findById(executionId).map(execution -> new ExecutionHistory(
                execution,
                stepRepo.findByExecutionIdOrderByCreatedAtAsc(executionId),
                List.copyOf(execution.getRoleHistory())));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<Execution> mutate(UUID executionId, String operation, Consumer<Execution> change) {
        return locked(executionId, () -> executionRepo.findById(executionId).map(execution -> {
            requireNotTerminal(execution, operation);
            change.accept(execution);
            execution.touch();
            return executionRepo.save(execution);
        }));
    }

    private static void requireNotTerminal(Execution execution, String operation) {
        if (execution.isTerminal()) {
            throw new ExecutionStateException(ExecutionStateException.Kind.TERMINAL,
                    execution.getId(), operation, execution.getStatus());
        }
    }

    private static void requireRunning(Execution execution, String operation) {
        if (execution.getStatus() != ExecutionStatus.RUNNING) {
            throw new ExecutionStateException(ExecutionStateException.Kind.NOT_RUNNING,
                    execution.getId(), operation, execution.getStatus());
        }
    }

    /**
     * Run {@code change} on a step attempt under its execution's lock. The
     * owning execution id never changes, so it is safe to read it unlocked.
     */
    private Optional<StepExecution> lockedStep(UUID stepExecutionId,
                                               Function<StepExecution, StepExecution> change) {
        Optional<UUID> owner = stepRepo.findById(stepExecutionId).map(StepExecution::getExecutionId);
        if (owner.isEmpty()) return Optional.empty();
        return locked(owner.get(), () -> stepRepo.findById(stepExecutionId).map(change));
    }

    int lockTableSize() {
        return stripes.length;
    }

    private <T> T locked(UUID id, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(id.hashCode(), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
