package com.devflow.orchestrator.service;

import com.devflow.orchestrator.InMemoryRepositories;
import com.devflow.orchestrator.model.*;
import com.devflow.orchestrator.quality.CheckStatus;
import com.devflow.orchestrator.quality.QualityCheckResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ExecutionTracker.
 *
 * Repositories are Mockito mocks backed by maps; no Spring context, no database.
 */
class ExecutionTrackerTest {

    InMemoryRepositories repos;
    ExecutionTracker tracker;

    @BeforeEach
    void setUp() {
        repos = new InMemoryRepositories();
        tracker = new ExecutionTracker(repos.executionRepo, repos.stepRepo);
    }

    // ------------------------------------------------------------------
    // createExecution()
    // ------------------------------------------------------------------

    @Test
    void create_startsRunningWithEmptyStateAndZeroMetrics() {
        Execution e = tracker.createExecution("wf", "architect", "cursor", "/tmp/p", Map.of("k", "v"));

        assertThat(e.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(e.getCompletedSteps()).isEmpty();
        assertThat(e.getRoleHistory()).isEmpty();
        assertThat(e.getMetrics()).isEqualTo(ExecutionMetrics.zero());
        assertThat(e.getCreatedAt()).isEqualTo(e.getUpdatedAt()).isEqualTo(e.getStartedAt());
        assertThat(e.getContext().getVariables()).containsEntry("k", "v");
        assertThat(tracker.getExecution(e.getId())).map(Execution::getWorkflowId).contains("wf");
    }

    @Test
    void unknownIds_returnEmpty() {
        UUID ghost = UUID.randomUUID();

        assertThat(tracker.getExecution(ghost)).isEmpty();
        assertThat(tracker.completeStep(ghost, "s1")).isEmpty();
        assertThat(tracker.pauseExecution(ghost, "why")).isEmpty();
        assertThat(tracker.addStepExecution(ghost, "s1", "r", Map.of())).isEmpty();
        assertThat(tracker.updateStepExecution(ghost, StepExecutionUpdate.status(StepStatus.RUNNING))).isEmpty();
        assertThat(tracker.getExecutionMetrics(ghost)).isEmpty();
        assertThat(tracker.getExecutionHistory(ghost)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    @Test
    void stepExecution_timestampsAreStampedOnce() throws Exception {
        Execution e = newExecution();
        StepExecution s = tracker.addStepExecution(e.getId(), "s1", "architect", Map.of()).orElseThrow();
        assertThat(s.getStatus()).isEqualTo(StepStatus.PENDING);

        tracker.updateStepExecution(s.getId(), StepExecutionUpdate.status(StepStatus.RUNNING));
        Instant started = repos.steps.get(s.getId()).getStartedAt();
        Thread.sleep(2);
        tracker.updateStepExecution(s.getId(), StepExecutionUpdate.status(StepStatus.RUNNING));
        tracker.updateStepExecution(s.getId(), StepExecutionUpdate.completed("done", List.of(), List.of("tip")));
        Instant completed = repos.steps.get(s.getId()).getCompletedAt();
        tracker.updateStepExecution(s.getId(), StepExecutionUpdate.status(StepStatus.COMPLETED));

        StepExecution stored = repos.steps.get(s.getId());
        assertThat(stored.getStartedAt()).isEqualTo(started);
        assertThat(stored.getCompletedAt()).isEqualTo(completed).isAfterOrEqualTo(started);
        assertThat(stored.getResult()).isEqualTo("done");
        assertThat(stored.getSuggestions()).containsExactly("tip");
    }

    @Test
    void failedStep_stampsCompletedAtAsEndOfAttempt() {
        Execution e = newExecution();
        StepExecution s = tracker.addStepExecution(e.getId(), "s1", "architect", Map.of()).orElseThrow();

        tracker.updateStepExecution(s.getId(), StepExecutionUpdate.failed("boom", List.of()));

        assertThat(repos.steps.get(s.getId()).getCompletedAt()).isNotNull();
        assertThat(repos.steps.get(s.getId()).getError()).isEqualTo("boom");
    }

    @Test
    void completeStep_appendsOnce_andClearsCurrentStep() {
        Execution e = newExecution();
        tracker.startStep(e.getId(), "s1");

        tracker.completeStep(e.getId(), "s1");
        tracker.completeStep(e.getId(), "s1");

        Execution stored = tracker.getExecution(e.getId()).orElseThrow();
        assertThat(stored.getCompletedSteps()).containsExactly("s1");
        assertThat(stored.getCurrentStep()).isEmpty();
    }

    @Test
    void addQualityCheck_appendsToStep() {
        Execution e = newExecution();
        StepExecution s = tracker.addStepExecution(e.getId(), "s1", "architect", Map.of()).orElseThrow();

        tracker.addQualityCheck(s.getId(),
                new QualityCheckResult("r", "R", "g", CheckStatus.PASS, "ok", List.of()));

        assertThat(repos.steps.get(s.getId()).getQualityChecks()).extracting(QualityCheckResult::ruleId)
                .containsExactly("r");
    }

    // ------------------------------------------------------------------
    // Metrics and gates
    // ------------------------------------------------------------------

    @Test
    void addMetrics_addsCounters_andNeverLowersScores() {
        Execution e = newExecution();

        tracker.addMetrics(e.getId(), MetricsDelta.created().plus(MetricsDelta.qualityScore(80)));
        tracker.addMetrics(e.getId(), MetricsDelta.tested().plus(MetricsDelta.qualityScore(50)));

        ExecutionMetrics m = tracker.getExecution(e.getId()).orElseThrow().getMetrics();
        assertThat(m.getFilesCreated()).isEqualTo(1);
        assertThat(m.getTestsWritten()).isEqualTo(1);
        assertThat(m.getQualityScore()).isEqualTo(80.0);
    }

    @Test
    void recordQualityGates_isSetUnion() {
        Execution e = newExecution();

        tracker.recordQualityGates(e.getId(), List.of("a", "b"));
        tracker.recordQualityGates(e.getId(), List.of("b", "c"));

        assertThat(tracker.getExecution(e.getId()).orElseThrow().getContext().getQualityGates())
                .containsExactly("a", "b", "c");
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    @Test
    void transitionRole_appendsExactlyOneTransition_andBumpsUpdatedAt() {
        Execution e = newExecution();
        Instant before = e.getUpdatedAt();

        Execution after = tracker.transitionRole(e.getId(), "senior-developer", "notes",
                List.of("use postgres"), "gates met").orElseThrow();

        assertThat(after.getCurrentRole()).isEqualTo("senior-developer");
        assertThat(after.getRoleHistory()).singleElement().satisfies(t -> {
            assertThat(t.fromRole()).isEqualTo("architect");
            assertThat(t.toRole()).isEqualTo("senior-developer");
            assertThat(t.handoffNotes()).isEqualTo("notes");
        });
        assertThat(after.getContext().getDecisions()).containsExactly("use postgres");
        assertThat(after.getUpdatedAt()).isAfter(before);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void pauseThenResume_restoresRunning_andKeepsProgress() {
        Execution e = newExecution();
        tracker.completeStep(e.getId(), "s1");
        tracker.addMetrics(e.getId(), MetricsDelta.created());
        tracker.recordQualityGates(e.getId(), List.of("code-complete"));

        Execution paused = tracker.pauseExecution(e.getId(), "waiting for review").orElseThrow();
        assertThat(paused.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(paused.getContext().getPauseReason()).isEqualTo("waiting for review");
        assertThat(paused.getContext().getPausedAt()).isNotNull();

        Execution resumed = tracker.resumeExecution(e.getId()).orElseThrow();
        assertThat(resumed.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(resumed.getContext().getPauseReason()).isNull();
        assertThat(resumed.getContext().getResumedAt()).isNotNull();
        assertThat(resumed.getCurrentRole()).isEqualTo("architect");
        assertThat(resumed.getCompletedSteps()).containsExactly("s1");
        assertThat(resumed.getMetrics().getFilesCreated()).isEqualTo(1);
        assertThat(resumed.getContext().getQualityGates()).containsExactly("code-complete");
    }

    @Test
    void completeAndTransition_whilePaused_areRejected() {
        Execution e = newExecution();
        tracker.pauseExecution(e.getId(), "hold");

        assertThatThrownBy(() -> tracker.completeExecution(e.getId(), ExecutionMetrics.zero()))
                .isInstanceOf(ExecutionStateException.class)
                .extracting("kind").isEqualTo(ExecutionStateException.Kind.NOT_RUNNING);
        assertThatThrownBy(() -> tracker.transitionRole(e.getId(), "senior-developer", "notes"))
                .isInstanceOf(ExecutionStateException.class)
                .hasMessage("Cannot transition execution " + e.getId() + ": execution is not running (PAUSED)");

        Execution stored = tracker.getExecution(e.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(stored.getCurrentRole()).isEqualTo("architect");
        assertThat(stored.getRoleHistory()).isEmpty();
        assertThat(stored.getCompletedAt()).isNull();
    }

    @Test
    void pause_whenPaused_isRejected() {
        Execution e = newExecution();
        tracker.pauseExecution(e.getId(), "first");

        assertThatThrownBy(() -> tracker.pauseExecution(e.getId(), "second"))
                .isInstanceOf(ExecutionStateException.class)
                .extracting("kind").isEqualTo(ExecutionStateException.Kind.NOT_RUNNING);
    }

    @Test
    void resume_whenRunning_isRejected() {
        Execution e = newExecution();

        assertThatThrownBy(() -> tracker.resumeExecution(e.getId()))
                .isInstanceOf(ExecutionStateException.class)
                .extracting("kind").isEqualTo(ExecutionStateException.Kind.NOT_PAUSED);
    }

    @Test
    void completeExecution_overwritesMetrics_andBlocksFurtherChanges() {
        Execution e = newExecution();
        tracker.addMetrics(e.getId(), MetricsDelta.created());
        ExecutionMetrics fin = new ExecutionMetrics(3, 2, 1, 75.0, 90.0);

        Execution done = tracker.completeExecution(e.getId(), fin).orElseThrow();

        assertThat(done.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(done.getCompletedAt()).isNotNull();
        assertThat(done.getMetrics()).isEqualTo(fin);
        assertThatThrownBy(() -> tracker.transitionRole(e.getId(), "code-review", "late"))
                .isInstanceOf(ExecutionStateException.class)
                .hasMessageContaining("execution is terminal");
        assertThatThrownBy(() -> tracker.completeStep(e.getId(), "s9"))
                .isInstanceOf(ExecutionStateException.class);
        assertThatThrownBy(() -> tracker.pauseExecution(e.getId(), "late"))
                .isInstanceOf(ExecutionStateException.class)
                .extracting("kind").isEqualTo(ExecutionStateException.Kind.TERMINAL);
        assertThatThrownBy(() -> tracker.resumeExecution(e.getId()))
                .isInstanceOf(ExecutionStateException.class)
                .extracting("kind").isEqualTo(ExecutionStateException.Kind.TERMINAL);
        assertThatThrownBy(() -> tracker.completeExecution(e.getId(), ExecutionMetrics.zero()))
                .isInstanceOf(ExecutionStateException.class)
                .extracting("kind").isEqualTo(ExecutionStateException.Kind.TERMINAL);
        assertThat(tracker.getExecution(e.getId()).orElseThrow().getMetrics()).isEqualTo(fin);
    }

    @Test
    void failExecution_recordsReason_andIsTerminal() {
        Execution e = newExecution();
        StepExecution s = tracker.addStepExecution(e.getId(), "s1", "architect", Map.of()).orElseThrow();

        Execution failed = tracker.failExecution(e.getId(), "bad config", new IllegalStateException("boom"))
                .orElseThrow();

        assertThat(failed.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.getContext().getFailureReason()).isEqualTo("bad config");
        assertThat(failed.getContext().getFailureError()).isEqualTo("boom");
        assertThat(failed.getContext().getFailedAt()).isNotNull();
        assertThatThrownBy(() -> tracker.pauseExecution(e.getId(), "x"))
                .isInstanceOf(ExecutionStateException.class)
                .extracting("kind").isEqualTo(ExecutionStateException.Kind.TERMINAL);
        assertThatThrownBy(() -> tracker.updateStepExecution(s.getId(),
                StepExecutionUpdate.status(StepStatus.RUNNING)))
                .isInstanceOf(ExecutionStateException.class);
    }

    // ------------------------------------------------------------------
    // Reporting
    // ------------------------------------------------------------------

    @Test
    void metricsReport_withNoSteps_hasZeroSuccessRate() {
        Execution e = newExecution();

        ExecutionMetricsReport report = tracker.getExecutionMetrics(e.getId()).orElseThrow();

        assertThat(report.totalSteps()).isZero();
        assertThat(report.successRate()).isZero();
        assertThat(report.averageStepTime()).isZero();
    }

    @Test
    void metricsReport_countsCompletedAttemptsAndTransitions() {
        Execution e = newExecution();
        StepExecution ok = tracker.addStepExecution(e.getId(), "s1", "architect", Map.of()).orElseThrow();
        StepExecution bad = tracker.addStepExecution(e.getId(), "s2", "architect", Map.of()).orElseThrow();
        tracker.updateStepExecution(ok.getId(), StepExecutionUpdate.status(StepStatus.RUNNING));
        tracker.updateStepExecution(ok.getId(), StepExecutionUpdate.completed("ok", List.of(), List.of()));
        tracker.updateStepExecution(bad.getId(), StepExecutionUpdate.failed("no", List.of()));
        tracker.transitionRole(e.getId(), "senior-developer", "n");

        ExecutionMetricsReport report = tracker.getExecutionMetrics(e.getId()).orElseThrow();

        assertThat(report.totalSteps()).isEqualTo(2);
        assertThat(report.completedSteps()).isEqualTo(1);
        assertThat(report.successRate()).isEqualTo(0.5);
        assertThat(report.averageStepTime()).isGreaterThanOrEqualTo(0);
        assertThat(report.roleTransitions()).isEqualTo(1);
    }

    @Test
    void history_listsStepsAndTransitions() {
        Execution e = newExecution();
        tracker.addStepExecution(e.getId(), "s1", "architect", Map.of());
        tracker.transitionRole(e.getId(), "senior-developer", "n");

        ExecutionHistory history = tracker.getExecutionHistory(e.getId()).orElseThrow();

        assertThat(history.stepExecutions()).extracting(StepExecution::getStepId).containsExactly("s1");
        assertThat(history.roleTransitions()).hasSize(1);
    }

    @Test
    void queriesByStatusAndRole() {
        Execution a = newExecution();
        Execution b = newExecution();
        tracker.pauseExecution(b.getId(), "x");

        assertThat(tracker.getExecutionsByStatus(ExecutionStatus.PAUSED)).extracting(Execution::getId)
                .containsExactly(b.getId());
        assertThat(tracker.getExecutionsByRole("architect")).extracting(Execution::getId)
                .containsExactlyInAnyOrder(a.getId(), b.getId());
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentMetricUpdates_areNotLost() throws Exception {
        Execution e = newExecution();
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) tracker.addMetrics(e.getId(), MetricsDelta.modified());
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        assertThat(tracker.getExecution(e.getId()).orElseThrow().getMetrics().getFilesModified())
                .isEqualTo(threads * perThread);
    }

    @Test
    void concurrentStepAndExecutionUpdates_areNotLost() throws Exception {
        Execution e = newExecution();
        StepExecution s = tracker.addStepExecution(e.getId(), "s1", "architect", Map.of()).orElseThrow();
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.addQualityCheck(s.getId(), new QualityCheckResult(
                                "r" + thread + "-" + i, "R", null, CheckStatus.PASS, "ok", List.of()));
                        tracker.addMetrics(e.getId(), MetricsDelta.created());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        assertThat(tracker.getStepExecution(s.getId()).orElseThrow().getQualityChecks())
                .hasSize(threads * perThread);
        assertThat(tracker.getExecution(e.getId()).orElseThrow().getMetrics().getFilesCreated())
                .isEqualTo(threads * perThread);
    }

    @Test
    void lockTable_doesNotGrowWithExecutions() {
        int before = tracker.lockTableSize();

        for (int i = 0; i < 500; i++) {
            Execution e = newExecution();
            tracker.addStepExecution(e.getId(), "s1", "architect", Map.of())
                    .ifPresent(s -> tracker.addQualityCheck(s.getId(),
                            new QualityCheckResult("r", "R", null, CheckStatus.PASS, "ok", List.of())));
            tracker.completeExecution(e.getId(), ExecutionMetrics.zero());
        }

        assertThat(tracker.lockTableSize()).isEqualTo(before).isEqualTo(ExecutionTracker.LOCK_STRIPES);
    }

    private Execution newExecution() {
        return tracker.createExecution("wf", "architect", "general", "/tmp/project", Map.of());
    }
}
