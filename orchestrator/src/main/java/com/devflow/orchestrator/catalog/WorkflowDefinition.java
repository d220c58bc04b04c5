package com.devflow.orchestrator.catalog;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * An ordered set of steps plus workflow-level quality checks, independent of
 * any execution.
 */
public record WorkflowDefinition(
        String             id,
        String             name,
        String             description,
        List<WorkflowStep> steps,
        List<String>       qualityChecks,
        List<String>       tags) {

    public WorkflowDefinition {
        steps         = steps == null ? List.of() : List.copyOf(steps);
        qualityChecks = qualityChecks == null ? List.of() : List.copyOf(qualityChecks);
        tags          = tags == null ? List.of() : List.copyOf(tags);
    }

    public Optional<WorkflowStep> step(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    /** Steps sorted by their order index; ties keep declaration order. */
    public List<WorkflowStep> orderedSteps() {
        return steps.stream().sorted(Comparator.comparingInt(WorkflowStep::order)).toList();
    }
}
