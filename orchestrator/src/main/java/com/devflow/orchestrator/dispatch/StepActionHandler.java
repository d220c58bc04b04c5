package com.devflow.orchestrator.dispatch;

/**
 * Carries out one {@link ActionKind} against the project workspace.
 *
 * Handlers are Spring {@code @Component}s collected by
 * {@link StepActionDispatcher}; exactly one handler must exist per kind.
 */
public interface StepActionHandler {

    ActionKind kind();

    /**
     * @throws StepActionException when the target is missing, escapes the
     *                             project root, or cannot be read or written
     */
    ActionOutcome execute(StepRequest request) throws StepActionException;
}
