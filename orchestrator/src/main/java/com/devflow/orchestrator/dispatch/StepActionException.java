package com.devflow.orchestrator.dispatch;

/**
 * Thrown by a {@link StepActionHandler} when a step cannot be carried out.
 *
 * The dispatcher turns it into a failed step result; it never escapes
 * {@link StepActionDispatcher#executeStep}.
 */
public class StepActionException extends RuntimeException {

    public enum Kind { PATH_ESCAPE, TARGET_MISSING, TEMPLATE_MISSING, IO_ERROR }

    private final Kind kind;

    public StepActionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StepActionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
