package com.pipewright.core.lifecycle;

import com.pipewright.core.model.FailureKind;

/**
 * Ends a task lifecycle in {@link com.pipewright.core.model.TaskPhase#FAILED}.
 * Always converted to a failed result before it reaches the coordinator's caller.
 */
public class TaskFailureException extends Exception {

    private final FailureKind kind;

    public TaskFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TaskFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
