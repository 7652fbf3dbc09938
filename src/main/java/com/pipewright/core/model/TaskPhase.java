package com.pipewright.core.model;

/**
 * Lifecycle phases a task passes through while its worker is supervised.
 * Any non-terminal phase may transition to {@link #FAILED}.
 */
public enum TaskPhase {
    PENDING,
    SPAWNING,
    HEALTH_CHECKING,
    STABILIZING,
    DISPATCHING,
    POLLING,
    VERIFYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
