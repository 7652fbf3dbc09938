package com.pipewright.core.model;

/**
 * Why a task ended in {@link TaskPhase#FAILED}.
 */
public enum FailureKind {
    SPAWN("failed to spawn worker"),
    HEALTH_CHECK_TIMEOUT("worker never became healthy"),
    STABILIZE_TIMEOUT("worker never became idle"),
    RENDER("failed to render task payload"),
    DISPATCH("failed to dispatch task"),
    POLL_TIMEOUT("timed out waiting for completion"),
    CRASH_DETECTED("worker stopped responding"),
    OUTPUT_MISSING("worker reported done but produced no output"),
    CANCELLED("cancelled"),
    INFRASTRUCTURE("infrastructure error");

    private final String summary;

    FailureKind(String summary) {
        this.summary = summary;
    }

    public String summary() {
        return summary;
    }
}
