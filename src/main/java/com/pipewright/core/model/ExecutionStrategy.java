package com.pipewright.core.model;

/**
 * Strategy for executing the tasks of a run.
 * <p>
 * SEQUENTIAL: one task at a time in topological order, stopping at the first failure.
 * PARALLEL: every task of a dependency level at once, stopping after a level with a failure.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL
}
