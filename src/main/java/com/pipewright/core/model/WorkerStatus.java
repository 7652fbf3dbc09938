package com.pipewright.core.model;

/**
 * The two states a worker reports while it is reachable.
 */
public enum WorkerStatus {
    /** Processing input. */
    BUSY,
    /** Waiting for input. */
    IDLE
}
