package com.pipewright.core.lifecycle;

import com.pipewright.core.model.WorkerStatus;

/**
 * Completion detection for the polling phase.
 *
 * <p>A task is complete only once the worker has been seen {@code BUSY} and then reports
 * {@code IDLE} again. An idle answer before the first busy one means the worker has not
 * picked up the message yet. Any successful poll resets the failure streak.
 */
public class CompletionTracker {

    private final int maxConsecutiveFailures;
    private boolean observedRunning;
    private int consecutiveFailures;

    public CompletionTracker(int maxConsecutiveFailures) {
        if (maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be positive");
        }
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    /**
     * Records a successful poll.
     *
     * @return true when the task is complete
     */
    public boolean observe(WorkerStatus status) {
        consecutiveFailures = 0;
        if (status == WorkerStatus.BUSY) {
            observedRunning = true;
            return false;
        }
        return observedRunning;
    }

    /**
     * Records a failed poll.
     *
     * @return true when the failure streak reached the crash threshold
     */
    public boolean recordFailure() {
        consecutiveFailures++;
        return consecutiveFailures >= maxConsecutiveFailures;
    }

    public boolean observedRunning() {
        return observedRunning;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }
}
