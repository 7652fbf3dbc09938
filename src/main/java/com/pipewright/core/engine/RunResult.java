package com.pipewright.core.engine;

import com.pipewright.core.model.ExecutionResult;

import java.util.List;

/**
 * Outcome of a run. {@code results} holds every task that was attempted or skipped, in
 * the order they finished; tasks never reached after a failure are absent.
 *
 * @param runId     identifier used in logs and events
 * @param results   per-task results
 * @param success   true when every task of the expanded set succeeded or was skipped
 * @param cancelled true when the run was interrupted
 * @param error     first failure message, {@code null} on success
 */
public record RunResult(
    String runId,
    List<ExecutionResult> results,
    boolean success,
    boolean cancelled,
    String error
) {
    public RunResult {
        results = List.copyOf(results);
    }

    public long succeededCount() {
        return results.stream().filter(ExecutionResult::succeeded).count();
    }

    public long failedCount() {
        return results.stream().filter(r -> !r.succeeded()).count();
    }

    public long skippedCount() {
        return results.stream().filter(ExecutionResult::skipped).count();
    }
}
