package com.pipewright.core.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of one task in one run. Skipped tasks count as successful so that
 * their dependents treat the recorded artifact as available.
 *
 * @param task        task name
 * @param outputPath  absolute path of the task's artifact
 * @param error       failure description, {@code null} on success
 * @param failureKind failure classification, {@code null} on success
 * @param duration    wall-clock time spent on the task
 * @param skipped     true when the recorded output was reused
 * @param detail      skip reason for skipped tasks, otherwise {@code null}
 */
public record ExecutionResult(
    String task,
    Path outputPath,
    String error,
    FailureKind failureKind,
    Duration duration,
    boolean skipped,
    String detail
) {
    public static ExecutionResult completed(String task, Path outputPath, Duration duration) {
        return new ExecutionResult(task, outputPath, null, null, duration, false, null);
    }

    public static ExecutionResult skipped(String task, Path outputPath, String reason) {
        return new ExecutionResult(task, outputPath, null, null, Duration.ZERO, true, reason);
    }

    public static ExecutionResult failed(String task, Path outputPath, FailureKind kind,
                                         String error, Duration duration) {
        return new ExecutionResult(task, outputPath, error, kind, duration, false, null);
    }

    public boolean succeeded() {
        return error == null;
    }
}
