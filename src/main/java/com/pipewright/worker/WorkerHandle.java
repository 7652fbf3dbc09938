package com.pipewright.worker;

/**
 * Opaque handle to a spawned worker.
 *
 * @param taskName task the worker serves
 * @param port     port the worker's API listens on
 * @param process  local process, or {@code null} for a worker not started by this JVM
 */
public record WorkerHandle(
    String taskName,
    int port,
    Process process
) {
    public Long pid() {
        return process != null ? process.pid() : null;
    }
}
