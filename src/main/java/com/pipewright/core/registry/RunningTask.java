package com.pipewright.core.registry;

import com.pipewright.worker.WorkerHandle;

import java.time.Instant;

/**
 * A task whose worker is currently alive.
 *
 * @param name      task name
 * @param port      port assigned to the worker
 * @param handle    handle used to poll and stop the worker
 * @param startedAt when the worker was spawned
 */
public record RunningTask(
    String name,
    int port,
    WorkerHandle handle,
    Instant startedAt
) {}
