package com.pipewright.worker;

import com.pipewright.core.model.WorkerStatus;

/**
 * Abstraction over the external worker processes that execute tasks.
 * Implementations: {@link AgentApiWorkerProvider} (local agentapi processes).
 */
public interface WorkerProvider {

    /**
     * Starts a worker bound to the given port. Returns once the process is launched;
     * the worker may not answer requests yet.
     */
    WorkerHandle spawn(String taskName, int port) throws WorkerException;

    /**
     * Queries the worker's current state.
     *
     * @throws WorkerException when the worker is unreachable or answers with an unknown state
     */
    WorkerStatus pollStatus(WorkerHandle handle) throws WorkerException;

    /**
     * Sends the rendered task payload to the worker.
     */
    void dispatch(WorkerHandle handle, String payload) throws WorkerException;

    /**
     * Stops the worker and releases its resources. Never throws.
     */
    void stop(WorkerHandle handle);
}
