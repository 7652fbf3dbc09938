package com.pipewright.core.lifecycle;

import com.pipewright.core.model.ExecutionResult;
import com.pipewright.core.model.FailureKind;
import com.pipewright.core.model.TaskDefinition;
import com.pipewright.core.model.TaskPhase;
import com.pipewright.core.model.WorkerStatus;
import com.pipewright.core.registry.RunningTask;
import com.pipewright.core.registry.RunningTaskRegistry;
import com.pipewright.worker.WorkerException;
import com.pipewright.worker.WorkerHandle;
import com.pipewright.worker.WorkerProperties;
import com.pipewright.worker.WorkerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Supervises one task's worker from spawn to verified output.
 *
 * <p>Flow: spawn -> wait until the worker answers -> wait until it is idle -> send the
 * payload -> poll until busy-then-idle -> check that the output exists. Every wait
 * observes the {@link CancellationToken}. Whatever ends the lifecycle, the worker is
 * removed from the {@link RunningTaskRegistry} and stopped exactly once.
 */
@Service
public class TaskLifecycleExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleExecutor.class);

    private final WorkerProvider provider;
    private final RunningTaskRegistry registry;
    private final LifecycleSettings settings;

    @Autowired
    public TaskLifecycleExecutor(WorkerProvider provider, RunningTaskRegistry registry,
                                 WorkerProperties properties) {
        this(provider, registry, LifecycleSettings.from(properties));
    }

    TaskLifecycleExecutor(WorkerProvider provider, RunningTaskRegistry registry, LifecycleSettings settings) {
        this.provider = provider;
        this.registry = registry;
        this.settings = settings;
    }

    public ExecutionResult execute(TaskDefinition task, Path outputPath, String payload,
                                   Duration timeout, CancellationToken cancellation) {
        return execute(task, outputPath, payload, timeout, cancellation, PhaseListener.NONE);
    }

    /**
     * Runs the full lifecycle of {@code task}.
     *
     * @param outputPath   resolved path of the artifact the worker must produce
     * @param payload      fully rendered message for the worker
     * @param timeout      bound on the polling phase; zero or negative polls indefinitely
     * @param cancellation run-wide cancellation signal
     * @param listener     phase transition callback
     * @return a completed result, or a failed one carrying the {@link FailureKind}
     */
    public ExecutionResult execute(TaskDefinition task, Path outputPath, String payload, Duration timeout,
                                   CancellationToken cancellation, PhaseListener listener) {
        String name = task.name();
        long start = System.nanoTime();
        try {
            enter(name, TaskPhase.SPAWNING, listener);
            WorkerHandle handle = spawn(name, cancellation);

            enter(name, TaskPhase.HEALTH_CHECKING, listener);
            awaitHealthy(handle, cancellation);

            enter(name, TaskPhase.STABILIZING, listener);
            awaitIdle(handle, cancellation);

            enter(name, TaskPhase.DISPATCHING, listener);
            dispatch(handle, payload, cancellation);

            enter(name, TaskPhase.POLLING, listener);
            awaitCompletion(handle, timeout, cancellation);

            enter(name, TaskPhase.VERIFYING, listener);
            if (!Files.exists(outputPath)) {
                throw new TaskFailureException(FailureKind.OUTPUT_MISSING,
                        FailureKind.OUTPUT_MISSING.summary() + ": " + outputPath);
            }

            enter(name, TaskPhase.COMPLETED, listener);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Task {} completed in {}ms", name, elapsed.toMillis());
            return ExecutionResult.completed(name, outputPath, elapsed);
        } catch (TaskFailureException e) {
            enter(name, TaskPhase.FAILED, listener);
            log.warn("Task {} failed ({}): {}", name, e.kind(), e.getMessage());
            return ExecutionResult.failed(name, outputPath, e.kind(), e.getMessage(),
                    Duration.ofNanos(System.nanoTime() - start));
        } finally {
            release(name);
        }
    }

    private WorkerHandle spawn(String name, CancellationToken cancellation) throws TaskFailureException {
        checkCancelled(cancellation);
        int port = registry.allocatePort();
        WorkerHandle handle;
        try {
            handle = provider.spawn(name, port);
        } catch (WorkerException e) {
            throw new TaskFailureException(FailureKind.SPAWN,
                    FailureKind.SPAWN.summary() + " on port " + port + ": " + e.getMessage(), e);
        }
        registry.add(new RunningTask(name, port, handle, Instant.now()));
        return handle;
    }

    private void awaitHealthy(WorkerHandle handle, CancellationToken cancellation) throws TaskFailureException {
        long deadline = System.nanoTime() + settings.healthTimeout().toNanos();
        String lastError = "no response";
        while (true) {
            checkCancelled(cancellation);
            try {
                provider.pollStatus(handle);
                log.debug("Worker for {} is healthy on port {}", handle.taskName(), handle.port());
                return;
            } catch (WorkerException e) {
                lastError = e.getMessage();
            }
            if (handle.process() != null && !handle.process().isAlive()) {
                throw new TaskFailureException(FailureKind.SPAWN,
                        "worker process exited before becoming healthy: " + lastError);
            }
            if (System.nanoTime() >= deadline) {
                throw new TaskFailureException(FailureKind.HEALTH_CHECK_TIMEOUT,
                        FailureKind.HEALTH_CHECK_TIMEOUT.summary() + " within "
                                + settings.healthTimeout().toSeconds() + "s: " + lastError);
            }
            sleep(settings.healthPollInterval(), cancellation);
        }
    }

    private void awaitIdle(WorkerHandle handle, CancellationToken cancellation) throws TaskFailureException {
        long deadline = System.nanoTime() + settings.stabilizeTimeout().toNanos();
        while (true) {
            checkCancelled(cancellation);
            try {
                if (provider.pollStatus(handle) == WorkerStatus.IDLE) {
                    return;
                }
            } catch (WorkerException e) {
                log.debug("Status poll for {} failed while stabilizing: {}", handle.taskName(), e.getMessage());
            }
            if (System.nanoTime() >= deadline) {
                throw new TaskFailureException(FailureKind.STABILIZE_TIMEOUT,
                        FailureKind.STABILIZE_TIMEOUT.summary() + " within "
                                + settings.stabilizeTimeout().toSeconds() + "s");
            }
            sleep(settings.healthPollInterval(), cancellation);
        }
    }

    private void dispatch(WorkerHandle handle, String payload, CancellationToken cancellation)
            throws TaskFailureException {
        checkCancelled(cancellation);
        try {
            provider.dispatch(handle, payload);
        } catch (WorkerException e) {
            throw new TaskFailureException(FailureKind.DISPATCH,
                    FailureKind.DISPATCH.summary() + ": " + e.getMessage(), e);
        }
    }

    private void awaitCompletion(WorkerHandle handle, Duration timeout, CancellationToken cancellation)
            throws TaskFailureException {
        boolean bounded = timeout != null && !timeout.isZero() && !timeout.isNegative();
        long deadline = bounded ? System.nanoTime() + timeout.toNanos() : Long.MAX_VALUE;
        var tracker = new CompletionTracker(settings.maxConsecutivePollFailures());

        while (true) {
            checkCancelled(cancellation);
            try {
                if (tracker.observe(provider.pollStatus(handle))) {
                    return;
                }
            } catch (WorkerException e) {
                log.debug("Status poll for {} failed ({} in a row): {}",
                        handle.taskName(), tracker.consecutiveFailures() + 1, e.getMessage());
                if (tracker.recordFailure()) {
                    throw new TaskFailureException(FailureKind.CRASH_DETECTED,
                            FailureKind.CRASH_DETECTED.summary() + " after "
                                    + tracker.consecutiveFailures() + " failed polls: " + e.getMessage(), e);
                }
            }
            if (bounded && System.nanoTime() >= deadline) {
                throw new TaskFailureException(FailureKind.POLL_TIMEOUT,
                        FailureKind.POLL_TIMEOUT.summary() + " after " + timeout.toSeconds() + "s");
            }
            sleep(settings.pollInterval(), cancellation);
        }
    }

    private void release(String name) {
        registry.remove(name).ifPresent(running -> {
            try {
                provider.stop(running.handle());
            } catch (RuntimeException e) {
                log.warn("Failed to stop worker for {}: {}", name, e.getMessage());
            }
        });
    }

    private static void sleep(Duration interval, CancellationToken cancellation) throws TaskFailureException {
        if (cancellation.await(interval)) {
            throw cancelled();
        }
    }

    private static void checkCancelled(CancellationToken cancellation) throws TaskFailureException {
        if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw cancelled();
        }
    }

    private static TaskFailureException cancelled() {
        return new TaskFailureException(FailureKind.CANCELLED, FailureKind.CANCELLED.summary());
    }

    private static void enter(String task, TaskPhase phase, PhaseListener listener) {
        log.debug("Task {} -> {}", task, phase);
        try {
            listener.onPhase(task, phase);
        } catch (RuntimeException e) {
            log.warn("Phase listener failed for {} at {}: {}", task, phase, e.getMessage());
        }
    }
}
