package com.pipewright.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, consumed by the CLI progress printer.
 *
 * @param eventType event type, e.g. "run.started", "task.completed"
 * @param runId     the run this event belongs to
 * @param taskName  the task this event relates to (nullable for run- and level-wide events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String taskName,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static final String RUN_STARTED = "run.started";
    public static final String LEVEL_STARTED = "level.started";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_PHASE = "task.phase";
    public static final String TASK_SKIPPED = "task.skipped";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String LEVEL_COMPLETED = "level.completed";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";
    public static final String RUN_CANCELLED = "run.cancelled";

    public static PipelineEvent of(String eventType, String runId, String taskName, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, taskName, payload, Instant.now());
    }
}
