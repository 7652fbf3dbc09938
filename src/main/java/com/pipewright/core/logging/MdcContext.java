package com.pipewright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Pipewright MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_NAME = "taskName";
    public static final String LEVEL = "level";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, String taskName) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_NAME, taskName);
    }

    public static void setLevel(String runId, int level) {
        MDC.put(RUN_ID, runId);
        MDC.put(LEVEL, String.valueOf(level));
    }

    public static void clearTask() {
        MDC.remove(TASK_NAME);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_NAME);
        MDC.remove(LEVEL);
    }
}
