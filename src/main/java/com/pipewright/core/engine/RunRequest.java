package com.pipewright.core.engine;

import com.pipewright.core.model.CacheMode;
import com.pipewright.core.model.ExecutionStrategy;

import java.nio.file.Path;
import java.util.List;

/**
 * Options of one run.
 *
 * @param taskNames      requested tasks; empty means every task. Dependencies are added automatically
 * @param strategy       sequential or level-parallel execution
 * @param cacheMode      how recorded outputs are treated
 * @param timeoutSeconds per-task bound on the polling phase, 0 for none
 * @param outputDir      directory outputs and resume state are written under
 * @param inputPath      requirements file or directory
 * @param persona        persona override, {@code null} for the configured one
 */
public record RunRequest(
    List<String> taskNames,
    ExecutionStrategy strategy,
    CacheMode cacheMode,
    int timeoutSeconds,
    Path outputDir,
    Path inputPath,
    String persona
) {
    public RunRequest {
        taskNames = taskNames == null ? List.of() : List.copyOf(taskNames);
        strategy = strategy == null ? ExecutionStrategy.PARALLEL : strategy;
        cacheMode = cacheMode == null ? CacheMode.NORMAL : cacheMode;
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must not be negative");
        }
    }
}
