package com.pipewright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline runs.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "completed" or the lower-cased failure kind
     */
    public void recordTaskExecution(String task, String outcome, Duration duration) {
        Timer.builder("pipewright.task.duration")
                .tag("task", task)
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordTaskSkipped(String task) {
        Counter.builder("pipewright.task.skipped")
                .description("Tasks whose recorded output was reused")
                .tag("task", task)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("pipewright.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordLevelExecution(int taskCount, String strategy) {
        DistributionSummary.builder("pipewright.level.task_count")
                .description("Number of tasks per dependency level")
                .tag("strategy", strategy)
                .register(registry)
                .record(taskCount);
    }
}
