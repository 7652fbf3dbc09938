package com.pipewright.core.lifecycle;

import com.pipewright.worker.WorkerProperties;

import java.time.Duration;

/**
 * Poll intervals and bounds of the lifecycle phases.
 */
public record LifecycleSettings(
    Duration healthTimeout,
    Duration stabilizeTimeout,
    Duration healthPollInterval,
    Duration pollInterval,
    int maxConsecutivePollFailures
) {
    public static LifecycleSettings from(WorkerProperties properties) {
        return new LifecycleSettings(
                Duration.ofSeconds(properties.getHealthTimeoutSeconds()),
                Duration.ofSeconds(properties.getStabilizeTimeoutSeconds()),
                Duration.ofMillis(properties.getHealthPollMillis()),
                Duration.ofMillis(properties.getPollIntervalMillis()),
                properties.getMaxConsecutivePollFailures());
    }
}
