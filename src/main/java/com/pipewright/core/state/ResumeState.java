package com.pipewright.core.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Persisted resume state of one output directory.
 *
 * @param inputHash   combined hash of the run's input files
 * @param configHash  hash of persona, stack and preferences
 * @param taskOutputs task name → output record
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResumeState(
    String inputHash,
    String configHash,
    Map<String, TaskOutputRecord> taskOutputs
) {
    public ResumeState {
        taskOutputs = taskOutputs != null ? Map.copyOf(taskOutputs) : Map.of();
    }

    public static ResumeState empty() {
        return new ResumeState("", "", Map.of());
    }
}
