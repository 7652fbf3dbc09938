package com.pipewright.core.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * What a task's output looked like when it was last generated, and what it was generated from.
 *
 * @param outputPath             path of the output file
 * @param outputHash             hash of the output content
 * @param inputHashAtGeneration  run input hash at generation time
 * @param configHashAtGeneration configuration hash at generation time
 * @param dependencyHashes       dependency name → that dependency's output hash at generation time
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskOutputRecord(
    String outputPath,
    String outputHash,
    String inputHashAtGeneration,
    String configHashAtGeneration,
    Map<String, String> dependencyHashes
) {
    public TaskOutputRecord {
        dependencyHashes = dependencyHashes != null ? Map.copyOf(dependencyHashes) : Map.of();
    }
}
