package com.pipewright.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Static definition of one pipeline task: the artifact it produces (relative to the
 * run's output directory) and the tasks whose artifacts it consumes.
 *
 * @param name       unique task name, e.g. "architect"
 * @param outputPath output file path, relative to the output directory
 * @param dependsOn  names of tasks that must complete before this one
 */
public record TaskDefinition(
    String name,
    String outputPath,
    List<String> dependsOn
) {
    public TaskDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(outputPath, "outputPath");
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    public static TaskDefinition of(String name, String outputPath, String... dependsOn) {
        return new TaskDefinition(name, outputPath, List.of(dependsOn));
    }
}
