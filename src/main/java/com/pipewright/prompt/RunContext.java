package com.pipewright.prompt;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Run-wide values available to payload templates.
 *
 * @param primaryInput main input file
 * @param inputFiles   all input files
 * @param inputDir     directory the input files live in
 * @param outputDir    directory task outputs are written under
 * @param persona      configured persona
 * @param stack        technology stack entries
 * @param preferences  architecture preference entries
 * @param taskOutputs  resolved output path of every task in the run, by task name
 */
public record RunContext(
    Path primaryInput,
    List<Path> inputFiles,
    Path inputDir,
    Path outputDir,
    String persona,
    Map<String, String> stack,
    Map<String, String> preferences,
    Map<String, Path> taskOutputs
) {
    public RunContext {
        inputFiles = List.copyOf(inputFiles);
        stack = Map.copyOf(stack);
        preferences = Map.copyOf(preferences);
        taskOutputs = Map.copyOf(taskOutputs);
    }
}
