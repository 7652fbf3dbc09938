package com.pipewright.dispatch.cli;

import com.pipewright.core.registry.TaskDefinitionProvider;
import com.pipewright.core.scheduler.DependencyScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: pipewright tasks
 * <p>
 * Lists the configured tasks with their outputs and dependencies, and the dependency
 * levels a full run would execute.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List tasks and execution levels")
@Component
public class TasksCommand implements Runnable {

    private final TaskDefinitionProvider definitions;
    private final DependencyScheduler scheduler;

    public TasksCommand(TaskDefinitionProvider definitions, DependencyScheduler scheduler) {
        this.definitions = definitions;
        this.scheduler = scheduler;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        System.out.printf("  %-14s %-28s %s%n", "TASK", "OUTPUT", "DEPENDS ON");
        System.out.println("  " + "-".repeat(64));
        for (String name : definitions.taskNames()) {
            var def = definitions.find(name).orElseThrow();
            System.out.printf("  %-14s %-28s %s%n", def.name(), def.outputPath(),
                    def.dependsOn().isEmpty() ? "-" : String.join(", ", def.dependsOn()));
        }

        System.out.println();
        List<List<String>> levels = scheduler.dependencyLevels(definitions.taskNames());
        for (int i = 0; i < levels.size(); i++) {
            ConsoleOutput.info("Level " + (i + 1) + ": " + String.join(", ", levels.get(i)));
        }
    }
}
