package com.pipewright.dispatch.cli;

import com.pipewright.core.registry.RunningTaskRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: pipewright stop [task] [--all]
 * <p>
 * Terminates workers recorded in the running-task snapshot by pid, descendants first.
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop running workers")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Task whose worker to stop")
    private String task;

    @Option(names = {"--all", "-a"}, description = "Stop every worker and clear the snapshot")
    private boolean all;

    private final RunningTaskRegistry registry;

    public StopCommand(RunningTaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        if (task == null && !all) {
            ConsoleOutput.error("Name a task or pass --all");
            return 2;
        }

        Map<String, RunningTaskRegistry.Entry> running;
        try {
            running = RunningTaskRegistry.loadSnapshot(registry.snapshotPath());
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + registry.snapshotPath() + ": " + e.getMessage());
            return 1;
        }

        int stopped = 0;
        for (var entry : running.entrySet()) {
            if (!all && !entry.getKey().equals(task)) continue;
            if (terminate(entry.getKey(), entry.getValue())) stopped++;
        }
        if (!all && !running.containsKey(task)) {
            ConsoleOutput.error("No running worker for task " + task);
            return 1;
        }

        if (all) {
            try {
                RunningTaskRegistry.clearSnapshot(registry.snapshotPath());
            } catch (IOException e) {
                ConsoleOutput.error("Cannot delete " + registry.snapshotPath() + ": " + e.getMessage());
            }
        }
        ConsoleOutput.info("Stopped " + stopped + " worker" + (stopped != 1 ? "s" : ""));
        return 0;
    }

    private static boolean terminate(String name, RunningTaskRegistry.Entry entry) {
        if (entry.pid() == null) {
            ConsoleOutput.error(name + ": no pid recorded (port " + entry.port() + ")");
            return false;
        }
        var process = ProcessHandle.of(entry.pid());
        if (process.isEmpty() || !process.get().isAlive()) {
            ConsoleOutput.info(name + ": pid " + entry.pid() + " is not running");
            return false;
        }
        process.get().descendants().forEach(ProcessHandle::destroy);
        process.get().destroy();
        ConsoleOutput.success("Stopped " + name + " (pid " + entry.pid() + ", port " + entry.port() + ")");
        return true;
    }
}
