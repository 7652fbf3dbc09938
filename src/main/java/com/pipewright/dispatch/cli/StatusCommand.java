package com.pipewright.dispatch.cli;

import com.pipewright.core.registry.RunningTaskRegistry;
import com.pipewright.worker.AgentApiClient;
import com.pipewright.worker.WorkerException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.util.Map;

/**
 * CLI command: pipewright status
 * <p>
 * Shows the workers of the in-flight run, as recorded in the running-task snapshot, and
 * asks each one for its current status.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show running workers")
@Component
public class StatusCommand implements Runnable {

    private final RunningTaskRegistry registry;
    private final AgentApiClient client;

    public StatusCommand(RunningTaskRegistry registry, AgentApiClient client) {
        this.registry = registry;
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Map<String, RunningTaskRegistry.Entry> running;
        try {
            running = RunningTaskRegistry.loadSnapshot(registry.snapshotPath());
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + registry.snapshotPath() + ": " + e.getMessage());
            return;
        }
        if (running.isEmpty()) {
            ConsoleOutput.info("No running workers.");
            return;
        }

        System.out.printf("  %-14s %-6s %-8s %s%n", "TASK", "PORT", "PID", "STATUS");
        System.out.println("  " + "-".repeat(48));
        for (var entry : running.entrySet()) {
            var worker = entry.getValue();
            String status;
            try {
                status = client.status(worker.port()).name().toLowerCase();
            } catch (WorkerException e) {
                status = "unreachable";
            }
            System.out.printf("  %-14s %-6d %-8s %s%n", entry.getKey(), worker.port(),
                    worker.pid() != null ? worker.pid() : "-", status);
        }
    }
}
