package com.pipewright.dispatch.cli;

import com.pipewright.core.engine.RunResult;
import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.model.ExecutionResult;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Pipewright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PIPEWRIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PIPEWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void level(int index, int taskCount) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [LEVEL " + (index + 1) + "]|@ starting " +
                taskCount + " task" + (taskCount != 1 ? "s" : "")));
    }

    /**
     * Progress line for a run event; events without a console representation are ignored.
     */
    public static void event(PipelineEvent event) {
        var payload = event.payload();
        switch (event.eventType()) {
            case PipelineEvent.LEVEL_STARTED -> {
                Object tasks = payload.get("tasks");
                level(((Number) payload.get("level")).intValue(),
                        tasks instanceof List<?> list ? list.size() : 0);
            }
            case PipelineEvent.TASK_STARTED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(blue) [TASK]|@ " + event.taskName() + " started -> " + payload.get("output")));
            case PipelineEvent.TASK_SKIPPED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(white) SKIP|@ " + event.taskName() + " (" + payload.get("reason") + ")"));
            case PipelineEvent.TASK_COMPLETED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) DONE|@ " + event.taskName() + " in "
                            + formatDuration(((Number) payload.get("durationMs")).longValue())));
            case PipelineEvent.TASK_FAILED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) FAIL|@ " + event.taskName() + ": " + payload.get("error")));
            default -> { }
        }
    }

    public static void summary(RunResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + result.runId() + "|@"));
        for (ExecutionResult r : result.results()) {
            String status = r.skipped() ? "@|fg(white) skipped|@"
                    : r.succeeded() ? "@|fg(green) completed|@"
                    : "@|fg(red) " + r.failureKind().name().toLowerCase() + "|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    String.format("  %-14s ", r.task()) + status + "  " + r.outputPath()));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + result.succeededCount() + " ok|@ (" + result.skippedCount()
                        + " skipped), @|fg(red) " + result.failedCount() + " failed|@"));
        if (result.cancelled()) {
            error("Run cancelled.");
        } else if (result.success()) {
            success("Run complete.");
        } else {
            error("Run failed: " + result.error());
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
