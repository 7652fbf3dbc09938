package com.pipewright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Pipewright.
 * Routes to subcommands: run, tasks, status, stop.
 */
@Command(
        name = "pipewright",
        mixinStandardHelpOptions = true,
        version = "Pipewright 0.1.0",
        description = "Runs dependent agent tasks, each in its own supervised worker",
        subcommands = {
                RunCommand.class,
                TasksCommand.class,
                StatusCommand.class,
                StopCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PipewrightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
