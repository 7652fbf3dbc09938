package com.pipewright.dispatch.cli;

import com.pipewright.core.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments, delegates to the appropriate command and hands its exit code to Boot.
 * <p>
 * Exit codes: 0 success, 1 failed run or configuration error, 2 usage error.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final PipewrightCommand pipewrightCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PipewrightCommand pipewrightCommand, IFactory factory) {
        this.pipewrightCommand = pipewrightCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(pipewrightCommand, factory).execute(args);
        log.debug("pipewright exiting with code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Builds the command line used for every invocation. A {@link ConfigurationException} from
     * any subcommand is printed as a one-line error; anything else is logged with its stack
     * trace. Both exit with {@link #EXIT_FAILURE}.
     */
    static CommandLine commandLine(PipewrightCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof ConfigurationException) {
                        ConsoleOutput.error(ex.getMessage());
                    } else {
                        log.error("Command '{}' failed", cmd.getCommandName(), ex);
                        ConsoleOutput.error(cmd.getCommandName() + " failed: " + ex.getMessage());
                    }
                    return EXIT_FAILURE;
                });
    }
}
