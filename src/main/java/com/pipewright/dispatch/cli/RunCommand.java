package com.pipewright.dispatch.cli;

import com.pipewright.core.config.PipelineProperties;
import com.pipewright.core.engine.RunCoordinator;
import com.pipewright.core.engine.RunRequest;
import com.pipewright.core.engine.RunResult;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.lifecycle.CancellationToken;
import com.pipewright.core.model.CacheMode;
import com.pipewright.core.model.ExecutionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: pipewright run [INPUT] [-t task]...
 * <p>
 * Runs the requested tasks (all tasks by default) plus their dependencies. Ctrl-C cancels
 * the run; running workers are stopped before the process exits.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run tasks against an input file or directory")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 60;

    @Parameters(index = "0", arity = "0..1", defaultValue = ".",
            description = "Requirements file or directory (default: ${DEFAULT-VALUE})")
    private Path input;

    @Option(names = {"--task", "-t"}, description = "Task to run, repeatable; dependencies are added")
    private List<String> tasks = new ArrayList<>();

    @Option(names = {"--sequential", "-s"}, description = "Run one task at a time instead of level by level")
    private boolean sequential;

    @Option(names = {"--resume", "-r"}, description = "Skip tasks whose outputs are up-to-date")
    private boolean resume;

    @Option(names = {"--force", "-f"}, description = "Discard recorded state and regenerate everything (wins over --resume)")
    private boolean force;

    @Option(names = {"--timeout"}, description = "Per-task completion timeout in seconds, 0 for none")
    private Integer timeoutSeconds;

    @Option(names = {"--output", "-o"}, description = "Output directory")
    private Path outputDir;

    @Option(names = {"--persona", "-p"}, description = "Persona: minimal, balanced, production")
    private String persona;

    private final RunCoordinator coordinator;
    private final PipelineProperties properties;
    private final EventBus eventBus;

    public RunCommand(RunCoordinator coordinator, PipelineProperties properties, EventBus eventBus) {
        this.coordinator = coordinator;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var request = new RunRequest(
                tasks,
                sequential ? ExecutionStrategy.SEQUENTIAL : ExecutionStrategy.PARALLEL,
                cacheMode(),
                timeoutSeconds != null ? timeoutSeconds : properties.getTimeoutSeconds(),
                outputDir != null ? outputDir : Path.of(properties.getOutputDir()),
                input,
                persona);

        var cancellation = new CancellationToken();
        var finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (finished.getCount() == 0) return;
            cancellation.cancel();
            try {
                finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "pipewright-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        var subscription = eventBus.subscribe(ConsoleOutput::event);
        try {
            ConsoleOutput.info("Output: " + request.outputDir().toAbsolutePath().normalize()
                    + " | strategy " + request.strategy().name().toLowerCase()
                    + " | cache " + request.cacheMode().name().toLowerCase());
            RunResult result = coordinator.run(request, cancellation);
            ConsoleOutput.summary(result);
            return result.success() ? 0 : 1;
        } finally {
            subscription.unsubscribe();
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutting down, shutdown hook stays registered");
            }
        }
    }

    private CacheMode cacheMode() {
        if (force) return CacheMode.FORCE;
        return resume ? CacheMode.RESUME : CacheMode.NORMAL;
    }
}
