package com.pipewright.core.engine;

import com.pipewright.core.config.ConfigurationException;
import com.pipewright.core.config.PipelineProperties;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.input.DiscoveredInput;
import com.pipewright.core.input.InputDiscovery;
import com.pipewright.core.lifecycle.CancellationToken;
import com.pipewright.core.lifecycle.TaskLifecycleExecutor;
import com.pipewright.core.logging.MdcContext;
import com.pipewright.core.metrics.PipelineMetrics;
import com.pipewright.core.model.CacheMode;
import com.pipewright.core.model.ExecutionResult;
import com.pipewright.core.model.ExecutionStrategy;
import com.pipewright.core.model.FailureKind;
import com.pipewright.core.model.TaskDefinition;
import com.pipewright.core.registry.RunningTask;
import com.pipewright.core.registry.RunningTaskRegistry;
import com.pipewright.core.registry.TaskDefinitionProvider;
import com.pipewright.core.scheduler.DependencyScheduler;
import com.pipewright.core.state.RegenerationDecision;
import com.pipewright.core.state.ResumeStateStore;
import com.pipewright.prompt.PayloadRenderException;
import com.pipewright.prompt.PayloadRenderer;
import com.pipewright.prompt.RunContext;
import com.pipewright.worker.WorkerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a dependency-expanded set of tasks, sequentially or one dependency level at a time.
 *
 * <p>In {@link CacheMode#RESUME} every task first asks the {@link ResumeStateStore} whether its
 * recorded output is still valid; a valid output yields a skipped, successful result. Each
 * successful task is recorded and the state file saved immediately, so a crash mid-run keeps
 * the work already done. A failed task stops the run: sequentially at once, in parallel mode
 * after the rest of its level has finished. On cancellation every worker still registered is
 * stopped before {@link #run} returns.
 */
@Service
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    private final TaskDefinitionProvider definitions;
    private final DependencyScheduler scheduler;
    private final TaskLifecycleExecutor lifecycle;
    private final PayloadRenderer renderer;
    private final InputDiscovery inputDiscovery;
    private final RunningTaskRegistry registry;
    private final WorkerProvider workerProvider;
    private final PipelineProperties properties;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    @Autowired
    public RunCoordinator(TaskDefinitionProvider definitions, DependencyScheduler scheduler,
                          TaskLifecycleExecutor lifecycle, PayloadRenderer renderer,
                          InputDiscovery inputDiscovery, RunningTaskRegistry registry,
                          WorkerProvider workerProvider, PipelineProperties properties,
                          EventBus eventBus, @Autowired(required = false) PipelineMetrics metrics) {
        this.definitions = definitions;
        this.scheduler = scheduler;
        this.lifecycle = lifecycle;
        this.renderer = renderer;
        this.inputDiscovery = inputDiscovery;
        this.registry = registry;
        this.workerProvider = workerProvider;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Executes a run.
     *
     * @throws ConfigurationException for unknown tasks, an invalid persona, a missing input or
     *                                an unusable output directory; nothing has been started then
     */
    public RunResult run(RunRequest request, CancellationToken cancellation) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        try {
            var plan = prepare(runId, request);
            log.info("Run {} starting: {} tasks, strategy={}, cache={}",
                    runId, plan.order().size(), request.strategy(), request.cacheMode());
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, runId, null, Map.of(
                    "tasks", plan.order(),
                    "strategy", request.strategy().name(),
                    "cacheMode", request.cacheMode().name(),
                    "input", plan.input().summary())));

            var results = new ArrayList<ExecutionResult>();
            try {
                if (request.strategy() == ExecutionStrategy.SEQUENTIAL) {
                    runSequential(plan, cancellation, results);
                } else {
                    runLevels(plan, cancellation, results);
                }
            } finally {
                if (cancellation.isCancelled() || !registry.isEmpty()) {
                    stopAll();
                }
            }
            return finish(runId, plan, cancellation.isCancelled(), results);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops every worker still in the running-task registry. Safe to call concurrently with
     * task cleanup; each worker is stopped by whichever caller removes it first.
     */
    public void stopAll() {
        for (RunningTask running : registry.list()) {
            registry.remove(running.name()).ifPresent(task -> {
                log.info("Stopping worker for {} on port {}", task.name(), task.port());
                try {
                    workerProvider.stop(task.handle());
                } catch (RuntimeException e) {
                    log.warn("Failed to stop worker for {}: {}", task.name(), e.getMessage());
                }
            });
        }
    }

    private RunPlan prepare(String runId, RunRequest request) {
        List<String> requested = request.taskNames().isEmpty()
                ? definitions.taskNames()
                : request.taskNames();
        scheduler.validate(requested);
        List<String> order = scheduler.expandWithDependencies(requested);
        List<List<String>> levels = scheduler.dependencyLevels(order);

        String persona = request.persona() != null ? request.persona() : properties.getPersona();
        if (!PipelineProperties.isValidPersona(persona)) {
            throw new ConfigurationException("Invalid persona: " + persona
                    + " (valid: " + String.join(", ", PipelineProperties.VALID_PERSONAS) + ")");
        }

        Path outputDir = request.outputDir().toAbsolutePath().normalize();
        DiscoveredInput input = inputDiscovery.discover(request.inputPath(), outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create output directory " + outputDir, e);
        }

        var store = new ResumeStateStore(outputDir);
        if (request.cacheMode() == CacheMode.FORCE) {
            try {
                store.clear();
                log.info("Force mode: cleared resume state {}", store.statePath());
            } catch (IOException e) {
                log.warn("Could not delete resume state {}: {}", store.statePath(), e.getMessage());
            }
        } else {
            store.load();
        }
        try {
            store.updateInputHash(input.baseDir(), input.files());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read input files under " + input.path(), e);
        }
        store.updateConfigHash(persona, properties.getStack(), properties.getPreferences());

        var taskOutputs = new LinkedHashMap<String, Path>();
        for (String name : order) {
            taskOutputs.put(name, outputDir.resolve(definition(name).outputPath()).normalize());
        }
        var context = new RunContext(input.primaryFile(), input.files(), input.baseDir(), outputDir,
                persona, properties.getStack(), properties.getPreferences(), taskOutputs);

        return new RunPlan(runId, request, order, levels, input, store, context);
    }

    private void runSequential(RunPlan plan, CancellationToken cancellation, List<ExecutionResult> results) {
        for (String name : plan.order()) {
            if (cancellation.isCancelled()) {
                log.info("Run cancelled, not starting {}", name);
                return;
            }
            ExecutionResult result = runTask(plan, name, cancellation);
            results.add(result);
            if (!result.succeeded()) {
                log.warn("Stopping run after failure of {}", name);
                return;
            }
        }
    }

    private void runLevels(RunPlan plan, CancellationToken cancellation, List<ExecutionResult> results) {
        List<List<String>> levels = plan.levels();
        for (int i = 0; i < levels.size(); i++) {
            List<String> level = levels.get(i);
            if (cancellation.isCancelled()) {
                log.info("Run cancelled, not starting level {}", i);
                return;
            }
            final int levelIndex = i;
            MdcContext.setLevel(plan.runId(), levelIndex);
            log.info("Level {}/{}: {}", i + 1, levels.size(), level);
            eventBus.publish(PipelineEvent.of(PipelineEvent.LEVEL_STARTED, plan.runId(), null,
                    Map.of("level", i, "tasks", level)));
            if (metrics != null) {
                metrics.recordLevelExecution(level.size(), "parallel");
            }

            var levelResults = new ArrayList<ExecutionResult>();
            ExecutorService executor = Executors.newFixedThreadPool(level.size(), taskThreads(plan.runId()));
            try {
                var futures = new ArrayList<CompletableFuture<ExecutionResult>>();
                for (String name : level) {
                    futures.add(CompletableFuture.supplyAsync(() -> {
                        MdcContext.setLevel(plan.runId(), levelIndex);
                        try {
                            return runTask(plan, name, cancellation);
                        } finally {
                            MdcContext.clear();
                        }
                    }, executor));
                }
                for (var future : futures) {
                    levelResults.add(future.join());
                }
            } finally {
                executor.shutdown();
            }

            results.addAll(levelResults);
            long failed = levelResults.stream().filter(r -> !r.succeeded()).count();
            eventBus.publish(PipelineEvent.of(PipelineEvent.LEVEL_COMPLETED, plan.runId(), null,
                    Map.of("level", i, "failed", failed)));
            if (failed > 0) {
                log.warn("Level {} had {} failed task(s), aborting before level {}", i, failed, i + 1);
                return;
            }
        }
    }

    private ExecutionResult runTask(RunPlan plan, String name, CancellationToken cancellation) {
        MdcContext.setTask(plan.runId(), name);
        TaskDefinition task = definition(name);
        Path outputPath = plan.context().taskOutputs().get(name);
        try {
            if (cancellation.isCancelled()) {
                return report(plan, ExecutionResult.failed(name, outputPath, FailureKind.CANCELLED,
                        FailureKind.CANCELLED.summary(), Duration.ZERO));
            }

            ResumeStateStore store = plan.store();
            if (plan.request().cacheMode() == CacheMode.RESUME) {
                RegenerationDecision decision = store.shouldRegenerate(name, outputPath, task.dependsOn());
                if (!decision.regenerate()) {
                    log.info("Skipping {}: {}", name, decision.reason());
                    return report(plan, ExecutionResult.skipped(name, outputPath, decision.reason()));
                }
                log.info("Regenerating {}: {}", name, decision.reason());
            }

            eventBus.publish(PipelineEvent.of(PipelineEvent.TASK_STARTED, plan.runId(), name,
                    Map.of("output", outputPath.toString())));

            String payload;
            try {
                payload = renderer.render(task, plan.context());
            } catch (PayloadRenderException e) {
                return report(plan, ExecutionResult.failed(name, outputPath, FailureKind.RENDER,
                        FailureKind.RENDER.summary() + ": " + e.getMessage(), Duration.ZERO));
            }

            Files.createDirectories(outputPath.getParent());
            ExecutionResult result = lifecycle.execute(task, outputPath, payload,
                    Duration.ofSeconds(plan.request().timeoutSeconds()), cancellation,
                    (taskName, phase) -> eventBus.publish(PipelineEvent.of(PipelineEvent.TASK_PHASE,
                            plan.runId(), taskName, Map.of("phase", phase.name()))));

            if (result.succeeded()) {
                try {
                    store.recordOutput(name, outputPath, task.dependsOn());
                    store.save();
                } catch (IOException e) {
                    log.warn("Could not record output of {}: {}", name, e.getMessage());
                }
            }
            return report(plan, result);
        } catch (IOException | RuntimeException e) {
            log.error("Infrastructure error running task {}: {}", name, e.getMessage(), e);
            return report(plan, ExecutionResult.failed(name, outputPath, FailureKind.INFRASTRUCTURE,
                    FailureKind.INFRASTRUCTURE.summary() + ": " + e.getMessage(), Duration.ZERO));
        } finally {
            MdcContext.clearTask();
        }
    }

    private ExecutionResult report(RunPlan plan, ExecutionResult result) {
        String type;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("output", String.valueOf(result.outputPath()));
        payload.put("durationMs", result.duration().toMillis());
        if (result.skipped()) {
            type = PipelineEvent.TASK_SKIPPED;
            payload.put("reason", result.detail());
        } else if (result.succeeded()) {
            type = PipelineEvent.TASK_COMPLETED;
        } else {
            type = PipelineEvent.TASK_FAILED;
            payload.put("kind", result.failureKind().name());
            payload.put("error", result.error());
        }
        eventBus.publish(PipelineEvent.of(type, plan.runId(), result.task(), payload));

        if (metrics != null) {
            if (result.skipped()) {
                metrics.recordTaskSkipped(result.task());
            } else {
                String outcome = result.succeeded()
                        ? "completed"
                        : result.failureKind().name().toLowerCase(Locale.ROOT);
                metrics.recordTaskExecution(result.task(), outcome, result.duration());
            }
        }
        return result;
    }

    private RunResult finish(String runId, RunPlan plan, boolean cancelled, List<ExecutionResult> results) {
        String error = results.stream()
                .filter(r -> !r.succeeded())
                .map(r -> r.task() + ": " + r.error())
                .findFirst()
                .orElse(null);
        if (cancelled && error == null) {
            error = FailureKind.CANCELLED.summary();
        }
        boolean success = !cancelled && error == null && results.size() == plan.order().size();

        String status = cancelled ? "cancelled" : success ? "completed" : "failed";
        String type = cancelled ? PipelineEvent.RUN_CANCELLED
                : success ? PipelineEvent.RUN_COMPLETED : PipelineEvent.RUN_FAILED;
        var payload = new LinkedHashMap<String, Object>();
        payload.put("tasks", results.size());
        payload.put("failed", results.stream().filter(r -> !r.succeeded()).count());
        payload.put("skipped", results.stream().filter(ExecutionResult::skipped).count());
        if (error != null) {
            payload.put("error", error);
        }
        eventBus.publish(PipelineEvent.of(type, runId, null, payload));
        if (metrics != null) {
            metrics.recordRunResult(status);
        }
        log.info("Run {} {}: {} results", runId, status, results.size());
        return new RunResult(runId, results, success, cancelled, error);
    }

    private TaskDefinition definition(String name) {
        return definitions.find(name)
                .orElseThrow(() -> new ConfigurationException("Unknown task: " + name));
    }

    private static ThreadFactory taskThreads(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pipewright-" + runId + "-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record RunPlan(
        String runId,
        RunRequest request,
        List<String> order,
        List<List<String>> levels,
        DiscoveredInput input,
        ResumeStateStore store,
        RunContext context
    ) {}
}
