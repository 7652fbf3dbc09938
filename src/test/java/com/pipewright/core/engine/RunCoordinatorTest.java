package com.pipewright.core.engine;

import com.pipewright.core.config.ConfigurationException;
import com.pipewright.core.config.PipelineProperties;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.input.InputDiscovery;
import com.pipewright.core.lifecycle.CancellationToken;
import com.pipewright.core.lifecycle.PhaseListener;
import com.pipewright.core.lifecycle.TaskLifecycleExecutor;
import com.pipewright.core.metrics.PipelineMetrics;
import com.pipewright.core.model.CacheMode;
import com.pipewright.core.model.ExecutionResult;
import com.pipewright.core.model.ExecutionStrategy;
import com.pipewright.core.model.FailureKind;
import com.pipewright.core.model.TaskDefinition;
import com.pipewright.core.registry.RunningTask;
import com.pipewright.core.registry.RunningTaskRegistry;
import com.pipewright.core.registry.TaskDefinitions;
import com.pipewright.core.scheduler.DependencyScheduler;
import com.pipewright.core.state.ResumeStateStore;
import com.pipewright.prompt.TemplatePayloadRenderer;
import com.pipewright.worker.WorkerHandle;
import com.pipewright.worker.WorkerProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RunCoordinatorTest {

    /** Per-test behaviour of the mocked lifecycle; a {@code null} result falls through to the default. */
    @FunctionalInterface
    interface ExecuteHook {
        ExecutionResult apply(TaskDefinition task, Path output, CancellationToken cancellation) throws Exception;
    }

    @TempDir
    Path workDir;

    private Path inputDir;
    private Path outputDir;
    private PipelineProperties properties;
    private TaskLifecycleExecutor lifecycle;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private RunningTaskRegistry registry;
    private WorkerProvider workerProvider;
    private RunCoordinator coordinator;
    private ExecuteHook hook = (task, output, cancellation) -> null;
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private Set<String> failing = Set.of();

    @BeforeEach
    void setUp() throws Exception {
        inputDir = Files.createDirectories(workDir.resolve("input"));
        Files.writeString(inputDir.resolve("prd.md"), "# Product");
        outputDir = workDir.resolve("out");

        properties = new PipelineProperties();
        var tasks = new LinkedHashMap<String, PipelineProperties.Task>();
        tasks.put("A", new PipelineProperties.Task("a.md"));
        tasks.put("B", new PipelineProperties.Task("b.md", "A"));
        tasks.put("C", new PipelineProperties.Task("c.md", "A", "B"));
        properties.setTasks(tasks);

        lifecycle = mock(TaskLifecycleExecutor.class);
        when(lifecycle.execute(any(TaskDefinition.class), any(Path.class), anyString(), any(Duration.class),
                any(CancellationToken.class), any(PhaseListener.class))).thenAnswer(invocation -> {
            TaskDefinition task = invocation.getArgument(0);
            Path output = invocation.getArgument(1);
            executed.add(task.name());
            ExecutionResult hooked = hook.apply(task, output, invocation.getArgument(4));
            if (hooked != null) {
                return hooked;
            }
            if (failing.contains(task.name())) {
                return ExecutionResult.failed(task.name(), output, FailureKind.CRASH_DETECTED, "boom", Duration.ZERO);
            }
            Files.writeString(output, task.name() + " output");
            return ExecutionResult.completed(task.name(), output, Duration.ofMillis(5));
        });

        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        coordinator = coordinator(properties);
    }

    private RunCoordinator coordinator(PipelineProperties props) {
        var definitions = TaskDefinitions.fromProperties(props);
        registry = new RunningTaskRegistry(5000, null);
        workerProvider = mock(WorkerProvider.class);
        return new RunCoordinator(definitions, new DependencyScheduler(definitions), lifecycle,
                new TemplatePayloadRenderer(props), new InputDiscovery(),
                registry, workerProvider, props, eventBus, new PipelineMetrics(meterRegistry));
    }

    private static PipelineProperties diamond() {
        var props = new PipelineProperties();
        var tasks = new LinkedHashMap<String, PipelineProperties.Task>();
        tasks.put("A", new PipelineProperties.Task("a.md"));
        tasks.put("B", new PipelineProperties.Task("b.md", "A"));
        tasks.put("C", new PipelineProperties.Task("c.md", "A"));
        tasks.put("D", new PipelineProperties.Task("d.md", "B", "C"));
        props.setTasks(tasks);
        return props;
    }

    private RunResult run(ExecutionStrategy strategy, CacheMode mode, String... tasks) {
        return coordinator.run(new RunRequest(List.of(tasks), strategy, mode, 0, outputDir, inputDir, null),
                new CancellationToken());
    }

    private static List<String> names(RunResult result) {
        return result.results().stream().map(ExecutionResult::task).toList();
    }

    @Nested
    @DisplayName("Execution order")
    class Order {

        @Test
        @DisplayName("Sequential chain runs A, B, C in order")
        void sequentialOrder() {
            var result = run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);

            assertTrue(result.success(), result.error());
            assertEquals(List.of("A", "B", "C"), executed);
            assertEquals(3, result.succeededCount());
        }

        @Test
        @DisplayName("Requesting C alone pulls in A and B")
        void expandsDependencies() {
            var result = run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL, "C");

            assertTrue(result.success());
            assertEquals(List.of("A", "B", "C"), names(result));
        }

        @Test
        @DisplayName("Sequential stops at the first failure")
        void sequentialStopsOnFailure() {
            failing = Set.of("B");

            var result = run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);

            assertFalse(result.success());
            assertEquals(List.of("A", "B"), names(result));
            assertTrue(result.error().startsWith("B: boom"));
        }

        @Test
        @DisplayName("Parallel: failed level aborts later levels and keeps earlier results")
        void parallelAbortsAfterFailedLevel() {
            failing = Set.of("B");

            var result = run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL);

            assertFalse(result.success());
            assertEquals(List.of("A", "B"), names(result));
            assertTrue(result.results().get(0).succeeded());
            assertEquals(FailureKind.CRASH_DETECTED, result.results().get(1).failureKind());
            assertFalse(executed.contains("C"));
            assertEquals(1, result.failedCount());
        }
    }

    @Nested
    @DisplayName("Parallel levels")
    class Levels {

        @Test
        @DisplayName("A, B(A), C(A, B) runs as three single-task levels")
        void threeTaskLevels() {
            var levels = new CopyOnWriteArrayList<Object>();
            eventBus.subscribe(e -> {
                if (PipelineEvent.LEVEL_STARTED.equals(e.eventType())) levels.add(e.payload().get("tasks"));
            });

            var result = run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL);

            assertTrue(result.success());
            assertEquals(List.of(List.of("A"), List.of("B"), List.of("C")), levels);
        }

        @Test
        @DisplayName("Siblings of one level run at the same time")
        void siblingsRunConcurrently() {
            coordinator = coordinator(diamond());
            var bothStarted = new CountDownLatch(2);
            hook = (task, output, cancellation) -> {
                if (Set.of("B", "C").contains(task.name())) {
                    bothStarted.countDown();
                    if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                        return ExecutionResult.failed(task.name(), output, FailureKind.POLL_TIMEOUT,
                                "sibling never started", Duration.ZERO);
                    }
                }
                return null;
            };

            var result = run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL);

            assertTrue(result.success(), result.error());
            assertEquals(List.of("A", "B", "C", "D"), names(result));
        }

        @Test
        @DisplayName("A failed task lets its sibling finish and record, then stops before the next level")
        void failedSiblingDoesNotCancelLevel() {
            coordinator = coordinator(diamond());
            failing = Set.of("B");

            var result = run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL);

            assertFalse(result.success());
            assertEquals(List.of("A", "B", "C"), names(result));
            assertTrue(result.results().get(2).succeeded());
            assertFalse(executed.contains("D"));

            var store = new ResumeStateStore(outputDir.toAbsolutePath().normalize());
            assertTrue(store.load());
            assertEquals(Set.of("A", "C"), store.state().taskOutputs().keySet());
        }

        @Test
        @DisplayName("Cancellation mid-run stops every worker still registered")
        void cancellationStopsRemainingWorkers() {
            var handle = new WorkerHandle("B", 5001, null);
            hook = (task, output, cancellation) -> {
                if (task.name().equals("B")) {
                    registry.add(new RunningTask("B", 5001, handle, Instant.now()));
                    cancellation.cancel();
                    return ExecutionResult.failed("B", output, FailureKind.CANCELLED, "cancelled", Duration.ZERO);
                }
                return null;
            };

            var result = run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL);

            assertTrue(result.cancelled());
            assertFalse(executed.contains("C"));
            verify(workerProvider).stop(handle);
            assertTrue(registry.isEmpty());
        }
    }

    @Nested
    @DisplayName("Resume cache")
    class Resume {

        @Test
        @DisplayName("Second resumed run skips every up-to-date task")
        void skipsUpToDate() {
            run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL);
            executed.clear();

            var result = run(ExecutionStrategy.PARALLEL, CacheMode.RESUME);

            assertTrue(result.success());
            assertTrue(executed.isEmpty());
            assertEquals(3, result.skippedCount());
            assertEquals("up-to-date", result.results().get(0).detail());
        }

        @Test
        @DisplayName("Outputs nested inside the input directory do not invalidate the cache")
        void nestedOutputDirectory() {
            outputDir = inputDir.resolve("outputs");
            run(ExecutionStrategy.PARALLEL, CacheMode.RESUME);
            executed.clear();

            var result = run(ExecutionStrategy.PARALLEL, CacheMode.RESUME);

            assertEquals(List.of(), executed);
            assertEquals(3, result.skippedCount());
        }

        @Test
        @DisplayName("Deleted output is regenerated, the rest is skipped")
        void regeneratesMissingOutput() throws Exception {
            run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);
            executed.clear();
            Files.delete(outputDir.resolve("c.md"));

            var result = run(ExecutionStrategy.SEQUENTIAL, CacheMode.RESUME);

            assertTrue(result.success());
            assertEquals(List.of("C"), executed);
            assertEquals(2, result.skippedCount());
        }

        @Test
        @DisplayName("Changed input regenerates everything")
        void inputChange() throws Exception {
            run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);
            executed.clear();
            Files.writeString(inputDir.resolve("prd.md"), "# Product v2");

            run(ExecutionStrategy.SEQUENTIAL, CacheMode.RESUME);

            assertEquals(List.of("A", "B", "C"), executed);
        }

        @Test
        @DisplayName("Normal mode regenerates even when outputs are up-to-date")
        void normalAlwaysRuns() {
            run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);
            executed.clear();

            run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);

            assertEquals(List.of("A", "B", "C"), executed);
        }

        @Test
        @DisplayName("Failed task writes no record; successful ones are saved immediately")
        void recordsOnlySuccesses() {
            failing = Set.of("B");
            run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);

            var store = new ResumeStateStore(outputDir.toAbsolutePath().normalize());
            assertTrue(store.load());
            assertEquals(Set.of("A"), store.state().taskOutputs().keySet());
        }

        @Test
        @DisplayName("Force mode discards recorded state and reruns everything")
        void forceReruns() {
            run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL);
            executed.clear();

            var result = run(ExecutionStrategy.SEQUENTIAL, CacheMode.FORCE);

            assertTrue(result.success());
            assertEquals(List.of("A", "B", "C"), executed);
            assertEquals(0, result.skippedCount());
        }
    }

    @Test
    @DisplayName("Cancelled before start -> no task runs and the result is cancelled")
    void cancelledBeforeStart() {
        var token = new CancellationToken();
        token.cancel();

        var result = coordinator.run(new RunRequest(List.of(), ExecutionStrategy.PARALLEL, CacheMode.NORMAL,
                0, outputDir, inputDir, null), token);

        assertTrue(result.cancelled());
        assertFalse(result.success());
        assertTrue(executed.isEmpty());
    }

    @Test
    @DisplayName("Unknown task is rejected before anything starts")
    void unknownTask() {
        assertThrows(ConfigurationException.class, () -> run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL, "Z"));
        verifyNoInteractions(lifecycle);
    }

    @Test
    @DisplayName("Invalid persona is rejected")
    void invalidPersona() {
        assertThrows(ConfigurationException.class, () -> coordinator.run(new RunRequest(List.of(),
                ExecutionStrategy.PARALLEL, CacheMode.NORMAL, 0, outputDir, inputDir, "chaotic"),
                new CancellationToken()));
    }

    @Test
    @DisplayName("Unreadable prompt file -> RENDER failure without starting a worker")
    void renderFailure() {
        properties.getTasks().get("A").setPromptFile(workDir.resolve("missing.md").toString());

        var result = coordinator(properties).run(new RunRequest(List.of("A"), ExecutionStrategy.SEQUENTIAL,
                CacheMode.NORMAL, 0, outputDir, inputDir, null), new CancellationToken());

        assertEquals(FailureKind.RENDER, result.results().get(0).failureKind());
        assertTrue(executed.isEmpty());
    }

    @Test
    @DisplayName("Rendered payload names the task's output and its dependency outputs")
    void payloadRendered() {
        run(ExecutionStrategy.SEQUENTIAL, CacheMode.NORMAL, "B");

        verify(lifecycle).execute(argThat(t -> t != null && t.name().equals("B")), any(Path.class),
                argThat(p -> p.contains("b.md") && p.contains("- A: ")), eq(Duration.ZERO),
                any(CancellationToken.class), any(PhaseListener.class));
    }

    @Test
    @DisplayName("Publishes run and task events and records metrics")
    void eventsAndMetrics() {
        var types = new CopyOnWriteArrayList<String>();
        eventBus.subscribe(e -> types.add(e.eventType()));

        run(ExecutionStrategy.PARALLEL, CacheMode.NORMAL);

        assertEquals(PipelineEvent.RUN_STARTED, types.get(0));
        assertEquals(PipelineEvent.RUN_COMPLETED, types.get(types.size() - 1));
        assertEquals(3, types.stream().filter(PipelineEvent.TASK_COMPLETED::equals).count());
        assertEquals(3, types.stream().filter(PipelineEvent.LEVEL_STARTED::equals).count());
        assertEquals(1.0, meterRegistry.get("pipewright.runs.total").tag("status", "completed").counter().count());
        assertEquals(1, meterRegistry.get("pipewright.task.duration").tag("task", "A").timer().count());
    }
}
