package com.pipewright.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of tasks whose workers are alive, shared by every task thread of a run.
 *
 * <p>All reads and writes go through one lock. Ports come from a counter that only
 * increases; a port is never handed out twice and is not probed for availability.
 * After every change the registry writes a name → {port, pid} snapshot so that separate
 * {@code status} and {@code stop} invocations can find the workers of an in-flight run.
 */
public class RunningTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunningTaskRegistry.class);

    public static final Path DEFAULT_SNAPSHOT =
            Path.of(System.getProperty("java.io.tmpdir"), "pipewright-running.json");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RunningTask> running = new LinkedHashMap<>();
    private final Path snapshotPath;
    private int nextPort;

    /**
     * Snapshot entry written for monitoring commands.
     *
     * @param port worker port
     * @param pid  worker process id, {@code null} when the worker has no local process
     */
    public record Entry(int port, Long pid) {}

    public RunningTaskRegistry(int basePort, Path snapshotPath) {
        this.nextPort = basePort;
        this.snapshotPath = snapshotPath;
    }

    public int allocatePort() {
        lock.lock();
        try {
            return nextPort++;
        } finally {
            lock.unlock();
        }
    }

    public void add(RunningTask task) {
        lock.lock();
        try {
            running.put(task.name(), task);
            writeSnapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a task. Only the caller that receives a non-empty result owns the cleanup
     * of that worker.
     */
    public Optional<RunningTask> remove(String name) {
        lock.lock();
        try {
            var removed = Optional.ofNullable(running.remove(name));
            if (removed.isPresent()) {
                writeSnapshot();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<RunningTask> list() {
        lock.lock();
        try {
            return new ArrayList<>(running.values());
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return running.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public Path snapshotPath() {
        return snapshotPath;
    }

    // Called with the lock held.
    private void writeSnapshot() {
        if (snapshotPath == null) return;
        var entries = new LinkedHashMap<String, Entry>();
        for (var task : running.values()) {
            entries.put(task.name(), new Entry(task.port(), task.handle() != null ? task.handle().pid() : null));
        }
        try {
            if (entries.isEmpty()) {
                Files.deleteIfExists(snapshotPath);
            } else {
                Files.createDirectories(snapshotPath.toAbsolutePath().getParent());
                MAPPER.writeValue(snapshotPath.toFile(), entries);
            }
        } catch (IOException e) {
            log.warn("Could not write running-task snapshot {}: {}", snapshotPath, e.getMessage());
        }
    }

    /**
     * Reads a snapshot written by a (possibly different) process.
     *
     * @return name → entry, empty when no snapshot exists
     */
    public static Map<String, Entry> loadSnapshot(Path path) throws IOException {
        try {
            return MAPPER.readValue(Files.readAllBytes(path), new TypeReference<LinkedHashMap<String, Entry>>() {});
        } catch (NoSuchFileException e) {
            return Map.of();
        }
    }

    public static void clearSnapshot(Path path) throws IOException {
        Files.deleteIfExists(path);
    }
}
