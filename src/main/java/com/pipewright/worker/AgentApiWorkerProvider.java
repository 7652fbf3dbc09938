package com.pipewright.worker;

import com.pipewright.core.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Runs each task in a local {@code agentapi server --port <port> -- <agent>} process and
 * talks to it over {@link AgentApiClient}.
 *
 * <p>Worker stdout/stderr go to {@code <logDir>/<task>.log}.
 */
public class AgentApiWorkerProvider implements WorkerProvider {

    private static final Logger log = LoggerFactory.getLogger(AgentApiWorkerProvider.class);

    private final WorkerProperties properties;
    private final AgentApiClient client;

    public AgentApiWorkerProvider(WorkerProperties properties, AgentApiClient client) {
        this.properties = properties;
        this.client = client;
    }

    @Override
    public WorkerHandle spawn(String taskName, int port) throws WorkerException {
        var command = new ArrayList<String>();
        command.add(properties.getCommand());
        command.add("server");
        command.add("--port");
        command.add(String.valueOf(port));
        command.add("--");
        command.add(properties.getAgentCommand());
        command.addAll(properties.getAgentArgs());

        Path logFile = Path.of(properties.getLogDir()).resolve(taskName + ".log");
        try {
            Files.createDirectories(logFile.getParent());
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
            log.info("Spawned worker for {} on port {} (pid {}, log {})",
                    taskName, port, process.pid(), logFile);
            return new WorkerHandle(taskName, port, process);
        } catch (IOException e) {
            throw new WorkerException("Failed to start " + String.join(" ", command) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public WorkerStatus pollStatus(WorkerHandle handle) throws WorkerException {
        Process process = handle.process();
        if (process != null && !process.isAlive()) {
            throw new WorkerException("Worker process for " + handle.taskName()
                    + " exited with code " + process.exitValue());
        }
        return client.status(handle.port());
    }

    @Override
    public void dispatch(WorkerHandle handle, String payload) throws WorkerException {
        client.sendMessage(handle.port(), payload);
    }

    @Override
    public void stop(WorkerHandle handle) {
        Process process = handle.process();
        if (process == null) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(properties.getStopGraceSeconds(), TimeUnit.SECONDS)) {
                log.warn("Worker for {} did not exit within {}s, killing",
                        handle.taskName(), properties.getStopGraceSeconds());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("Worker for {} on port {} stopped", handle.taskName(), handle.port());
    }
}
