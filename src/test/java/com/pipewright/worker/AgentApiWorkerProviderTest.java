package com.pipewright.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class AgentApiWorkerProviderTest {

    @TempDir
    Path logDir;

    private WorkerProperties properties;
    private AgentApiClient client;
    private AgentApiWorkerProvider provider;

    @BeforeEach
    void setUp() {
        properties = new WorkerProperties();
        properties.setLogDir(logDir.toString());
        properties.setStopGraceSeconds(1);
        client = mock(AgentApiClient.class);
        provider = new AgentApiWorkerProvider(properties, client);
    }

    @Test
    @DisplayName("Spawn runs '<command> server --port N -- <agent>' and logs its output per task")
    void spawnBuildsCommandLine() throws Exception {
        properties.setCommand("echo");

        var handle = provider.spawn("architect", 3290);
        assertTrue(handle.process().waitFor(10, TimeUnit.SECONDS));

        assertEquals(3290, handle.port());
        assertNotNull(handle.pid());
        assertEquals("server --port 3290 -- claude", Files.readString(logDir.resolve("architect.log")).trim());
    }

    @Test
    @DisplayName("Polling a worker whose process exited fails without an HTTP call")
    void deadProcess() throws Exception {
        properties.setCommand("true");
        var handle = provider.spawn("qa", 3291);
        handle.process().waitFor(10, TimeUnit.SECONDS);

        assertThrows(WorkerException.class, () -> provider.pollStatus(handle));
        verify(client, never()).status(anyInt());
    }

    @Test
    @DisplayName("Missing executable is a spawn error")
    void missingExecutable() {
        properties.setCommand("definitely-not-an-agentapi-binary");
        assertThrows(WorkerException.class, () -> provider.spawn("qa", 3292));
    }

    @Test
    @DisplayName("Stop terminates a running process")
    void stopTerminates() throws Exception {
        var handle = new WorkerHandle("impl", 3293, new ProcessBuilder("sleep", "30").start());

        provider.stop(handle);

        assertFalse(handle.process().isAlive());
    }

    @Test
    @DisplayName("Attached workers without a process are left alone")
    void stopWithoutProcess() {
        assertDoesNotThrow(() -> provider.stop(new WorkerHandle("impl", 3294, null)));
    }
}
