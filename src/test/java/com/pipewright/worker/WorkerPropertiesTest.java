package com.pipewright.worker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new WorkerProperties();
        assertEquals("agentapi", props.getCommand());
        assertEquals("claude", props.getAgentCommand());
        assertEquals("localhost", props.getHost());
        assertEquals(3284, props.getBasePort());
        assertTrue(props.getAgentArgs().isEmpty());
    }

    @Test
    void timingDefaultsAreReasonable() {
        var props = new WorkerProperties();
        assertEquals(120, props.getHealthTimeoutSeconds());
        assertEquals(120, props.getStabilizeTimeoutSeconds());
        assertEquals(500, props.getHealthPollMillis());
        assertEquals(1000, props.getPollIntervalMillis());
        assertEquals(30, props.getMaxConsecutivePollFailures());
        assertEquals(30, props.getRequestTimeoutSeconds());
        assertEquals(10, props.getStopGraceSeconds());
    }
}
