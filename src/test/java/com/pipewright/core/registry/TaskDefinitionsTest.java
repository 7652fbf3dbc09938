package com.pipewright.core.registry;

import com.pipewright.core.config.ConfigurationException;
import com.pipewright.core.config.PipelineProperties;
import com.pipewright.core.model.TaskDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskDefinitionsTest {

    @Test
    @DisplayName("Default properties yield the five built-in tasks")
    void defaults() {
        var defs = TaskDefinitions.fromProperties(new PipelineProperties());

        assertEquals(List.of("architect", "implementer", "qa", "security", "verifier"), defs.taskNames());
        assertEquals(List.of("architect", "security"), defs.dependenciesOf("implementer"));
        assertEquals("code/.verified", defs.find("verifier").orElseThrow().outputPath());
    }

    @Test
    @DisplayName("Unknown task has no dependencies")
    void unknownTask() {
        var defs = TaskDefinitions.of(TaskDefinition.of("A", "a.md"));
        assertEquals(List.of(), defs.dependenciesOf("missing"));
        assertTrue(defs.find("missing").isEmpty());
    }

    @Test
    @DisplayName("Duplicate names are rejected")
    void duplicates() {
        assertThrows(ConfigurationException.class, () -> TaskDefinitions.of(
                TaskDefinition.of("A", "a.md"), TaskDefinition.of("A", "b.md")));
    }

    @Test
    @DisplayName("Dependency on an unknown task is rejected")
    void unknownDependency() {
        var ex = assertThrows(ConfigurationException.class, () -> TaskDefinitions.of(
                TaskDefinition.of("A", "a.md", "ghost")).validate());
        assertTrue(ex.getMessage().contains("ghost"));
    }

    @Test
    @DisplayName("Cycle is reported with its path")
    void cycle() {
        var ex = assertThrows(ConfigurationException.class, () -> TaskDefinitions.of(
                TaskDefinition.of("a", "a.md", "b"),
                TaskDefinition.of("b", "b.md", "a")).validate());
        assertEquals("Dependency cycle: a -> b -> a", ex.getMessage());
    }

    @Test
    @DisplayName("Configured task without output is rejected")
    void missingOutput() {
        var props = new PipelineProperties();
        props.setTasks(Map.of("A", new PipelineProperties.Task("")));
        assertThrows(ConfigurationException.class, () -> TaskDefinitions.fromProperties(props));
    }
}
