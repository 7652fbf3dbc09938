package com.pipewright.prompt;

import com.pipewright.core.config.PipelineProperties;
import com.pipewright.core.model.TaskDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplatePayloadRendererTest {

    @TempDir
    Path dir;

    private PipelineProperties properties;
    private TemplatePayloadRenderer renderer;
    private RunContext context;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        renderer = new TemplatePayloadRenderer(properties);
        Path out = dir.resolve("out");
        context = new RunContext(dir.resolve("prd.md"), List.of(dir.resolve("prd.md"), dir.resolve("api.yaml")),
                dir, out, "production", Map.of("language", "go"), Map.of(),
                Map.of("architect", out.resolve("architecture.md"), "qa", out.resolve("test-plan.md")));
    }

    private void inline(String task, String prompt) {
        var tasks = new LinkedHashMap<>(properties.getTasks());
        var configured = new PipelineProperties.Task(tasks.get(task).getOutput(),
                tasks.get(task).getDependsOn().toArray(String[]::new));
        configured.setPrompt(prompt);
        tasks.put(task, configured);
        properties.setTasks(tasks);
    }

    @Test
    @DisplayName("Inline prompt placeholders are substituted")
    void inlinePrompt() throws Exception {
        inline("qa", "{task_name} reads {prd_path} and {dependency_outputs}, writes {output_path} as {persona}");

        String payload = renderer.render(TaskDefinition.of("qa", "test-plan.md", "architect"), context);

        assertEquals("qa reads " + dir.resolve("prd.md") + " and - architect: "
                + dir.resolve("out/architecture.md") + ", writes " + dir.resolve("out/test-plan.md")
                + " as production", payload);
    }

    @Test
    @DisplayName("Unknown placeholders are left verbatim")
    void unknownPlaceholders() throws Exception {
        inline("architect", "Keep {not_a_variable} and {input_path}");

        String payload = renderer.render(TaskDefinition.of("architect", "architecture.md"), context);

        assertEquals("Keep {not_a_variable} and " + dir.resolve("prd.md"), payload);
    }

    @Test
    @DisplayName("Prompt file is used when no inline prompt is set")
    void promptFile() throws Exception {
        Path file = Files.writeString(dir.resolve("custom.md"), "Custom for {task_name}");
        var tasks = new LinkedHashMap<>(PipelineProperties.defaultTasks());
        tasks.get("architect").setPromptFile(file.toString());
        properties.setTasks(tasks);

        assertEquals("Custom for architect",
                renderer.render(TaskDefinition.of("architect", "architecture.md"), context));
    }

    @Test
    @DisplayName("Bundled template is the default and lists all input files")
    void bundledDefault() throws Exception {
        String payload = renderer.render(TaskDefinition.of("architect", "architecture.md"), context);

        assertTrue(payload.contains("software architect"));
        assertTrue(payload.contains(dir.resolve("api.yaml").toString()));
        assertTrue(payload.contains("language: go"));
        assertFalse(payload.contains("{input_path}"));
    }

    @Test
    @DisplayName("Tasks without a bundled template fall back to the generic one")
    void genericFallback() throws Exception {
        String payload = renderer.render(TaskDefinition.of("docs", "docs.md"), context);

        assertTrue(payload.contains("You are the docs"));
        assertTrue(payload.contains(dir.resolve("out/docs.md").toString()));
    }

    @Test
    @DisplayName("Unreadable prompt file is a render error")
    void missingPromptFile() {
        var tasks = new LinkedHashMap<>(PipelineProperties.defaultTasks());
        tasks.get("qa").setPromptFile(dir.resolve("missing.md").toString());
        properties.setTasks(tasks);

        assertThrows(PayloadRenderException.class,
                () -> renderer.render(TaskDefinition.of("qa", "test-plan.md", "architect"), context));
    }

    @Test
    @DisplayName("Replacement values containing $ and backslashes are inserted literally")
    void literalReplacement() {
        assertEquals("cost: $5 \\o/", TemplatePayloadRenderer.substitute("cost: {v}", Map.of("v", "$5 \\o/")));
    }
}
