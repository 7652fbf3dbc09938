package com.pipewright.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@ConfigurationProperties(prefix = "pipewright.pipeline")
public class PipelineProperties {

    public static final List<String> VALID_PERSONAS = List.of("minimal", "balanced", "production");

    private String outputDir = "./outputs";
    private int timeoutSeconds = 0;
    private String persona = "balanced";
    private Map<String, String> stack = new TreeMap<>();
    private Map<String, String> preferences = new TreeMap<>();
    private Map<String, Task> tasks = new LinkedHashMap<>();

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public String getPersona() { return persona; }
    public void setPersona(String persona) { this.persona = persona; }
    public Map<String, String> getStack() { return stack; }
    public void setStack(Map<String, String> stack) { this.stack = new TreeMap<>(stack); }
    public Map<String, String> getPreferences() { return preferences; }
    public void setPreferences(Map<String, String> preferences) { this.preferences = new TreeMap<>(preferences); }
    public void setTasks(Map<String, Task> tasks) { this.tasks = new LinkedHashMap<>(tasks); }

    /**
     * Returns the configured tasks, or the built-in five-task pipeline when none are configured.
     */
    public Map<String, Task> getTasks() {
        return tasks.isEmpty() ? defaultTasks() : tasks;
    }

    public static boolean isValidPersona(String persona) {
        return persona != null && VALID_PERSONAS.contains(persona);
    }

    public static Map<String, Task> defaultTasks() {
        var defaults = new LinkedHashMap<String, Task>();
        defaults.put("architect", new Task("architecture.md"));
        defaults.put("qa", new Task("test-plan.md", "architect"));
        defaults.put("security", new Task("security-assessment.md", "architect"));
        defaults.put("implementer", new Task("code/.complete", "architect", "security"));
        defaults.put("verifier", new Task("code/.verified", "implementer", "qa"));
        return defaults;
    }

    public static class Task {
        private String output = "";
        private List<String> dependsOn = new ArrayList<>();
        private String prompt = "";
        private String promptFile = "";

        public Task() {}

        public Task(String output, String... dependsOn) {
            this.output = output;
            this.dependsOn = new ArrayList<>(List.of(dependsOn));
        }

        public String getOutput() { return output; }
        public void setOutput(String output) { this.output = output; }
        public List<String> getDependsOn() { return dependsOn; }
        public void setDependsOn(List<String> dependsOn) { this.dependsOn = dependsOn; }
        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }
        public String getPromptFile() { return promptFile; }
        public void setPromptFile(String promptFile) { this.promptFile = promptFile; }
    }
}
