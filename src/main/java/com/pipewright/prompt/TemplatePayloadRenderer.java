package com.pipewright.prompt;

import com.pipewright.core.config.PipelineProperties;
import com.pipewright.core.model.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders payloads from prompt templates with {@code {placeholder}} substitution.
 *
 * <p>Template lookup order for a task: the inline {@code prompt} from configuration, then
 * its {@code prompt-file}, then the bundled {@code prompts/<task>.md}, then the bundled
 * {@code prompts/default.md}. Placeholders that are not recognised are left untouched.
 */
@Component
public class TemplatePayloadRenderer implements PayloadRenderer {

    private static final Logger log = LoggerFactory.getLogger(TemplatePayloadRenderer.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");
    private static final String BUNDLED_PREFIX = "prompts/";

    private final PipelineProperties properties;

    public TemplatePayloadRenderer(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public String render(TaskDefinition task, RunContext context) throws PayloadRenderException {
        String template = loadTemplate(task.name());
        return substitute(template, variables(task, context));
    }

    String loadTemplate(String taskName) throws PayloadRenderException {
        PipelineProperties.Task configured = properties.getTasks().get(taskName);
        if (configured != null && configured.getPrompt() != null && !configured.getPrompt().isBlank()) {
            return configured.getPrompt();
        }
        if (configured != null && configured.getPromptFile() != null && !configured.getPromptFile().isBlank()) {
            Path file = Path.of(configured.getPromptFile());
            try {
                return Files.readString(file);
            } catch (IOException e) {
                throw new PayloadRenderException("Cannot read prompt file " + file + " for task " + taskName, e);
            }
        }
        String bundled = readBundled(BUNDLED_PREFIX + taskName + ".md");
        if (bundled == null) {
            bundled = readBundled(BUNDLED_PREFIX + "default.md");
        }
        if (bundled == null) {
            throw new PayloadRenderException("No prompt template available for task " + taskName);
        }
        return bundled;
    }

    private static String readBundled(String resource) throws PayloadRenderException {
        try (InputStream in = TemplatePayloadRenderer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) return null;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PayloadRenderException("Cannot read bundled prompt " + resource, e);
        }
    }

    private static Map<String, String> variables(TaskDefinition task, RunContext context) {
        var vars = new HashMap<String, String>();
        String primary = context.primaryInput().toString();
        vars.put("input_path", primary);
        vars.put("prd_path", primary);
        vars.put("input_files", context.inputFiles().stream()
                .map(Path::toString)
                .collect(Collectors.joining("\n")));
        vars.put("output_dir", context.outputDir().toString());
        vars.put("task_name", task.name());
        vars.put("persona", context.persona());
        vars.put("stack", lines(context.stack()));
        vars.put("preferences", lines(context.preferences()));

        Path output = context.taskOutputs().get(task.name());
        vars.put("output_path", output != null ? output.toString() : context.outputDir().resolve(task.outputPath()).toString());

        var deps = new StringBuilder();
        for (String dep : task.dependsOn()) {
            Path depOutput = context.taskOutputs().get(dep);
            if (depOutput != null) {
                if (deps.length() > 0) deps.append('\n');
                deps.append("- ").append(dep).append(": ").append(depOutput);
            }
        }
        vars.put("dependency_outputs", deps.toString());
        return vars;
    }

    private static String lines(Map<String, String> entries) {
        return new TreeMap<>(entries).entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    static String substitute(String template, Map<String, String> vars) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            String value = vars.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        log.trace("Rendered template with {} variables", vars.size());
        return out.toString();
    }
}
