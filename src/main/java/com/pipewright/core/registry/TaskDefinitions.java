package com.pipewright.core.registry;

import com.pipewright.core.config.ConfigurationException;
import com.pipewright.core.config.PipelineProperties;
import com.pipewright.core.model.TaskDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory {@link TaskDefinitionProvider}.
 *
 * <p>{@link #of} only rejects duplicate names; call {@link #validate()} to also reject
 * dependencies on unknown tasks and dependency cycles.
 */
public final class TaskDefinitions implements TaskDefinitionProvider {

    private final Map<String, TaskDefinition> definitions;

    private TaskDefinitions(Map<String, TaskDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    public static TaskDefinitions of(TaskDefinition... definitions) {
        return of(List.of(definitions));
    }

    public static TaskDefinitions of(List<TaskDefinition> definitions) {
        var map = new LinkedHashMap<String, TaskDefinition>();
        for (var definition : definitions) {
            if (map.putIfAbsent(definition.name(), definition) != null) {
                throw new ConfigurationException("Duplicate task definition: " + definition.name());
            }
        }
        return new TaskDefinitions(map);
    }

    public static TaskDefinitions fromProperties(PipelineProperties properties) {
        var list = new ArrayList<TaskDefinition>();
        for (var entry : properties.getTasks().entrySet()) {
            var task = entry.getValue();
            if (task.getOutput() == null || task.getOutput().isBlank()) {
                throw new ConfigurationException("Task " + entry.getKey() + " has no output path");
            }
            list.add(new TaskDefinition(entry.getKey(), task.getOutput(), task.getDependsOn()));
        }
        return of(list).validate();
    }

    @Override
    public Map<String, TaskDefinition> definitions() {
        return definitions;
    }

    /**
     * Checks that every dependency names a known task and that the dependency relation is acyclic.
     *
     * @return this instance
     * @throws ConfigurationException naming the offending task or cycle
     */
    public TaskDefinitions validate() {
        for (var definition : definitions.values()) {
            for (var dep : definition.dependsOn()) {
                if (!definitions.containsKey(dep)) {
                    throw new ConfigurationException("Task " + definition.name()
                            + " depends on unknown task " + dep);
                }
            }
        }

        var state = new HashMap<String, Boolean>(); // false = on stack, true = done
        for (var name : definitions.keySet()) {
            detectCycle(name, state, new ArrayDeque<>());
        }
        return this;
    }

    private void detectCycle(String name, Map<String, Boolean> state, Deque<String> path) {
        Boolean seen = state.get(name);
        if (Boolean.TRUE.equals(seen)) return;
        if (Boolean.FALSE.equals(seen)) {
            var cycle = new ArrayList<String>();
            var it = path.descendingIterator();
            boolean inCycle = false;
            while (it.hasNext()) {
                String step = it.next();
                if (step.equals(name)) inCycle = true;
                if (inCycle) cycle.add(step);
            }
            cycle.add(name);
            throw new ConfigurationException("Dependency cycle: " + String.join(" -> ", cycle));
        }

        state.put(name, false);
        path.push(name);
        for (var dep : dependenciesOf(name)) {
            detectCycle(dep, state, path);
        }
        path.pop();
        state.put(name, true);
    }
}
