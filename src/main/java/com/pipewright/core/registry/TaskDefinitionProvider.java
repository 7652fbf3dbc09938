package com.pipewright.core.registry;

import com.pipewright.core.model.TaskDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of the static task definitions for a run.
 */
public interface TaskDefinitionProvider {

    /**
     * All known definitions keyed by task name.
     */
    Map<String, TaskDefinition> definitions();

    default Optional<TaskDefinition> find(String name) {
        return Optional.ofNullable(definitions().get(name));
    }

    /**
     * Declared dependencies of a task, or an empty list for unknown names.
     */
    default List<String> dependenciesOf(String name) {
        return find(name).map(TaskDefinition::dependsOn).orElse(List.of());
    }

    /**
     * Task names in sorted order.
     */
    default List<String> taskNames() {
        return definitions().keySet().stream().sorted().toList();
    }
}
