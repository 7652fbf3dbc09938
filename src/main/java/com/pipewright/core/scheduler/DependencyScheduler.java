package com.pipewright.core.scheduler;

import com.pipewright.core.config.ConfigurationException;
import com.pipewright.core.registry.TaskDefinitionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes execution order over a requested subset of tasks.
 *
 * <p>Levels are computed with Kahn's algorithm restricted to the subset: a dependency on a
 * task outside the subset is treated as already satisfied. Within a level, tasks keep the
 * order in which they were requested.
 */
@Service
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    private final TaskDefinitionProvider definitions;

    public DependencyScheduler(TaskDefinitionProvider definitions) {
        this.definitions = definitions;
    }

    /**
     * Flattened {@link #dependencyLevels}: every task appears after all of its in-subset dependencies.
     */
    public List<String> topologicalSort(List<String> names) {
        var order = new ArrayList<String>();
        dependencyLevels(names).forEach(order::addAll);
        return order;
    }

    /**
     * Groups the subset into levels. Level 0 holds tasks without in-subset dependencies;
     * every task of level {@code n} depends only on tasks of levels below {@code n}.
     *
     * @throws ConfigurationException if the subset contains a dependency cycle
     */
    public List<List<String>> dependencyLevels(List<String> names) {
        var subset = new LinkedHashSet<>(names);
        var inDegree = new LinkedHashMap<String, Integer>();
        var dependents = new LinkedHashMap<String, List<String>>();
        for (String name : subset) {
            inDegree.put(name, 0);
            dependents.put(name, new ArrayList<>());
        }
        for (String name : subset) {
            for (String dep : definitions.dependenciesOf(name)) {
                if (subset.contains(dep)) {
                    inDegree.merge(name, 1, Integer::sum);
                    dependents.get(dep).add(name);
                }
            }
        }

        var levels = new ArrayList<List<String>>();
        var current = new ArrayList<String>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) current.add(name);
        });

        int assigned = 0;
        List<String> level = current;
        while (!level.isEmpty()) {
            levels.add(List.copyOf(level));
            assigned += level.size();
            var readyNext = new HashSet<String>();
            for (String name : level) {
                for (String dependent : dependents.get(name)) {
                    if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                        readyNext.add(dependent);
                    }
                }
            }
            var next = new ArrayList<String>();
            for (String name : subset) {
                if (readyNext.contains(name)) next.add(name);
            }
            level = next;
        }

        if (assigned < subset.size()) {
            var unresolved = new ArrayList<String>();
            inDegree.forEach((name, degree) -> {
                if (degree > 0) unresolved.add(name);
            });
            throw new ConfigurationException("Dependency cycle among tasks: " + String.join(", ", unresolved));
        }

        log.debug("Dependency levels for {}: {}", names, levels);
        return levels;
    }

    /**
     * All ancestors of {@code name} over the full dependency relation, dependencies first.
     * The task itself is not included.
     */
    public List<String> transitiveDependencies(String name) {
        var ordered = new LinkedHashSet<String>();
        collect(name, new HashSet<>(), ordered);
        ordered.remove(name);
        return new ArrayList<>(ordered);
    }

    private void collect(String name, Set<String> visited, Set<String> ordered) {
        if (!visited.add(name)) return;
        for (String dep : definitions.dependenciesOf(name)) {
            collect(dep, visited, ordered);
        }
        ordered.add(name);
    }

    /**
     * The requested tasks plus everything they transitively depend on, in topological order.
     */
    public List<String> expandWithDependencies(List<String> names) {
        var expanded = new LinkedHashSet<String>();
        var visited = new HashSet<String>();
        for (String name : names) {
            collect(name, visited, expanded);
        }
        return topologicalSort(new ArrayList<>(expanded));
    }

    /**
     * @throws ConfigurationException naming the first unknown task and listing the known ones
     */
    public void validate(List<String> names) {
        Map<String, ?> known = definitions.definitions();
        for (String name : names) {
            if (!known.containsKey(name)) {
                throw new ConfigurationException("Unknown task: " + name
                        + " (available: " + String.join(", ", definitions.taskNames()) + ")");
            }
        }
    }
}
