package io.act.engine.runtime;

import io.act.engine.error.GraphCycleException;
import io.act.engine.flow.FlowDefinition;
import io.act.engine.flow.StepSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Dependency graph derived from placeholder references: a step depends on every step its
 * parameters reference. The execution order is topological, ties broken by declaration order.
 */
public final class StepGraph {
    private final List<String> order;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    private StepGraph(List<String> order, Map<String, Set<String>> dependencies, Map<String, Set<String>> dependents) {
        this.order = List.copyOf(order);
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    public static StepGraph build(FlowDefinition flow) {
        var steps = flow.steps();
        var index = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < steps.size(); i++) {
            index.put(steps.get(i).id(), i);
        }

        var dependencies = new LinkedHashMap<String, Set<String>>();
        var dependents = new LinkedHashMap<String, Set<String>>();
        for (StepSpec step : steps) {
            dependencies.put(step.id(), new LinkedHashSet<>());
            dependents.put(step.id(), new LinkedHashSet<>());
        }
        for (StepSpec step : steps) {
            for (String ref : PlaceholderResolver.references(step.params())) {
                if (!index.containsKey(ref)) {
                    continue;
                }
                if (ref.equals(step.id())) {
                    throw new GraphCycleException(List.of(step.id()));
                }
                dependencies.get(step.id()).add(ref);
                dependents.get(ref).add(step.id());
            }
        }

        var inDegree = new int[steps.size()];
        var ready = new PriorityQueue<Integer>();
        for (int i = 0; i < steps.size(); i++) {
            inDegree[i] = dependencies.get(steps.get(i).id()).size();
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        var order = new ArrayList<String>(steps.size());
        while (!ready.isEmpty()) {
            String id = steps.get(ready.poll()).id();
            order.add(id);
            for (String dependent : dependents.get(id)) {
                int position = index.get(dependent);
                if (--inDegree[position] == 0) {
                    ready.add(position);
                }
            }
        }
        if (order.size() < steps.size()) {
            var blocked = new ArrayList<String>();
            for (StepSpec step : steps) {
                if (!order.contains(step.id())) {
                    blocked.add(step.id());
                }
            }
            throw new GraphCycleException(blocked);
        }
        return new StepGraph(order, freeze(dependencies), freeze(dependents));
    }

    public List<String> order() {
        return order;
    }

    public Set<String> dependenciesOf(String stepId) {
        return dependencies.getOrDefault(stepId, Set.of());
    }

    public Set<String> dependentsOf(String stepId) {
        return dependents.getOrDefault(stepId, Set.of());
    }

    /**
     * Steps nothing else depends on, in execution order.
     */
    public List<String> terminalSteps() {
        var terminals = new ArrayList<String>();
        for (String id : order) {
            if (dependentsOf(id).isEmpty()) {
                terminals.add(id);
            }
        }
        return terminals;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        var copy = new LinkedHashMap<String, Set<String>>();
        source.forEach((key, value) -> copy.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(copy);
    }
}
