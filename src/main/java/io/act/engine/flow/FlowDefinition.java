package io.act.engine.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, parsed flow. Reloads replace the whole instance; nothing mutates a live one.
 */
public record FlowDefinition(
    String name,
    String description,
    Optional<String> startStep,
    List<StepSpec> steps,
    Map<String, Object> parameters,
    Map<String, String> env,
    Map<String, List<String>> edges,
    Map<String, Object> settings,
    Optional<AgentConfig> agent,
    Optional<DeploymentConfig> deployment,
    List<RouteSpec> routes
) {
    public static final String START_TYPE = "start";

    public FlowDefinition {
        Objects.requireNonNull(startStep, "startStep");
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(deployment, "deployment");
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        steps = steps == null ? List.of() : List.copyOf(steps);
        parameters = frozen(parameters);
        env = frozen(env);
        settings = frozen(settings);
        routes = routes == null ? List.of() : List.copyOf(routes);
        var edgeCopy = new LinkedHashMap<String, List<String>>();
        if (edges != null) {
            edges.forEach((source, targets) -> edgeCopy.put(source, List.copyOf(targets)));
        }
        edges = Collections.unmodifiableMap(edgeCopy);
    }

    public static FlowDefinition empty(String name) {
        return new FlowDefinition(name, "", Optional.empty(), List.of(), Map.of(), Map.of(), Map.of(), Map.of(),
            Optional.empty(), Optional.empty(), List.of());
    }

    public Optional<StepSpec> step(String id) {
        return steps.stream().filter(step -> step.id().equals(id)).findFirst();
    }

    public List<String> stepIds() {
        var ids = new ArrayList<String>(steps.size());
        for (var step : steps) {
            ids.add(step.id());
        }
        return ids;
    }

    public Optional<StepSpec> entryStep() {
        return startStep.flatMap(this::step);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    private static <V> Map<String, V> frozen(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
