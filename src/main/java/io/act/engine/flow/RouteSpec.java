package io.act.engine.flow;

import java.util.List;

/**
 * An externally-triggered route declared by an {@code aci} step with {@code operation = add_route}.
 * {@code targets} are the steps wired after the route step in {@code [edges]}.
 */
public record RouteSpec(
    String stepId,
    String path,
    List<String> methods,
    String handler,
    String description,
    boolean authRequired,
    List<String> targets
) {
    public RouteSpec {
        methods = methods == null || methods.isEmpty() ? List.of("GET") : List.copyOf(methods);
        targets = targets == null ? List.of() : List.copyOf(targets);
        description = description == null ? "" : description;
    }
}
