package io.act.engine.error;

import java.util.List;

public final class GraphCycleException extends ActEngineException {
    private final List<String> steps;

    public GraphCycleException(List<String> steps) {
        super("graph_cycle", "Placeholder references form a cycle between steps: " + String.join(", ", steps));
        this.steps = List.copyOf(steps);
    }

    public List<String> steps() {
        return steps;
    }
}
