package io.act.engine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run record of step outcomes. Each step id is written exactly once.
 */
public final class ExecutionContext {
    private final Map<String, Object> input;
    private final Map<String, StepResult> results = new LinkedHashMap<>();

    public ExecutionContext() {
        this(Map.of());
    }

    public ExecutionContext(Map<String, Object> input) {
        this.input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    public Map<String, Object> input() {
        return input;
    }

    public synchronized void record(String stepId, StepResult result) {
        if (results.containsKey(stepId)) {
            throw new IllegalStateException("Step already recorded: " + stepId);
        }
        results.put(stepId, result);
    }

    public synchronized Optional<StepResult> result(String stepId) {
        return Optional.ofNullable(results.get(stepId));
    }

    public synchronized boolean contains(String stepId) {
        return results.containsKey(stepId);
    }

    public synchronized List<String> recordedSteps() {
        return new ArrayList<>(results.keySet());
    }

    public synchronized Map<String, StepResult> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Step id to {@code {status, result, error}}, in recording order.
     */
    public synchronized Map<String, Object> snapshot() {
        var view = new LinkedHashMap<String, Object>();
        results.forEach((id, result) -> view.put(id, result.toMap()));
        return view;
    }
}
