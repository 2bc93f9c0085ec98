package io.act.engine.runtime;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one flow run.
 */
public record WorkflowResult(
    String flowName,
    WorkflowStatus status,
    List<String> executionOrder,
    Object output,
    Map<String, StepResult> steps,
    Duration elapsed
) {
    public WorkflowResult {
        executionOrder = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public StepResult step(String stepId) {
        return steps.get(stepId);
    }

    public Map<String, Object> toMap() {
        var context = new LinkedHashMap<String, Object>();
        steps.forEach((id, result) -> context.put(id, result.toMap()));
        var map = new LinkedHashMap<String, Object>();
        map.put("flow", flowName);
        map.put("status", status.wireName());
        map.put("execution_order", executionOrder);
        map.put("output", output);
        map.put("context", context);
        map.put("elapsed_ms", elapsed.toMillis());
        return map;
    }
}
