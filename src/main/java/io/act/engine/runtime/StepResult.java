package io.act.engine.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recorded outcome of one step in a run.
 */
public record StepResult(StepStatus status, Object result, String error, long durationMillis) {
    public StepResult {
        Objects.requireNonNull(status, "status");
    }

    public static StepResult success(Object result, long durationMillis) {
        return new StepResult(StepStatus.SUCCESS, result, null, durationMillis);
    }

    public static StepResult error(String error, long durationMillis) {
        return new StepResult(StepStatus.ERROR, null, error, durationMillis);
    }

    public static StepResult skipped(String reason) {
        return new StepResult(StepStatus.SKIPPED_DEPENDENCY_FAILED, null, reason, 0L);
    }

    public boolean succeeded() {
        return status == StepStatus.SUCCESS;
    }

    /**
     * Shape that placeholders walk: {@code status}, {@code result}, {@code error}.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status.wireName());
        map.put("result", result);
        map.put("error", error);
        return map;
    }
}
