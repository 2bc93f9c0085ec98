package io.act.engine.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one capability call: {@code status} is {@code success} or {@code error}.
 */
public record CapabilityResult(String status, Object result, String error) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public CapabilityResult {
        if (!SUCCESS.equals(status) && !ERROR.equals(status)) {
            throw new IllegalArgumentException("Unsupported capability status: " + status);
        }
    }

    public static CapabilityResult success(Object result) {
        return new CapabilityResult(SUCCESS, result, null);
    }

    public static CapabilityResult error(String message) {
        return new CapabilityResult(ERROR, null, message == null ? "unknown error" : message);
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status);
        map.put("result", result);
        map.put("error", error);
        return map;
    }
}
