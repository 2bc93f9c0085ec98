package io.act.engine.profile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a profile's {@code .operations} section.
 */
public record OperationDescriptor(String name, List<String> requiredParams, String description) {
    public OperationDescriptor {
        Objects.requireNonNull(name, "name");
        requiredParams = requiredParams == null ? List.of() : List.copyOf(requiredParams);
        description = description == null ? "" : description;
    }

    static OperationDescriptor fromValue(String name, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return new OperationDescriptor(name, List.of(), value == null ? "" : String.valueOf(value));
        }
        var required = new ArrayList<String>();
        Object raw = map.get("required_params");
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                required.add(String.valueOf(item));
            }
        } else if (raw instanceof String text) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    required.add(part.trim());
                }
            }
        }
        Object description = map.get("description");
        return new OperationDescriptor(name, required, description == null ? "" : String.valueOf(description));
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("description", description);
        map.put("required_params", requiredParams);
        return map;
    }
}
