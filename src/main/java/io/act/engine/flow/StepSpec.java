package io.act.engine.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One declared step of a flow: its id, the capability type it invokes and its raw parameters.
 * Parameter values keep their {@code {{...}}} placeholders; they are resolved per run.
 */
public record StepSpec(String id, String type, Map<String, Object> params) {
    public StepSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
