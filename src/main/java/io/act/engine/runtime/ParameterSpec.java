package io.act.engine.runtime;

import java.util.Objects;

public record ParameterSpec(String name, String type, boolean required, String description) {
    public ParameterSpec {
        Objects.requireNonNull(name, "name");
        type = type == null ? "any" : type;
        description = description == null ? "" : description;
    }

    public static ParameterSpec required(String name, String type, String description) {
        return new ParameterSpec(name, type, true, description);
    }

    public static ParameterSpec optional(String name, String type, String description) {
        return new ParameterSpec(name, type, false, description);
    }
}
